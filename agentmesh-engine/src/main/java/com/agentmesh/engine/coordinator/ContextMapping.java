package com.agentmesh.engine.coordinator;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.Map;

/**
 * Moves data between a workflow's shared context and its tasks.
 *
 * <p>A task input string of the form {@code ${a.b.c}} (optionally {@code ${context.a.b.c}}) is
 * replaced by the context value at that dotted path, anywhere inside the input tree. When a task
 * succeeds, each entry of its output mapping copies the value at a result path ({@code $} for the
 * whole result) to a context path, creating intermediate objects as needed.</p>
 *
 * <p>Paths that do not resolve are logged and skipped; an unresolved input reference becomes
 * JSON null. Neither operation mutates its arguments.</p>
 */
public final class ContextMapping {

    private static final Logger log = LoggerFactory.getLogger(ContextMapping.class);

    static final String WHOLE_RESULT = "$";
    private static final String CONTEXT_PREFIX = "context.";

    private ContextMapping() {
    }

    /**
     * Substitute every {@code ${path}} reference in the input with its context value.
     */
    public static JsonNode resolve(JsonNode input, JsonNode context) {
        if (input == null) {
            return null;
        }
        if (input.isTextual()) {
            String text = input.textValue();
            if (!isReference(text)) {
                return input;
            }
            String path = text.substring(2, text.length() - 1);
            if (path.startsWith(CONTEXT_PREFIX)) {
                path = path.substring(CONTEXT_PREFIX.length());
            }
            JsonNode value = at(context, path);
            if (value == null) {
                log.warn("Failed to resolve context reference '{}'", text);
                return NullNode.getInstance();
            }
            return value.deepCopy();
        }
        if (input.isObject()) {
            ObjectNode resolved = JsonNodeFactory.instance.objectNode();
            Iterator<Map.Entry<String, JsonNode>> fields = input.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                resolved.set(field.getKey(), resolve(field.getValue(), context));
            }
            return resolved;
        }
        if (input.isArray()) {
            ArrayNode resolved = JsonNodeFactory.instance.arrayNode();
            input.forEach(element -> resolved.add(resolve(element, context)));
            return resolved;
        }
        return input;
    }

    /**
     * Copy the mapped parts of a task result into a new version of the context.
     *
     * @param mapping result path to context path
     */
    public static JsonNode applyOutputs(JsonNode context, Map<String, String> mapping, JsonNode result) {
        ObjectNode out = context != null && context.isObject()
            ? ((ObjectNode) context).deepCopy()
            : JsonNodeFactory.instance.objectNode();
        for (Map.Entry<String, String> entry : mapping.entrySet()) {
            JsonNode value = WHOLE_RESULT.equals(entry.getKey()) ? result : at(result, entry.getKey());
            if (value == null) {
                log.warn("Failed to resolve output path '{}'", entry.getKey());
                continue;
            }
            String[] parts = entry.getValue().split("\\.");
            ObjectNode parent = out;
            for (int i = 0; i < parts.length - 1; i++) {
                JsonNode child = parent.get(parts[i]);
                if (child == null || !child.isObject()) {
                    child = parent.putObject(parts[i]);
                }
                parent = (ObjectNode) child;
            }
            parent.set(parts[parts.length - 1], value.deepCopy());
        }
        return out;
    }

    // ========== Internal Methods ==========

    private static boolean isReference(String text) {
        return text.length() > 3 && text.startsWith("${") && text.endsWith("}");
    }

    /**
     * @return the node at the dotted path, or null when any segment is missing
     */
    private static JsonNode at(JsonNode root, String path) {
        JsonNode node = root;
        for (String part : path.split("\\.")) {
            if (node == null || !node.isObject()) {
                return null;
            }
            node = node.get(part);
        }
        return node;
    }
}
