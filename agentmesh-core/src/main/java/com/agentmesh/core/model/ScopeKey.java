package com.agentmesh.core.model;

import java.util.Objects;
import java.util.UUID;

/**
 * Address of a memory entry: a scope (workflow, agent or global), its owner and an entry name.
 *
 * <p>Rendered forms:</p>
 * <pre>
 * workflow:3f2a.../checkpoint
 * agent:writer-1/notes
 * global:pricing
 * </pre>
 */
public record ScopeKey(ScopeType type, String owner, String name) {

    public ScopeKey {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(name, "name");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Scope key name must not be blank");
        }
        if (type == ScopeType.GLOBAL) {
            owner = null;
        } else if (owner == null || owner.isBlank() || owner.contains("/")) {
            throw new IllegalArgumentException("Invalid owner for " + type + " scope: " + owner);
        }
    }

    public static ScopeKey workflow(UUID workflowId, String name) {
        return new ScopeKey(ScopeType.WORKFLOW, workflowId.toString(), name);
    }

    public static ScopeKey agent(String agentId, String name) {
        return new ScopeKey(ScopeType.AGENT, agentId, name);
    }

    public static ScopeKey global(String name) {
        return new ScopeKey(ScopeType.GLOBAL, null, name);
    }

    /**
     * Parse the rendered form produced by {@link #render()}.
     */
    public static ScopeKey parse(String rendered) {
        int colon = rendered.indexOf(':');
        if (colon < 0) {
            throw new IllegalArgumentException("Malformed scope key: " + rendered);
        }
        ScopeType type = ScopeType.fromPrefix(rendered.substring(0, colon));
        String rest = rendered.substring(colon + 1);
        if (type == ScopeType.GLOBAL) {
            return new ScopeKey(type, null, rest);
        }
        int slash = rest.indexOf('/');
        if (slash < 0) {
            throw new IllegalArgumentException("Malformed scope key: " + rendered);
        }
        return new ScopeKey(type, rest.substring(0, slash), rest.substring(slash + 1));
    }

    /**
     * Prefix shared by every rendered key of the given scope type.
     */
    public static String prefixOf(ScopeType type) {
        return type.prefix() + ":";
    }

    public String render() {
        if (type == ScopeType.GLOBAL) {
            return type.prefix() + ":" + name;
        }
        return type.prefix() + ":" + owner + "/" + name;
    }

    @Override
    public String toString() {
        return render();
    }
}
