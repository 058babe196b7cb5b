package com.agentmesh.engine.coordinator;

import com.agentmesh.core.exception.NotFoundException;
import com.agentmesh.core.exception.VersionConflictException;
import com.agentmesh.core.model.MemoryEntry;
import com.agentmesh.core.model.ScopeKey;
import com.agentmesh.core.model.ScopeType;
import com.agentmesh.core.model.Workflow;
import com.agentmesh.core.model.WorkflowSpec;
import com.agentmesh.engine.memory.MemoryManager;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.UnaryOperator;

/**
 * Durable workflow state, kept in the Memory Manager under {@code workflow:<id>/checkpoint}.
 *
 * <p>Every mutation runs under the workflow's lock and is written with the version it was
 * computed from. On a {@link VersionConflictException} the latest checkpoint is re-read and the
 * mutation re-applied, so mutations must be free of side effects.</p>
 */
public class WorkflowCheckpoints {

    private static final Logger log = LoggerFactory.getLogger(WorkflowCheckpoints.class);

    public static final String CHECKPOINT = "checkpoint";
    public static final String DEFINITION = "definition";

    private final MemoryManager memory;
    private final ObjectMapper objectMapper;
    private final int conflictRetries;

    private final Map<UUID, Versioned> cache = new ConcurrentHashMap<>();
    private final Map<UUID, ReentrantLock> locks = new ConcurrentHashMap<>();

    public WorkflowCheckpoints(MemoryManager memory, ObjectMapper objectMapper, int conflictRetries) {
        this.memory = memory;
        this.objectMapper = objectMapper;
        this.conflictRetries = conflictRetries;
    }

    /**
     * Result of a checkpointed mutation.
     *
     * @param before  state the mutation was applied to
     * @param after   state now on record
     * @param version checkpoint version of {@code after}
     */
    public record Update(Workflow before, Workflow after, long version) {
        public boolean changed() {
            return before != after;
        }
    }

    /**
     * One stored checkpoint version.
     */
    public record Snapshot(long version, Instant writtenAt, Workflow workflow) {}

    private record Versioned(Workflow workflow, long version) {}

    /**
     * Write the definition and the first checkpoint of a new workflow.
     */
    public void create(Workflow workflow, WorkflowSpec definition) {
        UUID id = workflow.workflowId();
        memory.put(ScopeKey.workflow(id, DEFINITION), objectMapper.valueToTree(definition), 0);
        long version = memory.put(checkpointKey(id), objectMapper.valueToTree(workflow), 0);
        cache.put(id, new Versioned(workflow, version));
    }

    public Workflow get(UUID workflowId) {
        return current(workflowId).workflow();
    }

    public Optional<Workflow> find(UUID workflowId) {
        try {
            return Optional.of(get(workflowId));
        } catch (NotFoundException e) {
            return Optional.empty();
        }
    }

    /**
     * Workflows known to this orchestrator (those loaded or created since start).
     */
    public Collection<Workflow> all() {
        List<Workflow> workflows = new ArrayList<>();
        cache.values().forEach(v -> workflows.add(v.workflow()));
        return workflows;
    }

    /**
     * Apply a mutation and checkpoint the result. Returning the same instance skips the write.
     */
    public Update update(UUID workflowId, UnaryOperator<Workflow> mutation) {
        ReentrantLock lock = locks.computeIfAbsent(workflowId, id -> new ReentrantLock());
        lock.lock();
        try {
            Versioned current = current(workflowId);
            for (int round = 1; ; round++) {
                Workflow before = current.workflow();
                Workflow after = mutation.apply(before);
                if (after == before) {
                    return new Update(before, before, current.version());
                }
                try {
                    long version = memory.put(checkpointKey(workflowId), objectMapper.valueToTree(after),
                        current.version());
                    cache.put(workflowId, new Versioned(after, version));
                    return new Update(before, after, version);
                } catch (VersionConflictException e) {
                    if (round >= conflictRetries) {
                        throw e;
                    }
                    log.warn("Checkpoint conflict on workflow {} (round {}); re-reading", workflowId, round);
                    current = load(workflowId)
                        .orElseThrow(() -> new NotFoundException("Workflow", workflowId.toString()));
                    cache.put(workflowId, current);
                }
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Read every stored checkpoint into the cache, replacing what was there.
     *
     * @return the workflows found
     */
    public List<Workflow> reload() {
        List<Workflow> loaded = new ArrayList<>();
        for (ScopeKey key : memory.listKeys(ScopeType.WORKFLOW)) {
            if (!CHECKPOINT.equals(key.name())) {
                continue;
            }
            UUID id = UUID.fromString(key.owner());
            load(id).ifPresent(v -> {
                cache.put(id, v);
                loaded.add(v.workflow());
            });
        }
        log.info("Reloaded {} workflow checkpoints", loaded.size());
        return loaded;
    }

    /**
     * Every checkpoint version still retained for a workflow, oldest first.
     */
    public List<Snapshot> versions(UUID workflowId) {
        List<Snapshot> versions = new ArrayList<>();
        for (MemoryEntry entry : memory.listVersions(checkpointKey(workflowId))) {
            if (!entry.tombstone()) {
                versions.add(new Snapshot(entry.version(), entry.writtenAt(), read(entry)));
            }
        }
        return versions;
    }

    public static ScopeKey checkpointKey(UUID workflowId) {
        return ScopeKey.workflow(workflowId, CHECKPOINT);
    }

    // ========== Internal Methods ==========

    private Versioned current(UUID workflowId) {
        Versioned cached = cache.get(workflowId);
        if (cached != null) {
            return cached;
        }
        Versioned loaded = load(workflowId)
            .orElseThrow(() -> new NotFoundException("Workflow", workflowId.toString()));
        Versioned raced = cache.putIfAbsent(workflowId, loaded);
        return raced != null ? raced : loaded;
    }

    private Optional<Versioned> load(UUID workflowId) {
        return memory.get(checkpointKey(workflowId))
            .map(entry -> new Versioned(read(entry), entry.version()));
    }

    private Workflow read(MemoryEntry entry) {
        try {
            return objectMapper.treeToValue(entry.content(), Workflow.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unreadable checkpoint " + entry.scopeKey() + " v" + entry.version(), e);
        }
    }
}
