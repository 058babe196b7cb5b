package com.agentmesh.engine.persistence;

import com.agentmesh.core.exception.VersionConflictException;
import com.agentmesh.core.model.MemoryEntry;
import com.agentmesh.core.repository.MemoryRepository;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory implementation of MemoryRepository.
 * Each key's version list is replaced atomically inside {@link ConcurrentHashMap#compute},
 * which serializes writers per key without a global lock.
 */
@Repository
public class InMemoryMemoryRepository implements MemoryRepository {

    private final Map<String, List<MemoryEntry>> entries = new ConcurrentHashMap<>();

    @Override
    public MemoryEntry append(String scopeKey, JsonNode content, boolean tombstone, Instant writtenAt) {
        MemoryEntry[] written = new MemoryEntry[1];
        entries.compute(scopeKey, (key, versions) -> {
            List<MemoryEntry> next = versions == null ? new ArrayList<>() : new ArrayList<>(versions);
            written[0] = new MemoryEntry(key, latestVersion(versions) + 1, content, tombstone, writtenAt);
            next.add(written[0]);
            return List.copyOf(next);
        });
        return written[0];
    }

    @Override
    public MemoryEntry appendIfVersion(String scopeKey, long expectedVersion, JsonNode content,
                                       boolean tombstone, Instant writtenAt) {
        MemoryEntry[] written = new MemoryEntry[1];
        entries.compute(scopeKey, (key, versions) -> {
            long actual = latestVersion(versions);
            if (actual != expectedVersion) {
                throw new VersionConflictException(key, expectedVersion, actual);
            }
            List<MemoryEntry> next = versions == null ? new ArrayList<>() : new ArrayList<>(versions);
            written[0] = new MemoryEntry(key, actual + 1, content, tombstone, writtenAt);
            next.add(written[0]);
            return List.copyOf(next);
        });
        return written[0];
    }

    @Override
    public Optional<MemoryEntry> findLatest(String scopeKey) {
        List<MemoryEntry> versions = entries.get(scopeKey);
        if (versions == null || versions.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(versions.get(versions.size() - 1));
    }

    @Override
    public Optional<MemoryEntry> findVersion(String scopeKey, long version) {
        return entries.getOrDefault(scopeKey, List.of()).stream()
            .filter(e -> e.version() == version)
            .findFirst();
    }

    @Override
    public List<MemoryEntry> findVersions(String scopeKey) {
        return entries.getOrDefault(scopeKey, List.of());
    }

    @Override
    public List<String> findKeys(String prefix) {
        return entries.entrySet().stream()
            .filter(e -> e.getKey().startsWith(prefix) && !e.getValue().isEmpty())
            .map(Map.Entry::getKey)
            .sorted()
            .collect(Collectors.toList());
    }

    @Override
    public int deleteVersionsBefore(String scopeKey, long version) {
        int[] removed = new int[1];
        entries.computeIfPresent(scopeKey, (key, versions) -> {
            List<MemoryEntry> kept = versions.stream()
                .filter(e -> e.version() >= version)
                .collect(Collectors.toList());
            removed[0] = versions.size() - kept.size();
            return List.copyOf(kept);
        });
        return removed[0];
    }

    private static long latestVersion(List<MemoryEntry> versions) {
        return versions == null || versions.isEmpty() ? 0L : versions.get(versions.size() - 1).version();
    }
}
