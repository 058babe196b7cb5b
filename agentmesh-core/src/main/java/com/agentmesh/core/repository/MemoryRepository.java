package com.agentmesh.core.repository;

import com.agentmesh.core.exception.VersionConflictException;
import com.agentmesh.core.model.MemoryEntry;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Storage SPI behind the memory manager. Keys are rendered scope keys.
 *
 * Implementations must make appends linearizable per key: concurrent appends
 * to one key receive unique, strictly increasing versions starting at 1.
 */
public interface MemoryRepository {

    /**
     * Append a new version unconditionally.
     */
    MemoryEntry append(String scopeKey, JsonNode content, boolean tombstone, Instant writtenAt);

    /**
     * Append a new version only if the latest version equals expectedVersion
     * (0 means the key must have no versions).
     *
     * @throws VersionConflictException if another version was written first
     */
    MemoryEntry appendIfVersion(String scopeKey, long expectedVersion, JsonNode content,
                                boolean tombstone, Instant writtenAt);

    Optional<MemoryEntry> findLatest(String scopeKey);

    Optional<MemoryEntry> findVersion(String scopeKey, long version);

    /**
     * All retained versions of a key, oldest first.
     */
    List<MemoryEntry> findVersions(String scopeKey);

    /**
     * Every key with at least one retained version whose rendered form starts with the prefix.
     */
    List<String> findKeys(String prefix);

    /**
     * Delete retained versions strictly older than the given version.
     * The latest version of a key is never passed here, so versions stay monotonic.
     *
     * @return number of versions removed
     */
    int deleteVersionsBefore(String scopeKey, long version);
}
