package com.agentmesh.core.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * One version of a memory entry. Versions start at 1 and strictly increase per key.
 * A tombstone version marks the key deleted; its content is null.
 */
public record MemoryEntry(
    String scopeKey,
    long version,
    JsonNode content,
    boolean tombstone,
    Instant writtenAt
) {
}
