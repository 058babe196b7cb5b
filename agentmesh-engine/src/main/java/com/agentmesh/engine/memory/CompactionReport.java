package com.agentmesh.engine.memory;

/**
 * Outcome of one compaction pass.
 */
public record CompactionReport(int keysScanned, int keysCompacted, int versionsRemoved) {
}
