package com.agentmesh.core.exception;

/**
 * Thrown when a conditional memory write names a version that is no longer the latest.
 */
public class VersionConflictException extends AgentMeshException {

    public static final String ERROR_CODE = "VERSION_CONFLICT";

    private final String scopeKey;
    private final long expectedVersion;
    private final long actualVersion;

    public VersionConflictException(String scopeKey, long expectedVersion, long actualVersion) {
        super(ERROR_CODE, String.format(
            "Version conflict on %s: expected version %d, actual version %d",
            scopeKey, expectedVersion, actualVersion
        ));
        this.scopeKey = scopeKey;
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }

    public String getScopeKey() {
        return scopeKey;
    }

    public long getExpectedVersion() {
        return expectedVersion;
    }

    public long getActualVersion() {
        return actualVersion;
    }
}
