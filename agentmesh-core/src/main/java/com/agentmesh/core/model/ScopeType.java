package com.agentmesh.core.model;

/**
 * Partition of the memory key space.
 */
public enum ScopeType {
    WORKFLOW("workflow"),
    AGENT("agent"),
    GLOBAL("global");

    private final String prefix;

    ScopeType(String prefix) {
        this.prefix = prefix;
    }

    public String prefix() {
        return prefix;
    }

    public static ScopeType fromPrefix(String prefix) {
        for (ScopeType type : values()) {
            if (type.prefix.equals(prefix)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown scope type: " + prefix);
    }
}
