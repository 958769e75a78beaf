package com.team.remediation.model.diagnosis;

/**
 * Ids of the built-in causal patterns.
 */
public final class PatternIds {

    public static final String RESOURCE_EXHAUSTION = "resource_exhaustion";
    public static final String DEPENDENCY_UNAVAILABLE = "dependency_unavailable";
    public static final String PERMISSION_DENIED = "permission_denied";
    public static final String MISSING_RESOURCE = "missing_resource";
    public static final String FATAL_CRASH = "fatal_crash";
    public static final String PORT_CONFLICT = "port_conflict";
    public static final String UNKNOWN = "unknown";

    private PatternIds() {
    }
}
