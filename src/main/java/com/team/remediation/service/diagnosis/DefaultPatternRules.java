package com.team.remediation.service.diagnosis;

import com.team.remediation.model.diagnosis.PatternIds;

import java.util.List;

/**
 * Built-in causal patterns, in evaluation order.
 */
public final class DefaultPatternRules {

    private DefaultPatternRules() {
    }

    public static List<PatternRule> all() {
        return List.of(
                PatternRule.keywords(PatternIds.RESOURCE_EXHAUSTION, "resource",
                        "Container exceeded its memory limit or was killed by the kernel",
                        List.of("oomkilled", "out of memory", "cannot allocate memory", "outofmemory",
                                "exit code 137", "signal: killed")),
                PatternRule.keywords(PatternIds.DEPENDENCY_UNAVAILABLE, "connectivity",
                        "A downstream dependency refused or dropped connections",
                        List.of("connection refused", "connection timed out", "no route to host", "econnrefused")),
                PatternRule.keywords(PatternIds.PERMISSION_DENIED, "security",
                        "The workload lacks permission for a file, API or resource",
                        List.of("permission denied", "forbidden", "access denied", "operation not permitted")),
                PatternRule.keywords(PatternIds.MISSING_RESOURCE, "configuration",
                        "A file, mount, secret or config map the workload needs is missing",
                        List.of("no such file", "cannot find", "file not found")),
                PatternRule.keywords(PatternIds.FATAL_CRASH, "application",
                        "The process aborted with a panic or fatal trace",
                        List.of("panic:", "fatal error", "segmentation fault", "sigsegv", "exception in thread")),
                PatternRule.keywords(PatternIds.PORT_CONFLICT, "networking",
                        "The process could not bind its listening port",
                        List.of("address already in use"))
        );
    }
}
