package com.team.remediation.service.target;

public record HealthCheckResult(boolean healthy, String detail) {

    public static HealthCheckResult healthy(String detail) {
        return new HealthCheckResult(true, detail);
    }

    public static HealthCheckResult unhealthy(String detail) {
        return new HealthCheckResult(false, detail);
    }
}
