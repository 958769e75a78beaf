package com.team.remediation.model.proposal;

import com.fasterxml.jackson.annotation.JsonCreator;

public enum RiskLevel {
    LOW,
    MEDIUM,
    HIGH;

    @JsonCreator
    public static RiskLevel fromValue(String value) {
        if (value == null) {
            return null;
        }
        return RiskLevel.valueOf(value.trim().toUpperCase());
    }
}
