package com.team.remediation.model.dto;

public record ActorRequest(String actor, String feedback) {
}
