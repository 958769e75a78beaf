package com.team.remediation.model.dto;

import com.team.remediation.model.approval.Decision;

/**
 * A reviewer's verdict. {@code feedback} is optional except that it is what a needs_more_info round works from.
 */
public record DecisionRequest(Decision decision, String actor, String feedback) {
}
