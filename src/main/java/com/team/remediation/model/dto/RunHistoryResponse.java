package com.team.remediation.model.dto;

import com.team.remediation.model.entity.RemediationRunRecord;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Recently finished runs plus counts per final status since {@code since}.
 */
public record RunHistoryResponse(Instant since, Map<String, Long> countsByStatus, List<RemediationRunRecord> runs) {
}
