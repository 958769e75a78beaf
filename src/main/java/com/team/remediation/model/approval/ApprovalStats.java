package com.team.remediation.model.approval;

import java.util.Map;

public record ApprovalStats(int totalRecords,
                            Map<String, Integer> byStatus,
                            Map<String, Integer> pendingByRisk,
                            int activeWorkflows,
                            int activeSubscribers) {
}
