package com.team.remediation.service.approval;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically expires review records whose time-to-live has elapsed.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ApprovalExpiryScheduler {

    private final ApprovalQueue approvalQueue;

    @Scheduled(fixedDelayString = "#{@approvalConfig.expirySweepInterval.toMillis()}",
            initialDelayString = "#{@approvalConfig.expirySweepInterval.toMillis()}")
    public void sweep() {
        try {
            int expired = approvalQueue.expireDue();
            if (expired > 0) {
                log.info("Expiry sweep moved {} record(s) to expired", expired);
            }
        } catch (Exception e) {
            log.error("Approval expiry sweep failed: {}", e.getMessage(), e);
        }
    }
}
