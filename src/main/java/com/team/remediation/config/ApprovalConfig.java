package com.team.remediation.config;

import com.team.remediation.model.proposal.RiskLevel;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
@ConfigurationProperties(prefix = "workflow.approval")
@Getter
@Setter
public class ApprovalConfig {

    /** Time-to-live of an undecided or unexecuted record, by risk */
    private Duration ttlLow = Duration.ofHours(24);
    private Duration ttlMedium = Duration.ofHours(4);
    private Duration ttlHigh = Duration.ofHours(1);

    private Duration expirySweepInterval = Duration.ofSeconds(30);

    /** Keep-alive period of the per-workflow event stream */
    private Duration keepAliveInterval = Duration.ofSeconds(15);

    public Duration ttlFor(RiskLevel risk) {
        if (risk == null) {
            return ttlMedium;
        }
        return switch (risk) {
            case HIGH -> ttlHigh;
            case MEDIUM -> ttlMedium;
            case LOW -> ttlLow;
        };
    }
}
