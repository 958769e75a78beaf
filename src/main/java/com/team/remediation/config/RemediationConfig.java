package com.team.remediation.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Workflow engine and fix generation settings.
 */
@Configuration
@ConfigurationProperties(prefix = "workflow.remediation")
@Getter
@Setter
public class RemediationConfig {

    /** Upper bound on how long a run waits for human decisions */
    private Duration approvalTimeout = Duration.ofSeconds(300);

    /** Status poll interval used alongside the event subscription */
    private Duration pollInterval = Duration.ofSeconds(5);

    /** Wait between executing an action and re-checking entity health */
    private Duration settleDelay = Duration.ofSeconds(10);

    /** Prior fixes and similarity snippets passed to the generator (each) */
    private int maxContextItems = 5;

    /** How many times an entity may loop back to diagnosis on needs_more_info */
    private int maxNeedsMoreInfoRounds = 2;

    /** Generative backend call timeout */
    private Duration generationTimeout = Duration.ofSeconds(30);

    private double temperature = 0.3;

    /** Bounds on a diagnostic bundle */
    private int maxSignals = 50;
    private int maxSignalLength = 2000;
    private int maxLogLines = 200;

    /** Finished runs kept in memory for the workflow API; older ones are dropped first */
    private int maxRetainedRuns = 500;
}
