package com.team.remediation.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Settings for the cluster the workflow inspects and remediates.
 */
@Configuration
@ConfigurationProperties(prefix = "workflow.target")
@Getter
@Setter
public class TargetSystemConfig {

    private String kubectlPath = "kubectl";

    /** Executables a remediation command may start */
    private List<String> allowedCommands = new ArrayList<>(List.of("kubectl"));

    private int commandTimeoutSeconds = 30;

    /** Container waiting reasons that mark a pod as affected */
    private List<String> unhealthyReasons = new ArrayList<>(List.of("CrashLoopBackOff", "Error", "OOMKilled"));

    private int logTailLines = 50;

    /** Log remediation commands instead of running them */
    private boolean dryRun = false;
}
