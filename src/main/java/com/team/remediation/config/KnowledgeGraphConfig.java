package com.team.remediation.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "workflow.knowledge-graph")
@Getter
@Setter
public class KnowledgeGraphConfig {

    private boolean persistenceEnabled = true;

    /** Snapshot file location */
    private String path = "data/knowledge-graph.json";

    /** Seed base knowledge when the loaded graph is empty */
    private boolean seedOnEmpty = true;
}
