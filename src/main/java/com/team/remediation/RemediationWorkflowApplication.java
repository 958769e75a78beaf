package com.team.remediation;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableAsync
@EnableScheduling
public class RemediationWorkflowApplication {

    public static void main(String[] args) {
        SpringApplication.run(RemediationWorkflowApplication.class, args);
    }
}
