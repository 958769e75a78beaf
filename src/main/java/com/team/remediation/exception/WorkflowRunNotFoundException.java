package com.team.remediation.exception;

import java.util.NoSuchElementException;

public class WorkflowRunNotFoundException extends NoSuchElementException {

    public WorkflowRunNotFoundException(String runId) {
        super("Workflow run not found: " + runId);
    }
}
