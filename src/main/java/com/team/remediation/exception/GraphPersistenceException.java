package com.team.remediation.exception;

public class GraphPersistenceException extends RuntimeException {

    public GraphPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
