package com.team.remediation.exception;

/**
 * The target system could not be queried, so its health is unknown.
 */
public class TargetSystemException extends RuntimeException {

    public TargetSystemException(String message) {
        super(message);
    }

    public TargetSystemException(String message, Throwable cause) {
        super(message, cause);
    }
}
