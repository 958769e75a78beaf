package com.team.remediation.exception;

/**
 * The generative backend timed out, errored, was unavailable, or returned output
 * that is not a valid fix candidate. Always recovered by the fallback rule table.
 */
public class GenerationFailedException extends RuntimeException {

    public GenerationFailedException(String message) {
        super(message);
    }

    public GenerationFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
