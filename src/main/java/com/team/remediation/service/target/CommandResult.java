package com.team.remediation.service.target;

/**
 * Exit code and combined output of one external command.
 */
public record CommandResult(int exitCode, String output, boolean timedOut) {

    public boolean isSuccess() {
        return exitCode == 0 && !timedOut;
    }
}
