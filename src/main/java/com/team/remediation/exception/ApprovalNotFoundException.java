package com.team.remediation.exception;

import java.util.NoSuchElementException;

public class ApprovalNotFoundException extends NoSuchElementException {

    public ApprovalNotFoundException(String message) {
        super(message);
    }
}
