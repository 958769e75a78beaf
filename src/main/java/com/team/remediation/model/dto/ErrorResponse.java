package com.team.remediation.model.dto;

import java.util.List;

public record ErrorResponse(String error, String message, List<String> violations) {

    public static ErrorResponse of(String error, String message) {
        return new ErrorResponse(error, message, List.of());
    }
}
