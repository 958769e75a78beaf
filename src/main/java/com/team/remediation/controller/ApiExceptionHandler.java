package com.team.remediation.controller;

import com.team.remediation.exception.ApprovalNotFoundException;
import com.team.remediation.exception.InvalidTransitionException;
import com.team.remediation.exception.ProposalValidationException;
import com.team.remediation.exception.WorkflowRunNotFoundException;
import com.team.remediation.model.dto.ErrorResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.NoSuchElementException;

/**
 * Maps service exceptions to {@code {error, message}} bodies.
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(ProposalValidationException.class)
    public ResponseEntity<ErrorResponse> invalidProposal(ProposalValidationException e) {
        log.warn("Rejected proposal {}: {}", e.getProposalId(), e.getViolations());
        return ResponseEntity.badRequest()
                .body(new ErrorResponse("validation_error", e.getMessage(), e.getViolations()));
    }

    @ExceptionHandler({IllegalArgumentException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<ErrorResponse> badRequest(Exception e) {
        return ResponseEntity.badRequest().body(ErrorResponse.of("bad_request", rootMessage(e)));
    }

    @ExceptionHandler({ApprovalNotFoundException.class, WorkflowRunNotFoundException.class, NoSuchElementException.class})
    public ResponseEntity<ErrorResponse> notFound(RuntimeException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ErrorResponse.of("not_found", e.getMessage()));
    }

    @ExceptionHandler(InvalidTransitionException.class)
    public ResponseEntity<ErrorResponse> invalidTransition(InvalidTransitionException e) {
        return ResponseEntity.status(HttpStatus.CONFLICT).body(ErrorResponse.of("invalid_transition", e.getMessage()));
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ErrorResponse> conflict(IllegalStateException e) {
        return ResponseEntity.status(HttpStatus.CONFLICT).body(ErrorResponse.of("conflict", e.getMessage()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> unexpected(Exception e) {
        log.error("Unhandled API error", e);
        return ResponseEntity.internalServerError().body(ErrorResponse.of("internal_error", "Unexpected error"));
    }

    private static String rootMessage(Throwable e) {
        Throwable cause = e;
        while (cause.getCause() != null && cause.getCause() != cause) {
            cause = cause.getCause();
        }
        return cause.getMessage() != null ? cause.getMessage() : e.getMessage();
    }
}
