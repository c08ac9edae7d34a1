package com.eainde.research.controller;

import com.eainde.research.decompose.InsufficientScopeException;
import com.eainde.research.workflow.ResearchPipelineException;
import lombok.extern.log4j.Log4j2;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps research failures to HTTP responses. Worker failures never reach here: they end up as
 * gaps inside a normal report.
 */
@Log4j2
@RestControllerAdvice
public class ResearchExceptionHandler {

    @ExceptionHandler(InsufficientScopeException.class)
    public ResponseEntity<ErrorResponse> insufficientScope(InsufficientScopeException e) {
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                .body(new ErrorResponse("insufficient_scope", e.getMessage(), e.getSuggestion()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> invalidRequest(IllegalArgumentException e) {
        log.debug("Rejected research request: {}", e.getMessage());
        return ResponseEntity.badRequest()
                .body(new ErrorResponse("invalid_request", e.getMessage(), null));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> unreadableBody(HttpMessageNotReadableException e) {
        return ResponseEntity.badRequest()
                .body(new ErrorResponse("invalid_request", "request body is not valid JSON", null));
    }

    @ExceptionHandler(ResearchPipelineException.class)
    public ResponseEntity<ErrorResponse> pipelineFailure(ResearchPipelineException e) {
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ErrorResponse("pipeline_failure", e.getMessage(), null));
    }
}
