package com.openforge.searchmate.api;

import com.openforge.searchmate.api.dto.ApiErrorResponse;
import com.openforge.searchmate.llm.LlmClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.stream.Collectors;

/**
 * Maps failures of the assistant endpoints to JSON error bodies.
 * The reasoning service being down is a bad gateway, not a server bug.
 */
@Slf4j
@RestControllerAdvice(basePackageClasses = AssistantController.class)
public class ApiExceptionHandler {

    @ExceptionHandler(LlmClient.LlmRateLimitException.class)
    public ResponseEntity<ApiErrorResponse> handleRateLimit(LlmClient.LlmRateLimitException ex) {
        log.warn("[API] Reasoning service rate limit: {}", ex.getMessage());
        return error(HttpStatus.TOO_MANY_REQUESTS, ex.getMessage());
    }

    @ExceptionHandler(LlmClient.LlmException.class)
    public ResponseEntity<ApiErrorResponse> handleLlm(LlmClient.LlmException ex) {
        log.error("[API] Reasoning service failed: {}", ex.getMessage(), ex);
        return error(HttpStatus.BAD_GATEWAY, ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiErrorResponse> handleValidation(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                .collect(Collectors.joining("; "));
        log.warn("[API] Validation failed: {}", message);
        return error(HttpStatus.BAD_REQUEST, message);
    }

    @ExceptionHandler({IllegalArgumentException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<ApiErrorResponse> handleBadRequest(Exception ex) {
        log.warn("[API] Bad request: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, ex.getMessage());
    }

    private static ResponseEntity<ApiErrorResponse> error(HttpStatus status, String message) {
        return ResponseEntity.status(status)
                .body(new ApiErrorResponse(status.value(), status.getReasonPhrase(), message));
    }
}
