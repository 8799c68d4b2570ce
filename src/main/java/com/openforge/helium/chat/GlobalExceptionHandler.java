package com.openforge.helium.chat;

import com.openforge.helium.agent.ToolLoopExceededException;
import com.openforge.helium.llm.LlmClient;
import lombok.Builder;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.Map;

/**
 * Maps failures of the chat API onto {code, message, timestamp, details}.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @Data
    @Builder
    public static class ErrorResponse {
        private String code;
        private String message;
        private OffsetDateTime timestamp;
        private Map<String, Object> details;
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException e) {
        Map<String, String> fieldErrors = new HashMap<>();
        for (FieldError error : e.getBindingResult().getFieldErrors()) {
            fieldErrors.put(error.getField(), error.getDefaultMessage());
        }
        return respond(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", "Request validation failed",
                Map.of("fieldErrors", fieldErrors));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException e) {
        return respond(HttpStatus.BAD_REQUEST, "INVALID_ARGUMENT", e.getMessage(), null);
    }

    @ExceptionHandler(ToolLoopExceededException.class)
    public ResponseEntity<ErrorResponse> handleLoopExceeded(ToolLoopExceededException e) {
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, "TOOL_LOOP_EXCEEDED", e.getMessage(),
                Map.of("maxIterations", e.getMaxIterations(), "executions", e.getExecutions()));
    }

    @ExceptionHandler(LlmClient.LlmRateLimitException.class)
    public ResponseEntity<ErrorResponse> handleRateLimit(LlmClient.LlmRateLimitException e) {
        return respond(HttpStatus.TOO_MANY_REQUESTS, "RATE_LIMITED", e.getMessage(), null);
    }

    @ExceptionHandler(LlmClient.LlmException.class)
    public ResponseEntity<ErrorResponse> handleInference(LlmClient.LlmException e) {
        log.warn("Inference failed: {}", e.getMessage());
        return respond(HttpStatus.BAD_GATEWAY, "INFERENCE_FAILED", e.getMessage(), null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        log.error("Unhandled exception", e);
        Map<String, Object> details = new HashMap<>();
        details.put("exception", e.getClass().getSimpleName());
        if (e.getCause() != null) {
            details.put("cause", e.getCause().getMessage());
        }
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR",
                "An unexpected error occurred", details);
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, String code, String message,
                                                         Map<String, Object> details) {
        ErrorResponse error = ErrorResponse.builder()
                .code(code)
                .message(message)
                .timestamp(OffsetDateTime.now())
                .details(details)
                .build();
        return ResponseEntity.status(status).body(error);
    }
}
