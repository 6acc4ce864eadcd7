package com.example.dutyroster.exception;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationExceptions(MethodArgumentNotValidException ex) {
        Map<String, String> errors = new LinkedHashMap<>();
        ex.getBindingResult().getAllErrors().forEach((error) -> {
            String fieldName = error instanceof FieldError ? ((FieldError) error).getField() : error.getObjectName();
            errors.put(fieldName, error.getDefaultMessage());
        });

        ErrorResponse errorResponse = new ErrorResponse(
                "VALIDATION_ERROR",
                "Request body is invalid",
                errors,
                List.of(),
                LocalDateTime.now()
        );

        logger.warn("Validation failed: {}", errors);
        return ResponseEntity.badRequest().body(errorResponse);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex) {
        ErrorResponse errorResponse = new ErrorResponse(
                "MALFORMED_REQUEST",
                "Request body could not be read",
                null,
                List.of(),
                LocalDateTime.now()
        );

        logger.warn("Unreadable request body: {}", ex.getMostSpecificCause().getMessage());
        return ResponseEntity.badRequest().body(errorResponse);
    }

    @ExceptionHandler(RosterConfigurationException.class)
    public ResponseEntity<ErrorResponse> handleConfigurationException(RosterConfigurationException ex) {
        logger.warn("Roster configuration rejected: {}", ex.getMessage());
        return ResponseEntity.badRequest().body(of(ex, List.of(ex.getMessage())));
    }

    @ExceptionHandler(PinValidationException.class)
    public ResponseEntity<ErrorResponse> handlePinValidationException(PinValidationException ex) {
        logger.warn("Pin requests rejected ({} issues): {}", ex.getIssues().size(), ex.getIssues());
        return ResponseEntity.badRequest().body(of(ex, ex.getIssues()));
    }

    @ExceptionHandler(RosterCapacityException.class)
    public ResponseEntity<ErrorResponse> handleCapacityException(RosterCapacityException ex) {
        Map<String, String> details = new LinkedHashMap<>();
        details.put("totalPositions", String.valueOf(ex.getTotalPositions()));
        details.put("requiredPositions", String.valueOf(ex.getRequiredPositions()));
        ErrorResponse errorResponse = new ErrorResponse(
                ex.getErrorCode(),
                ex.getMessage(),
                details,
                List.of(ex.getMessage()),
                LocalDateTime.now()
        );

        logger.warn("Roster capacity exceeded: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(errorResponse);
    }

    @ExceptionHandler(BusinessException.class)
    public ResponseEntity<ErrorResponse> handleBusinessException(BusinessException ex) {
        logger.warn("Business error {}: {}", ex.getErrorCode(), ex.getMessage());
        return ResponseEntity.badRequest().body(of(ex, List.of(ex.getMessage())));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception ex) {
        ErrorResponse errorResponse = new ErrorResponse(
                "INTERNAL_ERROR",
                "An unexpected error occurred",
                null,
                List.of(),
                LocalDateTime.now()
        );

        logger.error("Unexpected error", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(errorResponse);
    }

    private static ErrorResponse of(BusinessException ex, List<String> issues) {
        return new ErrorResponse(ex.getErrorCode(), ex.getMessage(), null, issues, LocalDateTime.now());
    }

    public record ErrorResponse(
            String error,
            String message,
            Map<String, String> details,
            List<String> issues,
            LocalDateTime timestamp
    ) {}
}
