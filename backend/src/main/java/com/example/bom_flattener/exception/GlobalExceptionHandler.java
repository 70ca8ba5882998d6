package com.example.bom_flattener.exception;

import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.LocalDateTime;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * BOM 처리 예외 -> 일관된 에러 응답
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(UnresolvedReferenceException.class)
    public ResponseEntity<ErrorResponse> handleUnresolvedReference(
            UnresolvedReferenceException ex, HttpServletRequest request) {
        log.warn("Unresolved BOM reference: {}", ex.getMessage());
        return build(HttpStatus.NOT_FOUND, errorCode(ex), ex.getMessage(), request);
    }

    @ExceptionHandler({DuplicatePartException.class, CyclicBomException.class})
    public ResponseEntity<ErrorResponse> handleConflict(BomException ex, HttpServletRequest request) {
        log.warn("Inconsistent BOM structure: {}", ex.getMessage());
        return build(HttpStatus.CONFLICT, errorCode(ex), ex.getMessage(), request);
    }

    @ExceptionHandler(BomException.class)
    public ResponseEntity<ErrorResponse> handleBomException(BomException ex, HttpServletRequest request) {
        log.warn("Rejected BOM request: {}", ex.getMessage());
        return build(HttpStatus.BAD_REQUEST, errorCode(ex), ex.getMessage(), request);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException ex, HttpServletRequest request) {
        log.warn("Invalid argument: {}", ex.getMessage());
        return build(HttpStatus.BAD_REQUEST, "INVALID_ARGUMENT", ex.getMessage(), request);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException ex, HttpServletRequest request) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));
        log.warn("Validation failed: {}", message);
        return build(HttpStatus.BAD_REQUEST, "VALIDATION_FAILED", message, request);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException ex, HttpServletRequest request) {
        log.warn("Malformed request body: {}", ex.getMessage());
        return build(HttpStatus.BAD_REQUEST, "MALFORMED_REQUEST", "Malformed request body", request);
    }

    private static ResponseEntity<ErrorResponse> build(HttpStatus status, String errorCode, String message,
                                                       HttpServletRequest request) {
        ErrorResponse error = ErrorResponse.builder()
                .status(status.value())
                .errorCode(errorCode)
                .message(message)
                .path(request.getRequestURI())
                .timestamp(LocalDateTime.now())
                .build();

        return ResponseEntity.status(status).body(error);
    }

    // UnknownPartException -> UNKNOWN_PART
    private static String errorCode(BomException ex) {
        String name = ex.getClass().getSimpleName().replaceAll("Exception$", "");
        return name.replaceAll("([a-z])([A-Z])", "$1_$2").toUpperCase(Locale.ROOT);
    }
}
