package com.example.rota.exception;

import com.example.rota.common.error.ErrorLogBuffer;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private final ErrorLogBuffer errorLogBuffer;

    public GlobalExceptionHandler(ErrorLogBuffer errorLogBuffer) {
        this.errorLogBuffer = errorLogBuffer;
    }

    @ExceptionHandler(BusinessException.class)
    public ResponseEntity<ErrorResponse> handleBusinessException(BusinessException ex) {
        HttpStatus status = ex.getCategory().getStatus();
        ErrorResponse errorResponse = new ErrorResponse(
                status.getReasonPhrase(),
                ex.getErrorCode(),
                ex.getMessage(),
                null,
                LocalDateTime.now()
        );

        logger.warn("Request refused [{}]: {}", ex.getErrorCode(), ex.getMessage());
        return ResponseEntity.status(status).body(errorResponse);
    }

    @ExceptionHandler(OptimisticLockingFailureException.class)
    public ResponseEntity<ErrorResponse> handleConcurrentModification(OptimisticLockingFailureException ex) {
        ErrorResponse errorResponse = new ErrorResponse(
                HttpStatus.CONFLICT.getReasonPhrase(),
                "CONCURRENT_MODIFICATION",
                "The record was changed by another request, reload and retry",
                null,
                LocalDateTime.now()
        );

        logger.warn("Concurrent modification: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(errorResponse);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationExceptions(MethodArgumentNotValidException ex) {
        Map<String, String> errors = new LinkedHashMap<>();
        ex.getBindingResult().getAllErrors().forEach((error) -> {
            String fieldName = error instanceof FieldError fieldError ? fieldError.getField() : error.getObjectName();
            errors.putIfAbsent(fieldName, error.getDefaultMessage());
        });

        ErrorResponse errorResponse = new ErrorResponse(
                "Validation failed",
                "VALIDATION_ERROR",
                "Request contains invalid data",
                errors,
                LocalDateTime.now()
        );

        logger.warn("Validation failed: {}", errors);
        return ResponseEntity.badRequest().body(errorResponse);
    }

    @ExceptionHandler({
            IllegalArgumentException.class,
            MissingRequestHeaderException.class,
            MethodArgumentTypeMismatchException.class,
            HttpMessageNotReadableException.class
    })
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception ex) {
        ErrorResponse errorResponse = new ErrorResponse(
                "Validation failed",
                "VALIDATION_ERROR",
                ex.getMessage(),
                null,
                LocalDateTime.now()
        );

        logger.warn("Bad request: {}", ex.getMessage());
        return ResponseEntity.badRequest().body(errorResponse);
    }

    @ExceptionHandler({
            NoResourceFoundException.class,
            HttpRequestMethodNotSupportedException.class,
            HttpMediaTypeNotSupportedException.class
    })
    public ResponseEntity<ErrorResponse> handleUnroutable(Exception ex) {
        HttpStatusCode status = ((org.springframework.web.ErrorResponse) ex).getStatusCode();
        ErrorResponse errorResponse = new ErrorResponse(
                HttpStatus.valueOf(status.value()).getReasonPhrase(),
                "REQUEST_NOT_SUPPORTED",
                ex.getMessage(),
                null,
                LocalDateTime.now()
        );

        logger.warn("Unroutable request: {}", ex.getMessage());
        return ResponseEntity.status(status).body(errorResponse);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception ex, HttpServletRequest request) {
        ErrorResponse errorResponse = new ErrorResponse(
                "Internal server error",
                "INTERNAL_SERVER_ERROR",
                "An unexpected error occurred",
                null,
                LocalDateTime.now()
        );

        String target = request.getMethod() + " " + request.getRequestURI();
        logger.error("Unexpected error on {}", target, ex);
        errorLogBuffer.record(target, ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(errorResponse);
    }

    public record ErrorResponse(
            String error,
            String errorCode,
            String message,
            Map<String, String> details,
            LocalDateTime timestamp
    ) {}
}
