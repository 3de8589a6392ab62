package com.cred.freestyle.marketplace.api.exception;

import com.cred.freestyle.marketplace.api.dto.ErrorResponse;
import com.cred.freestyle.marketplace.exception.InvalidStateException;
import com.cred.freestyle.marketplace.exception.PermissionDeniedException;
import com.cred.freestyle.marketplace.exception.ResourceNotFoundException;
import com.cred.freestyle.marketplace.exception.TransactionReferenceConflictException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Global exception handler for the marketplace API.
 * Converts exceptions thrown by controllers into {@link ErrorResponse} bodies.
 *
 * @author Marketplace Team
 */
@ControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    /**
     * Handle ResourceNotFoundException.
     * Returns 404 NOT FOUND.
     */
    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleResourceNotFoundException(
            ResourceNotFoundException ex,
            HttpServletRequest request
    ) {
        logger.warn("Resource not found: {}", ex.getMessage());
        return notFound(ex.getMessage(), ex.getResourceType(), ex.getResourceId(), request);
    }

    /**
     * Handle PermissionDeniedException.
     * Rendered exactly like a missing resource so callers cannot discover other users' ids.
     */
    @ExceptionHandler(PermissionDeniedException.class)
    public ResponseEntity<ErrorResponse> handlePermissionDeniedException(
            PermissionDeniedException ex,
            HttpServletRequest request
    ) {
        logger.warn("Permission denied: user {} on {} {}", ex.getUserId(), ex.getResourceType(), ex.getResourceId());
        return notFound(ex.getMessage(), ex.getResourceType(), ex.getResourceId(), request);
    }

    /**
     * Handle InvalidStateException.
     * Returns 400 BAD REQUEST.
     */
    @ExceptionHandler(InvalidStateException.class)
    public ResponseEntity<ErrorResponse> handleInvalidStateException(
            InvalidStateException ex,
            HttpServletRequest request
    ) {
        logger.warn("Invalid state: {}", ex.getMessage());

        ErrorResponse error = new ErrorResponse(
                HttpStatus.BAD_REQUEST.value(),
                "Invalid State",
                ex.getMessage(),
                request.getRequestURI()
        );
        error.addDetail("resourceType", ex.getResourceType());
        error.addDetail("resourceId", ex.getResourceId());
        error.addDetail("currentStatus", ex.getCurrentStatus());

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    /**
     * Handle TransactionReferenceConflictException.
     * Returns 409 CONFLICT.
     */
    @ExceptionHandler(TransactionReferenceConflictException.class)
    public ResponseEntity<ErrorResponse> handleTransactionReferenceConflictException(
            TransactionReferenceConflictException ex,
            HttpServletRequest request
    ) {
        logger.warn("Transaction reference conflict: {}", ex.getTransactionReference());

        ErrorResponse error = new ErrorResponse(
                HttpStatus.CONFLICT.value(),
                "Conflict",
                "Could not allocate a unique transaction reference. Please retry.",
                request.getRequestURI()
        );

        return ResponseEntity.status(HttpStatus.CONFLICT).body(error);
    }

    /**
     * Handle IllegalArgumentException.
     * Returns 400 BAD REQUEST for invalid values (unknown enum values, out-of-range durations).
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgumentException(
            IllegalArgumentException ex,
            HttpServletRequest request
    ) {
        logger.warn("Illegal argument: {}", ex.getMessage());

        ErrorResponse error = new ErrorResponse(
                HttpStatus.BAD_REQUEST.value(),
                "Validation Failed",
                ex.getMessage(),
                request.getRequestURI()
        );

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    /**
     * Handle validation errors from @Valid annotation.
     * Returns 400 BAD REQUEST with field-level validation errors.
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(
            MethodArgumentNotValidException ex,
            HttpServletRequest request
    ) {
        logger.warn("Validation failed: {} field errors", ex.getBindingResult().getFieldErrorCount());

        Map<String, String> fieldErrors = new LinkedHashMap<>();
        for (FieldError error : ex.getBindingResult().getFieldErrors()) {
            fieldErrors.putIfAbsent(error.getField(), error.getDefaultMessage());
        }

        ErrorResponse error = new ErrorResponse(
                HttpStatus.BAD_REQUEST.value(),
                "Validation Failed",
                "Request validation failed. Please check the field errors.",
                request.getRequestURI()
        );
        error.addDetail("fieldErrors", fieldErrors);

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleMessageNotReadableException(
            HttpMessageNotReadableException ex,
            HttpServletRequest request
    ) {
        logger.warn("Unreadable request body: {}", ex.getMostSpecificCause().getMessage());

        ErrorResponse error = new ErrorResponse(
                HttpStatus.BAD_REQUEST.value(),
                "Validation Failed",
                "Malformed request body.",
                request.getRequestURI()
        );

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatchException(
            MethodArgumentTypeMismatchException ex,
            HttpServletRequest request
    ) {
        logger.warn("Invalid value for parameter {}: {}", ex.getName(), ex.getValue());

        ErrorResponse error = new ErrorResponse(
                HttpStatus.BAD_REQUEST.value(),
                "Validation Failed",
                String.format("Invalid value for parameter '%s'.", ex.getName()),
                request.getRequestURI()
        );
        error.addDetail("parameter", ex.getName());

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    /**
     * Handle AccessDeniedException.
     * Returns 403 FORBIDDEN.
     */
    @ExceptionHandler(AccessDeniedException.class)
    public ResponseEntity<ErrorResponse> handleAccessDeniedException(
            AccessDeniedException ex,
            HttpServletRequest request
    ) {
        logger.warn("Access denied on {}: {}", request.getRequestURI(), ex.getMessage());

        ErrorResponse error = new ErrorResponse(
                HttpStatus.FORBIDDEN.value(),
                "Forbidden",
                "You do not have permission to perform this action.",
                request.getRequestURI()
        );

        return ResponseEntity.status(HttpStatus.FORBIDDEN).body(error);
    }

    /**
     * Handle all other uncaught exceptions.
     * Returns 500 INTERNAL SERVER ERROR without internal details.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneralException(
            Exception ex,
            HttpServletRequest request
    ) {
        logger.error("Unexpected error: ", ex);

        ErrorResponse error = new ErrorResponse(
                HttpStatus.INTERNAL_SERVER_ERROR.value(),
                "Internal Server Error",
                "An unexpected error occurred. Please try again later.",
                request.getRequestURI()
        );

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
    }

    private ResponseEntity<ErrorResponse> notFound(
            String message,
            String resourceType,
            String resourceId,
            HttpServletRequest request
    ) {
        ErrorResponse error = new ErrorResponse(
                HttpStatus.NOT_FOUND.value(),
                "Not Found",
                message,
                request.getRequestURI()
        );
        error.addDetail("resourceType", resourceType);
        error.addDetail("resourceId", resourceId);

        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(error);
    }
}
