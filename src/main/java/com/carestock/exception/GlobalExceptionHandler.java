package com.carestock.exception;

import com.carestock.config.RequestGuardFilter;
import com.carestock.dto.ApiError;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.List;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleValidation(
            MethodArgumentNotValidException ex, HttpServletRequest request) {

        List<ApiError.FieldError> fieldErrors = ex.getBindingResult()
            .getFieldErrors()
            .stream()
            .map(fe -> ApiError.FieldError.builder()
                .field(fe.getField())
                .rejectedValue(fe.getRejectedValue())
                .message(fe.getDefaultMessage())
                .build())
            .toList();

        return build(HttpStatus.UNPROCESSABLE_ENTITY, "Validation Failed",
                     "One or more fields failed validation", request, null, fieldErrors);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ApiError> handleConstraintViolation(
            ConstraintViolationException ex, HttpServletRequest request) {

        List<ApiError.FieldError> fieldErrors = ex.getConstraintViolations()
            .stream()
            .map(cv -> ApiError.FieldError.builder()
                .field(cv.getPropertyPath().toString())
                .rejectedValue(cv.getInvalidValue())
                .message(cv.getMessage())
                .build())
            .toList();

        return build(HttpStatus.UNPROCESSABLE_ENTITY, "Validation Failed",
                     "One or more fields failed validation", request, null, fieldErrors);
    }

    @ExceptionHandler(HandlerMethodValidationException.class)
    public ResponseEntity<ApiError> handleMethodValidation(
            HandlerMethodValidationException ex, HttpServletRequest request) {
        return build(HttpStatus.UNPROCESSABLE_ENTITY, "Validation Failed",
                     "One or more parameters failed validation", request, null, null);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiError> handleTypeMismatch(
            MethodArgumentTypeMismatchException ex, HttpServletRequest request) {
        String msg = String.format("Parameter '%s' should be of type %s",
                ex.getName(), ex.getRequiredType() != null
                        ? ex.getRequiredType().getSimpleName() : "unknown");
        return build(HttpStatus.BAD_REQUEST, "Type Mismatch", msg, request, null, null);
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ApiError> handleMissingParameter(
            MissingServletRequestParameterException ex, HttpServletRequest request) {
        return build(HttpStatus.BAD_REQUEST, "Missing Parameter", ex.getMessage(), request, null, null);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiError> handleUnreadable(
            HttpMessageNotReadableException ex, HttpServletRequest request) {
        return build(HttpStatus.BAD_REQUEST, "Malformed Request",
                     "Request body could not be read", request, null, null);
    }

    @ExceptionHandler(StockValidationException.class)
    public ResponseEntity<ApiError> handleStockValidation(
            StockValidationException ex, HttpServletRequest request) {
        return build(HttpStatus.BAD_REQUEST, "Validation Error", ex.getMessage(),
                     request, ex.getErrorCode(), null);
    }

    @ExceptionHandler({ItemNotFoundException.class, RestockRequestNotFoundException.class})
    public ResponseEntity<ApiError> handleNotFound(
            CareStockException ex, HttpServletRequest request) {
        return build(HttpStatus.NOT_FOUND, "Not Found", ex.getMessage(),
                     request, ex.getErrorCode(), null);
    }

    @ExceptionHandler(DuplicateOpenRequestException.class)
    public ResponseEntity<ApiError> handleDuplicate(
            DuplicateOpenRequestException ex, HttpServletRequest request) {
        return build(HttpStatus.CONFLICT, "Duplicate Open Request", ex.getMessage(),
                     request, ex.getErrorCode(), null);
    }

    @ExceptionHandler(InvalidTransitionException.class)
    public ResponseEntity<ApiError> handleInvalidTransition(
            InvalidTransitionException ex, HttpServletRequest request) {
        return build(HttpStatus.CONFLICT, "Invalid Transition", ex.getMessage(),
                     request, ex.getErrorCode(), null);
    }

    @ExceptionHandler(TriageUnavailableException.class)
    public ResponseEntity<ApiError> handleTriageUnavailable(
            TriageUnavailableException ex, HttpServletRequest request) {
        log.error("Triage service unavailable: {}", ex.getMessage(), ex);
        return build(HttpStatus.SERVICE_UNAVAILABLE, "Triage Service Unavailable",
                     ex.getMessage(), request, ex.getErrorCode(), null);
    }

    @ExceptionHandler(TriageApiException.class)
    public ResponseEntity<ApiError> handleTriageError(
            TriageApiException ex, HttpServletRequest request) {
        log.error("Triage service error: {}", ex.getMessage());
        return build(HttpStatus.BAD_GATEWAY, "Triage Service Error",
                     ex.getMessage(), request, ex.getErrorCode(), null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGeneric(
            Exception ex, HttpServletRequest request) {
        log.error("Unhandled exception at {}: {}", request.getRequestURI(), ex.getMessage(), ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
                     "An unexpected error occurred", request, "INTERNAL_ERROR", null);
    }

    private ResponseEntity<ApiError> build(
            HttpStatus status, String error, String message,
            HttpServletRequest request, String code,
            List<ApiError.FieldError> fieldErrors) {

        ApiError body = ApiError.builder()
            .status(status.value())
            .error(error)
            .code(code)
            .message(message)
            .path(request.getRequestURI())
            .requestId(RequestGuardFilter.requestIdOf(request))
            .timestamp(Instant.now())
            .fieldErrors(fieldErrors)
            .build();

        return ResponseEntity.status(status).body(body);
    }
}
