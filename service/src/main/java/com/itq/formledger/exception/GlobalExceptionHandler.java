package com.itq.formledger.exception;

import com.itq.formledger.dto.ErrorResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.stream.Collectors;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(FormLedgerException.class)
    public ResponseEntity<ErrorResponse> handleLedger(FormLedgerException ex) {
        HttpStatus status = statusFor(ex.getCode());
        log.debug("Rejected with {}: {}", ex.getCode(), ex.getMessage());
        return ResponseEntity.status(status).body(new ErrorResponse(ex.getCode().name(), ex.getMessage()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public ErrorResponse handleValidation(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(FieldError::getDefaultMessage)
                .collect(Collectors.joining("; "));
        return new ErrorResponse("VALIDATION_ERROR", message);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public ErrorResponse handleBadArgument(IllegalArgumentException ex) {
        return new ErrorResponse("VALIDATION_ERROR", ex.getMessage());
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class})
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public ErrorResponse handleUnreadableRequest(Exception ex) {
        log.debug("Malformed request: {}", ex.getMessage());
        String message = ex instanceof HttpMessageNotReadableException
                ? "Request body is missing or not valid JSON"
                : ex.getMessage();
        return new ErrorResponse("VALIDATION_ERROR", message);
    }

    @ExceptionHandler(DataIntegrityViolationException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public ErrorResponse handleIntegrity(DataIntegrityViolationException ex) {
        log.warn("Storage rejected request data: {}", ex.getMostSpecificCause().getMessage());
        return new ErrorResponse("VALIDATION_ERROR", "Request data was rejected by storage constraints");
    }

    @ExceptionHandler(NoResourceFoundException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public ErrorResponse handleNoResource(NoResourceFoundException ex) {
        return new ErrorResponse("NOT_FOUND", "No endpoint " + ex.getResourcePath());
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    @ResponseStatus(HttpStatus.METHOD_NOT_ALLOWED)
    public ErrorResponse handleMethodNotAllowed(HttpRequestMethodNotSupportedException ex) {
        return new ErrorResponse("METHOD_NOT_ALLOWED", ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public ErrorResponse handleGeneral(Exception ex) {
        log.error("Unhandled exception", ex);
        return new ErrorResponse("INTERNAL_ERROR", "An unexpected error occurred");
    }

    static HttpStatus statusFor(ErrorCode code) {
        return switch (code) {
            case RECORD_NOT_FOUND, ADMIN_NOT_FOUND -> HttpStatus.NOT_FOUND;
            case UNAUTHORIZED_ADMIN -> HttpStatus.FORBIDDEN;
            case INVALID_SIGNATURE -> HttpStatus.UNAUTHORIZED;
            case ALREADY_INITIALIZED, NOT_INITIALIZED, FORM_ALREADY_APPROVED, ADMIN_ALREADY_EXISTS,
                 MAX_ADMINS_REACHED, CANNOT_REMOVE_LAST_ADMIN -> HttpStatus.CONFLICT;
            case EMPTY_FORM_ID, FORM_ID_TOO_LONG, METADATA_TOO_LONG, INVALID_FORM_HASH -> HttpStatus.BAD_REQUEST;
        };
    }
}
