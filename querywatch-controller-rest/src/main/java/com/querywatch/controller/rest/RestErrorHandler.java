package com.querywatch.controller.rest;

import com.querywatch.service.core.error.LogStoreException;
import com.querywatch.service.core.error.QueryLogNotFoundException;
import com.querywatch.service.core.error.SchemaDriftException;
import com.querywatch.service.core.error.ValidationException;
import java.time.Instant;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.ServletWebRequest;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Global REST exception mapper. Every failure leaves as an {@link ErrorPayload}; store and drift
 * details stay in the server log.
 */
@RestControllerAdvice
@Slf4j
public class RestErrorHandler {

    static final String INVALID_PARAMETERS = ValidationException.INVALID_PARAMETERS;
    static final String NOT_FOUND = "not_found";
    static final String DATABASE_ERROR = "database_error";
    static final String SCHEMA_DRIFT = "schema_drift";

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ErrorPayload> handleValidation(ValidationException ex, WebRequest request) {
        log.debug("Rejected request ({}): {}", ex.kind(), ex.getMessage());
        return build(HttpStatus.BAD_REQUEST, ex.kind(), ex.getMessage(), request);
    }

    @ExceptionHandler({MissingServletRequestParameterException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorPayload> handleBadParameter(Exception ex, WebRequest request) {
        log.debug("Rejected request parameter: {}", ex.getMessage());
        return build(HttpStatus.BAD_REQUEST, INVALID_PARAMETERS, ex.getMessage(), request);
    }

    @ExceptionHandler(QueryLogNotFoundException.class)
    public ResponseEntity<ErrorPayload> handleNotFound(QueryLogNotFoundException ex, WebRequest request) {
        return build(HttpStatus.NOT_FOUND, NOT_FOUND, ex.getMessage(), request);
    }

    @ExceptionHandler(LogStoreException.class)
    public ResponseEntity<ErrorPayload> handleStore(LogStoreException ex, WebRequest request) {
        return build(HttpStatus.INTERNAL_SERVER_ERROR, DATABASE_ERROR, ex.operation().publicMessage(), request);
    }

    @ExceptionHandler(SchemaDriftException.class)
    public ResponseEntity<ErrorPayload> handleDrift(SchemaDriftException ex, WebRequest request) {
        log.error("Query log schema drift: {}", ex.getMessage());
        return build(
                HttpStatus.INTERNAL_SERVER_ERROR,
                SCHEMA_DRIFT,
                "Stored query log does not match the expected column types",
                request);
    }

    private ResponseEntity<ErrorPayload> build(HttpStatus status, String error, String message, WebRequest request) {
        String path = null;
        if (request instanceof ServletWebRequest servletRequest) {
            path = servletRequest.getRequest().getRequestURI();
        }
        return ResponseEntity.status(status).body(new ErrorPayload(error, message, path, Instant.now()));
    }
}
