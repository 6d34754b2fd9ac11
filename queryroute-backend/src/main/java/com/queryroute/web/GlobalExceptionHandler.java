package com.queryroute.web;

import com.queryroute.api.ErrorResponse;
import com.queryroute.catalog.SourceNotFoundException;
import com.queryroute.etl.InvalidInstructionException;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.NoHandlerFoundException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.sql.SQLException;
import java.util.stream.Collectors;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationExceptions(MethodArgumentNotValidException ex) {
        String details = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));
        return respond(HttpStatus.BAD_REQUEST, ErrorResponse.of("VALIDATION_FAILED", "Input validation failed")
                .details(details));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex) {
        return respond(HttpStatus.BAD_REQUEST, ErrorResponse.of("VALIDATION_FAILED", "Malformed request body")
                .details(ex.getMostSpecificCause().getMessage()));
    }

    @ExceptionHandler(InvalidInstructionException.class)
    public ResponseEntity<ErrorResponse> handleInvalidInstructions(InvalidInstructionException ex) {
        return respond(HttpStatus.BAD_REQUEST, ErrorResponse.of("INVALID_INSTRUCTIONS", ex.getMessage())
                .problems(ex.getProblems().isEmpty() ? null : ex.getProblems()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgumentException(IllegalArgumentException ex) {
        return respond(HttpStatus.BAD_REQUEST, ErrorResponse.of("INVALID_ARGUMENT", ex.getMessage()));
    }

    @ExceptionHandler(SourceNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleSourceNotFound(SourceNotFoundException ex) {
        return respond(HttpStatus.NOT_FOUND, ErrorResponse.of("SOURCE_NOT_FOUND", ex.getMessage()));
    }

    @ExceptionHandler(SQLException.class)
    public ResponseEntity<ErrorResponse> handleSQLException(SQLException ex) {
        log.error("Database error occurred", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, ErrorResponse.of("DATABASE_ERROR", "A database error occurred: " + ex.getErrorCode())
                .details(ex.getMessage()));
    }

    @ExceptionHandler({NoResourceFoundException.class, NoHandlerFoundException.class})
    public ResponseEntity<ErrorResponse> handleNotFoundException(Exception ex) {
        return respond(HttpStatus.NOT_FOUND, ErrorResponse.of("NOT_FOUND", "Not found")
                .details(ex.getMessage()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleAllExceptions(Exception ex) {
        log.error("Unhandled exception occurred", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, ErrorResponse.of("INTERNAL_SERVER_ERROR", "An unexpected error occurred")
                .details(ex.getMessage()));
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, ErrorResponse.ErrorResponseBuilder body) {
        return ResponseEntity.status(status)
                .body(body.status(status.value()).traceId(MDC.get(TraceIdFilter.MDC_TRACE_ID)).build());
    }
}
