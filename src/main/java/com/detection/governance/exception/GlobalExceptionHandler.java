package com.detection.governance.exception;

import com.detection.governance.dto.ErrorResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Maps governance errors onto HTTP statuses with a uniform JSON body.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(ContentItemNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(ContentItemNotFoundException ex) {
        log.debug("Not found: {}", ex.getMessage());
        return respond(HttpStatus.NOT_FOUND, "Not found", ex.getMessage(), null);
    }

    @ExceptionHandler(PreconditionFailedException.class)
    public ResponseEntity<ErrorResponse> handlePreconditionFailed(PreconditionFailedException ex) {
        log.warn("Precondition failed: {}", ex.getMessage());
        return respond(HttpStatus.CONFLICT, "Precondition failed", ex.getMessage(), null);
    }

    @ExceptionHandler(CycleDetectedException.class)
    public ResponseEntity<ErrorResponse> handleCycle(CycleDetectedException ex) {
        log.warn("Cycle detected: {}", ex.getCycle());
        return respond(HttpStatus.CONFLICT, "Cycle detected", ex.getMessage(), ex.getCycle());
    }

    @ExceptionHandler(InvalidTransitionException.class)
    public ResponseEntity<ErrorResponse> handleInvalidTransition(InvalidTransitionException ex) {
        log.warn("Invalid transition: {}", ex.getMessage());
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, "Invalid transition", ex.getMessage(), null);
    }

    @ExceptionHandler(StoreWriteException.class)
    public ResponseEntity<ErrorResponse> handleStoreWrite(StoreWriteException ex) {
        log.error("Store write failed: {}", ex.getMessage(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Store write failed",
                "The change could not be saved and was rolled back", null);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(FieldError::getDefaultMessage)
                .collect(Collectors.joining("; "));
        return respond(HttpStatus.BAD_REQUEST, "Validation failed", message, null);
    }

    @ExceptionHandler({IllegalArgumentException.class, MissingRequestHeaderException.class,
            HttpMessageNotReadableException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception ex) {
        log.debug("Bad request: {}", ex.getMessage());
        String message = ex instanceof HttpMessageNotReadableException
                ? "Malformed request body"
                : ex.getMessage();
        return respond(HttpStatus.BAD_REQUEST, "Bad request", message, null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnhandled(Exception ex) {
        log.error("Unhandled exception", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error", null, null);
    }

    private ResponseEntity<ErrorResponse> respond(HttpStatus status, String error, String message, List<String> cycle) {
        return ResponseEntity.status(status).body(ErrorResponse.builder()
                .error(error)
                .message(message)
                .cycle(cycle)
                .timestamp(Instant.now())
                .build());
    }
}
