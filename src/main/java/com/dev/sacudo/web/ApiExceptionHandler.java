package com.dev.sacudo.web;

import com.dev.sacudo.session.SessionClosedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.stream.Collectors;

@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    static final String INPUT_ERROR = "INPUT_ERROR";
    static final String INTERNAL_ERROR = "INTERNAL_ERROR";

    @ExceptionHandler(SacudoException.class)
    public ResponseEntity<Map<String, Object>> handleSacudo(SacudoException ex) {
        HttpStatus status = statusFor(ex);
        if (status.is5xxServerError()) {
            log.warn("{}: {}", ex.getKind(), ex.getMessage());
        }
        return body(status, ex.getKind(), ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + " " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));
        return body(HttpStatus.BAD_REQUEST, INPUT_ERROR, message);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<Map<String, Object>> handleUnreadable(Exception ex) {
        return body(HttpStatus.BAD_REQUEST, INPUT_ERROR, "Malformed request");
    }

    @ExceptionHandler(CompletionException.class)
    public ResponseEntity<Map<String, Object>> handleCompletion(CompletionException ex) {
        Throwable cause = ex.getCause();
        if (cause instanceof SacudoException sacudoException) {
            return handleSacudo(sacudoException);
        }
        if (cause instanceof SessionClosedException || cause instanceof RejectedExecutionException) {
            return handleBusy((RuntimeException) cause);
        }
        return handleUnexpected(cause instanceof Exception exception ? exception : ex);
    }

    @ExceptionHandler({SessionClosedException.class, RejectedExecutionException.class})
    public ResponseEntity<Map<String, Object>> handleBusy(RuntimeException ex) {
        log.warn("Command not accepted: {}", ex.getMessage());
        return body(HttpStatus.SERVICE_UNAVAILABLE, INTERNAL_ERROR, "Guild session is busy, try again");
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnexpected(Exception ex) {
        log.error("Unexpected error", ex);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, INTERNAL_ERROR, "Unexpected error");
    }

    static HttpStatus statusFor(SacudoException ex) {
        if (ex instanceof InvalidInputException) {
            return HttpStatus.BAD_REQUEST;
        }
        if (ex instanceof InvalidStateException) {
            return HttpStatus.CONFLICT;
        }
        if (ex instanceof TransportException) {
            return HttpStatus.BAD_GATEWAY;
        }
        if (ex instanceof ResolutionException resolution) {
            return switch (resolution.getFailure()) {
                case NOT_FOUND -> HttpStatus.NOT_FOUND;
                case AUTH_REQUIRED -> HttpStatus.FORBIDDEN;
                case REGION_BLOCKED -> HttpStatus.UNAVAILABLE_FOR_LEGAL_REASONS;
                case RATE_LIMITED -> HttpStatus.TOO_MANY_REQUESTS;
                case TIMEOUT -> HttpStatus.GATEWAY_TIMEOUT;
            };
        }
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }

    private static ResponseEntity<Map<String, Object>> body(HttpStatus status, String kind, String message) {
        return ResponseEntity.status(status).body(Map.of(
                "timestamp", Instant.now().toString(),
                "status", status.value(),
                "error", status.getReasonPhrase(),
                "kind", kind,
                "message", message == null ? "" : message
        ));
    }
}
