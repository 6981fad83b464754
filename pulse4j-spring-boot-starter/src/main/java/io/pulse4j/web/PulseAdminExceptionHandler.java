package io.pulse4j.web;

import io.pulse4j.core.AlreadyRunningException;
import io.pulse4j.core.UnknownJobException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.Map;

@RestControllerAdvice(assignableTypes = SchedulerAdminController.class)
public class PulseAdminExceptionHandler {

    @ExceptionHandler(UnknownJobException.class)
    public ResponseEntity<Map<String, Object>> notFound(UnknownJobException ex) {
        return error(HttpStatus.NOT_FOUND, "unknown_job", ex.getMessage());
    }

    @ExceptionHandler(AlreadyRunningException.class)
    public ResponseEntity<Map<String, Object>> conflict(AlreadyRunningException ex) {
        return error(HttpStatus.CONFLICT, "already_running", ex.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> badRequest(IllegalArgumentException ex) {
        return error(HttpStatus.BAD_REQUEST, "bad_request", ex.getMessage());
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String reason, String message) {
        return ResponseEntity.status(status).body(Map.of(
                "status", "error",
                "reason", reason,
                "message", message == null ? "invalid_request" : message,
                "ts", Instant.now().toString()
        ));
    }
}
