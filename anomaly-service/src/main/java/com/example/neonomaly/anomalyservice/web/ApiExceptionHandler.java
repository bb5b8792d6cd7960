package com.example.neonomaly.anomalyservice.web;

import com.example.neonomaly.metricstore.exception.ConflictException;
import com.example.neonomaly.metricstore.exception.NoDataException;
import com.example.neonomaly.metricstore.exception.NotFoundException;
import com.example.neonomaly.metricstore.exception.StorageUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebInputException;

import java.util.Map;
import java.util.stream.Collectors;

/**
 * Renders store outcomes as {@code {"detail": "..."}} bodies with the matching status.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<Map<String, String>> notFound(NotFoundException e) {
        return detail(HttpStatus.NOT_FOUND, e.getMessage());
    }

    @ExceptionHandler(NoDataException.class)
    public ResponseEntity<Map<String, String>> noData(NoDataException e) {
        return detail(HttpStatus.NOT_FOUND, e.getMessage());
    }

    @ExceptionHandler(ConflictException.class)
    public ResponseEntity<Map<String, String>> conflict(ConflictException e) {
        return detail(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> invalid(IllegalArgumentException e) {
        return detail(HttpStatus.UNPROCESSABLE_ENTITY, e.getMessage());
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<Map<String, String>> invalidBody(WebExchangeBindException e) {
        String message = e.getFieldErrors().stream()
                .map(error -> error.getField() + " " + error.getDefaultMessage())
                .collect(Collectors.joining("; "));
        return detail(HttpStatus.UNPROCESSABLE_ENTITY, message);
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<Map<String, String>> unreadableBody(ServerWebInputException e) {
        return detail(HttpStatus.BAD_REQUEST, e.getReason());
    }

    @ExceptionHandler(StorageUnavailableException.class)
    public ResponseEntity<Map<String, String>> storageUnavailable(StorageUnavailableException e) {
        log.error("Storage unavailable", e);
        return detail(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage());
    }

    private static ResponseEntity<Map<String, String>> detail(HttpStatus status, String message) {
        log.debug("Request rejected with {}: {}", status.value(), message);
        return ResponseEntity.status(status).body(Map.of("detail", message != null ? message : status.getReasonPhrase()));
    }
}
