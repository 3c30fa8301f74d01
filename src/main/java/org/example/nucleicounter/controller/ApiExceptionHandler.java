package org.example.nucleicounter.controller;

import lombok.extern.slf4j.Slf4j;
import org.example.nucleicounter.service.BatchSetupException;
import org.example.nucleicounter.service.SettingsNotConfiguredException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;
import java.util.NoSuchElementException;

@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(SettingsNotConfiguredException.class)
    public ResponseEntity<Map<String, String>> notConfigured(SettingsNotConfiguredException e) {
        return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", e.getMessage()));
    }

    @ExceptionHandler(NoSuchElementException.class)
    public ResponseEntity<Map<String, String>> notFound(NoSuchElementException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", String.valueOf(e.getMessage())));
    }

    @ExceptionHandler(BatchSetupException.class)
    public ResponseEntity<Map<String, String>> setupFailed(BatchSetupException e) {
        log.error("Batch setup failed", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(Map.of("error", e.getMessage()));
    }
}
