package org.example.nucleicounter.service;

public class BatchSetupException extends RuntimeException {
    public BatchSetupException(String message, Throwable cause) {
        super(message, cause);
    }
}
