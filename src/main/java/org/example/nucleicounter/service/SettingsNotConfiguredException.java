package org.example.nucleicounter.service;

public class SettingsNotConfiguredException extends RuntimeException {
    public SettingsNotConfiguredException(String message) {
        super(message);
    }
}
