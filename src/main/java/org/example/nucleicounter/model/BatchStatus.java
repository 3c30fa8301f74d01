package org.example.nucleicounter.model;

public enum BatchStatus {
    QUEUED,
    RUNNING,
    DONE,
    CONFIG_ERROR,
    CANCELLED,
    ERROR
}
