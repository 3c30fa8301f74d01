package org.example.nucleicounter.model;

public enum OutcomeStatus {
    COUNTED,
    FILE_NOT_FOUND,
    OPEN_FAILED,
    UNPARSED,
    NOT_IN_OUTPUT,
    ENGINE_MISSING
}
