package org.example.nucleicounter.model;

public enum RunMode {
    HEADLESS,
    INSPECT
}
