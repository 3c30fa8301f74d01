package org.example.nucleicounter.engine;

public record ResultRecord(String identifier, String value) {
}
