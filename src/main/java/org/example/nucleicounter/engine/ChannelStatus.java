package org.example.nucleicounter.engine;

public enum ChannelStatus {
    WRITTEN,
    EMPTY,
    MISSING,
    UNREADABLE
}
