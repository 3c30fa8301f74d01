package org.example.nucleicounter.engine;

import java.util.List;

public record ChannelRead(ChannelStatus status, List<ResultRecord> records, int skippedLines) {

    public static ChannelRead of(ChannelStatus status) {
        return new ChannelRead(status, List.of(), 0);
    }
}
