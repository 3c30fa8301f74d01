package org.example.nucleicounter.model;

import org.example.nucleicounter.engine.ChannelStatus;
import org.example.nucleicounter.engine.EngineExecution;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record BatchResult(
        Map<String, ImageOutcome> outcomes,
        EngineExecution execution,
        ChannelStatus channelStatus,
        boolean engineMissing
) {

    public BatchResult {
        outcomes = Collections.unmodifiableMap(new LinkedHashMap<>(outcomes));
    }

    public static BatchResult empty() {
        return new BatchResult(Map.of(), null, null, false);
    }

    public static BatchResult engineMissing(Map<String, ImageOutcome> outcomes) {
        return new BatchResult(outcomes, null, null, true);
    }

    public int countedTotal() {
        return (int) outcomes.values().stream().filter(ImageOutcome::succeeded).count();
    }

    public int failedTotal() {
        return outcomes.size() - countedTotal();
    }

    public long nucleiTotal() {
        return outcomes.values().stream()
                .filter(ImageOutcome::succeeded)
                .mapToLong(ImageOutcome::count)
                .sum();
    }

    public boolean timedOut() {
        return execution != null && execution.timedOut();
    }

    public boolean cancelled() {
        return execution != null && execution.cancelled();
    }
}
