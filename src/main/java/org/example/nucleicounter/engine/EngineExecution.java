package org.example.nucleicounter.engine;

import java.time.Duration;

public record EngineExecution(
        Integer exitCode,
        boolean timedOut,
        boolean cancelled,
        boolean launchFailed,
        boolean detached,
        String output,
        Duration elapsed
) {

    public static EngineExecution exited(int exitCode, String output, Duration elapsed) {
        return new EngineExecution(exitCode, false, false, false, false, output, elapsed);
    }

    public static EngineExecution timedOut(String output, Duration elapsed) {
        return new EngineExecution(null, true, false, false, false, output, elapsed);
    }

    public static EngineExecution cancelled(String output, Duration elapsed) {
        return new EngineExecution(null, false, true, false, false, output, elapsed);
    }

    public static EngineExecution detached(String output, Duration elapsed) {
        return new EngineExecution(null, false, false, false, true, output, elapsed);
    }

    public static EngineExecution launchFailed(String reason) {
        return new EngineExecution(null, false, false, true, false, reason, Duration.ZERO);
    }

    public boolean cleanExit() {
        return exitCode != null && exitCode == 0;
    }
}
