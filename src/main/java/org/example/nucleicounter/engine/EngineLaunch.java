package org.example.nucleicounter.engine;

import org.example.nucleicounter.model.RunMode;

import java.nio.file.Path;
import java.time.Duration;
import java.util.function.BooleanSupplier;

public record EngineLaunch(
        Path engine,
        Path script,
        RunMode runMode,
        Duration timeout,
        Path outputLog,
        BooleanSupplier resultsComplete,
        BooleanSupplier cancelRequested
) {
}
