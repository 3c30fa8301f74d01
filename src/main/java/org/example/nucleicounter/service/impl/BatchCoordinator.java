package org.example.nucleicounter.service.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.nucleicounter.engine.ChannelRead;
import org.example.nucleicounter.engine.EngineExecution;
import org.example.nucleicounter.engine.EngineLaunch;
import org.example.nucleicounter.engine.EngineProcessSupervisor;
import org.example.nucleicounter.engine.ResultChannel;
import org.example.nucleicounter.model.BatchResult;
import org.example.nucleicounter.model.EngineSettings;
import org.example.nucleicounter.model.ImageOutcome;
import org.example.nucleicounter.model.OutcomeStatus;
import org.example.nucleicounter.model.ProcessingRecipe;
import org.example.nucleicounter.model.RunMode;
import org.example.nucleicounter.script.ScriptSynthesizer;
import org.example.nucleicounter.service.BatchSetupException;
import org.example.nucleicounter.service.SettingsStore;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.BooleanSupplier;

/**
 * Runs one batch end to end: synthesize the macro, run the engine once, harvest the result
 * channel and reconcile it against the request.
 * <p>
 * The macro, result channel and engine output files live only for the duration of
 * {@link #run} and are deleted on every exit path. Per-image failures are returned as
 * outcomes; only a failure to set up the transient files raises.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BatchCoordinator {

    private final SettingsStore settingsStore;
    private final ScriptSynthesizer synthesizer;
    private final EngineProcessSupervisor supervisor;
    private final OutcomeReconciler reconciler;

    @Value("${nuclei.work-dir:${java.io.tmpdir}/nuclei-counter}")
    private String workDir;

    @Value("${engine.timeout.base:PT2M}")
    private Duration baseTimeout = Duration.ofMinutes(2);

    @Value("${engine.timeout.per-image:PT10S}")
    private Duration perImageTimeout = Duration.ofSeconds(10);

    @Value("${engine.timeout.max:PT30M}")
    private Duration maxTimeout = Duration.ofMinutes(30);

    @Value("${channel.grace:PT0.5S}")
    private Duration channelGrace = Duration.ofMillis(500);

    @Value("${channel.poll-interval:PT0.2S}")
    private Duration channelPollInterval = Duration.ofMillis(200);

    @Value("${channel.max-wait:PT5S}")
    private Duration channelMaxWait = Duration.ofSeconds(5);

    public BatchResult run(List<String> images, ProcessingRecipe recipe, RunMode runMode) {
        return run(images, recipe, runMode, () -> false);
    }

    /**
     * As {@link #run(List, ProcessingRecipe, RunMode)}, stopping the engine once
     * {@code cancelRequested} turns true. A cancel that arrives before launch skips the engine.
     */
    public BatchResult run(List<String> images, ProcessingRecipe recipe, RunMode runMode,
                           BooleanSupplier cancelRequested) {
        List<String> requested = new ArrayList<>(new LinkedHashSet<>(images));
        if (requested.isEmpty()) {
            log.info("Empty batch, engine not invoked");
            return BatchResult.empty();
        }

        Optional<Path> engine = resolveEngine();
        if (engine.isEmpty()) {
            log.error("Engine executable missing or not configured, {} image(s) not processed", requested.size());
            Map<String, ImageOutcome> outcomes =
                    reconciler.allFailed(requested, OutcomeStatus.ENGINE_MISSING, "engine executable missing");
            return BatchResult.engineMissing(outcomes);
        }

        Path dir = Paths.get(workDir);
        ResultChannel channel = null;
        Path script = null;
        Path outputLog = null;
        try {
            try {
                channel = ResultChannel.create(dir);
                script = Files.createTempFile(dir, "nuclei-batch-", ".ijm");
                outputLog = Files.createTempFile(dir, "engine-output-", ".log");
                Files.writeString(script, synthesizer.synthesize(recipe, requested, runMode, channel.path()),
                        StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new BatchSetupException("Could not create transient batch files in " + dir, e);
            }

            log.info("Batch of {} image(s), mode {}, macro {}", requested.size(), runMode, script);
            final ResultChannel results = channel;
            EngineExecution execution = supervisor.execute(new EngineLaunch(
                    engine.get(), script, runMode, timeoutFor(requested.size()), outputLog,
                    () -> results.recordCount() >= requested.size(), cancelRequested));
            logExecution(execution);

            channel.awaitSettled(requested.size(), channelGrace, channelPollInterval, channelMaxWait);
            ChannelRead read = channel.read();
            log.info("Result channel {}: {} record(s), {} skipped line(s)",
                    read.status(), read.records().size(), read.skippedLines());

            Map<String, ImageOutcome> outcomes = reconciler.reconcile(requested, read.records());
            BatchResult result = new BatchResult(outcomes, execution, read.status(), false);
            log.info("Batch finished: {} counted, {} failed", result.countedTotal(), result.failedTotal());
            return result;
        } finally {
            deleteQuietly(script, "macro");
            deleteQuietly(channel == null ? null : channel.path(), "result channel");
            deleteQuietly(outputLog, "engine output");
        }
    }

    Duration timeoutFor(int imageCount) {
        Duration timeout = baseTimeout.plus(perImageTimeout.multipliedBy(imageCount));
        return timeout.compareTo(maxTimeout) > 0 ? maxTimeout : timeout;
    }

    private Optional<Path> resolveEngine() {
        String configured = settingsStore.load().map(EngineSettings::getEnginePath).orElse(null);
        if (configured == null || configured.isBlank()) {
            return Optional.empty();
        }
        try {
            Path path = Paths.get(configured);
            if (Files.isRegularFile(path)) {
                return Optional.of(path);
            }
            log.error("Engine executable not found: {}", path);
        } catch (InvalidPathException e) {
            log.error("Invalid engine path '{}': {}", configured, e.getMessage());
        }
        return Optional.empty();
    }

    private static void logExecution(EngineExecution execution) {
        if (execution.launchFailed()) {
            log.error("Engine launch failed: {}", execution.output());
        } else if (execution.timedOut()) {
            log.warn("Engine timed out after {}, harvesting partial results", execution.elapsed());
        } else if (execution.cancelled()) {
            log.warn("Engine cancelled after {}, harvesting partial results", execution.elapsed());
        } else if (execution.detached()) {
            log.info("Engine left running after {}", execution.elapsed());
        } else if (!execution.cleanExit()) {
            log.warn("Engine exited with code {} after {}", execution.exitCode(), execution.elapsed());
        }
        if (log.isDebugEnabled() && execution.output() != null && !execution.output().isBlank()) {
            log.debug("Engine output:\n{}", execution.output());
        }
    }

    private static void deleteQuietly(Path path, String label) {
        if (path == null) {
            return;
        }
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warn("Could not delete transient {} file {}: {}", label, path, e.toString());
        }
    }
}
