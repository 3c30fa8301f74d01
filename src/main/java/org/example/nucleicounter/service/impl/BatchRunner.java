package org.example.nucleicounter.service.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.nucleicounter.engine.EngineExecution;
import org.example.nucleicounter.model.BatchResult;
import org.example.nucleicounter.model.BatchSession;
import org.example.nucleicounter.model.BatchStatus;
import org.example.nucleicounter.model.ProcessingRecipe;
import org.example.nucleicounter.model.RunMode;
import org.example.nucleicounter.repository.BatchSessionRepository;
import org.example.nucleicounter.service.HistoryService;
import org.example.nucleicounter.service.SettingsStore;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Executes queued batch sessions on the single engine worker thread and records the outcome
 * on the session, in its log file and in the history ledger.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BatchRunner {

    private final BatchSessionRepository repo;
    private final BatchCoordinator coordinator;
    private final SettingsStore settingsStore;
    private final HistoryService historyService;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Value("${nuclei.logs-dir:${user.home}/.nuclei-counter/batches}")
    private String logsDir;

    private final Set<Long> cancelRequests = ConcurrentHashMap.newKeySet();

    /**
     * Cancels a running batch. The engine is killed within one poll interval, or never
     * started if the batch is still preparing its macro. Once the engine has exited the
     * batch completes with the results it already has.
     */
    public void requestCancel(Long id) {
        cancelRequests.add(id);
        log.info("Cancel requested for batch {}", id);
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public BatchSession markRejected(BatchSession s, String reason) {
        s.setStatus(BatchStatus.ERROR);
        s.setErrorMessage(reason);
        s.setFinishedAt(Instant.now(clock));
        return repo.save(s);
    }

    @Async("engineExecutor")
    public void runAsync(Long id, List<String> images, RunMode runMode) {
        BatchSession s = repo.findById(id).orElseThrow();
        if (s.getStatus() == BatchStatus.CANCELLED) {
            log.info("Batch {} was cancelled before it started", id);
            return;
        }

        MDC.put("batchId", String.valueOf(id));
        Path batchDir = Paths.get(logsDir).toAbsolutePath().normalize().resolve(String.valueOf(id));
        Path logFile = batchDir.resolve("engine.log");
        Path outcomesFile = batchDir.resolve("outcomes.json");
        try {
            s.setStatus(BatchStatus.RUNNING);
            s.setStartedAt(Instant.now(clock));
            s = repo.save(s);

            ProcessingRecipe recipe = settingsStore.load()
                    .map(ProcessingRecipe::from)
                    .orElseGet(ProcessingRecipe::builtIn);
            BatchResult result = coordinator.run(images, recipe, runMode, () -> cancelRequests.contains(id));

            Files.createDirectories(batchDir);
            writeLog(logFile, runMode, images.size(), result);
            s.setLogPath(logFile.toString());
            objectMapper.writerWithDefaultPrettyPrinter()
                    .writeValue(outcomesFile.toFile(), new ArrayList<>(result.outcomes().values()));
            s.setOutcomesJsonPath(outcomesFile.toString());

            historyService.record(id, result);
            apply(s, result);
            if (cancelRequests.contains(id) && !result.cancelled()) {
                log.info("Batch {} was cancelled after the engine finished, keeping its results", id);
            }
        } catch (IOException ex) {
            log.error("Batch {} results could not be stored: {}", id, ex.getMessage());
            s.setStatus(BatchStatus.ERROR);
            s.setErrorMessage(ex.getMessage());
        } catch (RuntimeException ex) {
            log.error("Batch {} failed", id, ex);
            s.setStatus(BatchStatus.ERROR);
            s.setErrorMessage(ex.getMessage());
        } finally {
            s.setFinishedAt(Instant.now(clock));
            repo.save(s);
            cancelRequests.remove(id);
            MDC.remove("batchId");
        }
    }

    static void apply(BatchSession s, BatchResult result) {
        s.setCountedTotal(result.countedTotal());
        s.setFailedTotal(result.failedTotal());
        s.setNucleiTotal(result.nucleiTotal());
        s.setEngineMissing(result.engineMissing());
        s.setTimedOut(result.timedOut());
        s.setChannelStatus(result.channelStatus() == null ? null : result.channelStatus().name());
        EngineExecution execution = result.execution();
        if (execution != null) {
            s.setExitCode(execution.exitCode());
        }
        if (result.engineMissing()) {
            s.setStatus(BatchStatus.CONFIG_ERROR);
            s.setErrorMessage("engine executable missing");
        } else if (result.cancelled()) {
            s.setStatus(BatchStatus.CANCELLED);
        } else {
            s.setStatus(BatchStatus.DONE);
        }
    }

    private static void writeLog(Path logFile, RunMode runMode, int imageCount, BatchResult result) throws IOException {
        StringBuilder sb = new StringBuilder();
        sb.append("mode=").append(runMode).append('\n');
        sb.append("images=").append(imageCount).append('\n');
        EngineExecution execution = result.execution();
        if (execution == null) {
            sb.append(result.engineMissing() ? "engine=MISSING\n" : "engine=NOT_INVOKED\n");
        } else {
            if (execution.output() != null) {
                sb.append(execution.output());
                if (!execution.output().endsWith("\n")) {
                    sb.append('\n');
                }
            }
            if (execution.timedOut()) {
                sb.append("--- TIMED OUT after ").append(execution.elapsed()).append(" ---\n");
            } else if (execution.cancelled()) {
                sb.append("--- CANCELLED ---\n");
            } else if (execution.detached()) {
                sb.append("--- LEFT RUNNING FOR INSPECTION ---\n");
            } else if (execution.launchFailed()) {
                sb.append("--- LAUNCH FAILED ---\n");
            } else {
                sb.append("--- EXIT CODE: ").append(execution.exitCode()).append(" ---\n");
            }
        }
        Files.writeString(logFile, sb.toString(), StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
    }
}
