package org.example.nucleicounter.service.impl;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.nucleicounter.model.BatchResult;
import org.example.nucleicounter.model.BatchSession;
import org.example.nucleicounter.model.BatchStatus;
import org.example.nucleicounter.model.EngineSettings;
import org.example.nucleicounter.model.ImageOutcome;
import org.example.nucleicounter.model.ProcessingRecipe;
import org.example.nucleicounter.model.RunMode;
import org.example.nucleicounter.repository.BatchSessionRepository;
import org.example.nucleicounter.service.BatchService;
import org.example.nucleicounter.service.HistoryService;
import org.example.nucleicounter.service.SettingsStore;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class BatchServiceImpl implements BatchService {

    private final BatchSessionRepository repo;
    private final BatchRunner batchRunner;
    private final BatchCoordinator coordinator;
    private final SettingsStore settingsStore;
    private final HistoryService historyService;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Override
    @Transactional
    public BatchSession submit(List<String> images, RunMode runMode) {
        settingsStore.require();
        List<String> requested = distinct(images);
        RunMode mode = runMode == null ? RunMode.HEADLESS : runMode;

        BatchSession s = new BatchSession();
        s.setRunMode(mode);
        s.setImageCount(requested.size());
        s.setCreatedAt(Instant.now(clock));
        if (requested.isEmpty()) {
            s.setStatus(BatchStatus.DONE);
            s.setCountedTotal(0);
            s.setFailedTotal(0);
            s.setNucleiTotal(0L);
            s.setFinishedAt(s.getCreatedAt());
            return repo.save(s);
        }
        s.setStatus(BatchStatus.QUEUED);
        s = repo.save(s);
        log.info("Batch {} queued with {} image(s)", s.getId(), requested.size());

        final BatchSession queued = s;
        Runnable start = () -> {
            try {
                batchRunner.runAsync(queued.getId(), requested, mode);
            } catch (TaskRejectedException e) {
                log.error("Batch {} rejected by the engine worker: {}", queued.getId(), e.getMessage());
                batchRunner.markRejected(queued, "engine queue is full, submit the batch again later");
            }
        };
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    start.run();
                }
            });
        } else {
            start.run();
        }
        return s;
    }

    @Override
    public Optional<BatchSession> get(Long id) {
        return repo.findById(id);
    }

    @Override
    public List<ImageOutcome> readOutcomes(Long id) throws IOException {
        BatchSession s = repo.findById(id)
                .orElseThrow(() -> new NoSuchElementException("batch not found"));
        if (s.getOutcomesJsonPath() == null) {
            return List.of();
        }
        Path p = Paths.get(s.getOutcomesJsonPath());
        if (!Files.exists(p)) {
            return List.of();
        }
        return objectMapper.readValue(p.toFile(), new TypeReference<List<ImageOutcome>>() {});
    }

    @Override
    public String readLog(Long id) throws IOException {
        BatchSession s = repo.findById(id)
                .orElseThrow(() -> new NoSuchElementException("batch not found"));
        if (s.getLogPath() == null) {
            return "";
        }
        Path p = Paths.get(s.getLogPath());
        return Files.exists(p) ? Files.readString(p) : "";
    }

    @Override
    @Transactional
    public BatchSession cancel(Long id) {
        BatchSession s = repo.findById(id)
                .orElseThrow(() -> new NoSuchElementException("batch not found"));
        switch (s.getStatus()) {
            case QUEUED -> {
                s.setStatus(BatchStatus.CANCELLED);
                s.setFinishedAt(Instant.now(clock));
                s = repo.save(s);
                log.info("Batch {} cancelled while queued", id);
            }
            case RUNNING -> batchRunner.requestCancel(id);
            default -> log.debug("Batch {} already finished with {}", id, s.getStatus());
        }
        return s;
    }

    @Override
    public BatchResult countNow(List<String> images, RunMode runMode) {
        EngineSettings settings = settingsStore.require();
        BatchResult result = coordinator.run(distinct(images), ProcessingRecipe.from(settings), runMode);
        historyService.record(null, result);
        return result;
    }

    /**
     * Sessions left queued or running by a previous process can never finish.
     */
    @EventListener
    @Transactional
    public void markInterruptedSessions(ApplicationReadyEvent event) {
        if (event.getSpringApplication().getWebApplicationType() == WebApplicationType.NONE) {
            return;
        }
        List<BatchSession> stale = repo.findByStatusIn(List.of(BatchStatus.QUEUED, BatchStatus.RUNNING));
        for (BatchSession s : stale) {
            s.setStatus(BatchStatus.ERROR);
            s.setErrorMessage("interrupted by application restart");
            s.setFinishedAt(Instant.now(clock));
        }
        if (!stale.isEmpty()) {
            repo.saveAll(stale);
            log.warn("Marked {} interrupted batch session(s) as failed", stale.size());
        }
    }

    private static List<String> distinct(List<String> images) {
        LinkedHashSet<String> out = new LinkedHashSet<>();
        if (images != null) {
            for (String image : images) {
                if (image != null && !image.isBlank()) {
                    out.add(image.strip());
                }
            }
        }
        return new ArrayList<>(out);
    }
}
