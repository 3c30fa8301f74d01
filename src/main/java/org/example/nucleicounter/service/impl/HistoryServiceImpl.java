package org.example.nucleicounter.service.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.nucleicounter.model.BatchResult;
import org.example.nucleicounter.model.HistoryEntry;
import org.example.nucleicounter.repository.HistoryEntryRepository;
import org.example.nucleicounter.service.HistoryService;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class HistoryServiceImpl implements HistoryService {

    private final HistoryEntryRepository repo;
    private final Clock clock;

    @Value("${history.max-entries:100}")
    private int maxEntries = 100;

    @Override
    @Transactional
    public List<HistoryEntry> record(Long batchId, BatchResult result) {
        if (result.outcomes().isEmpty()) {
            return List.of();
        }
        Instant now = Instant.now(clock);
        List<HistoryEntry> entries = result.outcomes().values().stream()
                .map(o -> new HistoryEntry(batchId, o, now))
                .toList();
        List<HistoryEntry> saved = repo.saveAll(entries);
        trim();
        return saved;
    }

    @Override
    @Transactional(readOnly = true)
    public List<HistoryEntry> recent(int limit) {
        int size = Math.max(1, Math.min(limit, maxEntries));
        return repo.findAllByOrderByIdDesc(PageRequest.of(0, size));
    }

    private void trim() {
        long excess = repo.count() - maxEntries;
        if (excess <= 0) {
            return;
        }
        List<HistoryEntry> oldest = repo.findAllByOrderByIdAsc(PageRequest.of(0, (int) excess));
        repo.deleteAllInBatch(oldest);
        log.debug("History trimmed by {} entries", oldest.size());
    }
}
