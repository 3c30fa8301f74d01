package org.example.nucleicounter.service;

import org.example.nucleicounter.model.BatchResult;
import org.example.nucleicounter.model.HistoryEntry;

import java.util.List;

public interface HistoryService {
    List<HistoryEntry> record(Long batchId, BatchResult result);

    List<HistoryEntry> recent(int limit);
}
