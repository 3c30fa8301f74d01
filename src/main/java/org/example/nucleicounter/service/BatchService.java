package org.example.nucleicounter.service;

import org.example.nucleicounter.model.BatchResult;
import org.example.nucleicounter.model.BatchSession;
import org.example.nucleicounter.model.ImageOutcome;
import org.example.nucleicounter.model.RunMode;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

public interface BatchService {
    BatchSession submit(List<String> images, RunMode runMode);

    Optional<BatchSession> get(Long id);

    List<ImageOutcome> readOutcomes(Long id) throws IOException;

    String readLog(Long id) throws IOException;

    BatchSession cancel(Long id);

    BatchResult countNow(List<String> images, RunMode runMode);
}
