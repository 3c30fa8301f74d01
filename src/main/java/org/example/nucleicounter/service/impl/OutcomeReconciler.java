package org.example.nucleicounter.service.impl;

import lombok.extern.slf4j.Slf4j;
import org.example.nucleicounter.engine.ResultChannel;
import org.example.nucleicounter.engine.ResultRecord;
import org.example.nucleicounter.model.ImageOutcome;
import org.example.nucleicounter.model.OutcomeStatus;
import org.example.nucleicounter.script.ImageNames;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Paths;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps result channel records back onto the requested images.
 * <p>
 * Records are matched by name, not by position. When several requested paths share a file
 * name, their records are assigned in request order, which is the order the macro processes
 * them. Every requested image gets exactly one outcome; images without a record are failures.
 */
@Slf4j
@Component
public class OutcomeReconciler {

    public Map<String, ImageOutcome> reconcile(List<String> images, List<ResultRecord> records) {
        Map<String, Deque<String>> byName = new HashMap<>();
        for (String image : images) {
            byName.computeIfAbsent(ImageNames.displayName(image), k -> new ArrayDeque<>()).add(image);
        }

        Map<String, ImageOutcome> matched = new HashMap<>();
        for (ResultRecord record : records) {
            Deque<String> candidates = byName.get(ImageNames.displayName(record.identifier()));
            if (candidates == null || candidates.isEmpty()) {
                log.warn("Ignoring result for unrequested or already matched image '{}'", record.identifier());
                continue;
            }
            String image = candidates.poll();
            matched.put(image, toOutcome(image, record.value()));
        }

        Map<String, ImageOutcome> outcomes = new LinkedHashMap<>();
        for (String image : images) {
            ImageOutcome outcome = matched.get(image);
            if (outcome == null) {
                outcome = ImageOutcome.failed(image, OutcomeStatus.NOT_IN_OUTPUT, "not found in engine output");
            }
            outcomes.put(image, outcome);
        }
        return outcomes;
    }

    public Map<String, ImageOutcome> allFailed(List<String> images, OutcomeStatus status, String detail) {
        Map<String, ImageOutcome> outcomes = new LinkedHashMap<>();
        for (String image : images) {
            outcomes.put(image, ImageOutcome.failed(image, status, detail));
        }
        return outcomes;
    }

    ImageOutcome toOutcome(String image, String value) {
        if (ResultChannel.ERROR_TOKEN.equalsIgnoreCase(value)) {
            return exists(image)
                    ? ImageOutcome.failed(image, OutcomeStatus.OPEN_FAILED, "engine could not open or measure the image")
                    : ImageOutcome.failed(image, OutcomeStatus.FILE_NOT_FOUND, "file not found");
        }
        try {
            int count = Integer.parseInt(value);
            if (count >= 0) {
                return ImageOutcome.counted(image, count);
            }
        } catch (NumberFormatException e) {
            log.debug("Unparsed count '{}' for {}", value, image);
        }
        return ImageOutcome.failed(image, OutcomeStatus.UNPARSED, "unparsed count: '" + value + "'");
    }

    private static boolean exists(String image) {
        try {
            return Files.exists(Paths.get(image));
        } catch (InvalidPathException e) {
            return false;
        }
    }
}
