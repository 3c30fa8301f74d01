package org.example.nucleicounter.engine;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.example.nucleicounter.script.ImageNames;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Transient file the batch macro writes its per-image results into.
 * <p>
 * Format: a {@value #HEADER} header, then one {@code name,value} line per processed image
 * where {@code value} is a non-negative integer or {@value #ERROR_TOKEN}. Names containing
 * separators are CSV-quoted.
 */
@Slf4j
public final class ResultChannel {

    public static final String HEADER = "Filename,Count";
    public static final String ERROR_TOKEN = "ERROR";

    private static final CSVFormat FORMAT = CSVFormat.DEFAULT;

    private final Path path;

    private ResultChannel(Path path) {
        this.path = path;
    }

    public static ResultChannel create(Path dir) throws IOException {
        Files.createDirectories(dir);
        return new ResultChannel(Files.createTempFile(dir, "nuclei-results-", ".csv"));
    }

    public static ResultChannel at(Path path) {
        return new ResultChannel(path);
    }

    public static String identifierFor(String image) {
        return FORMAT.format(ImageNames.displayName(image));
    }

    public Path path() {
        return path;
    }

    public int recordCount() {
        try {
            if (!Files.exists(path)) {
                return 0;
            }
            List<String> lines = readLines();
            int count = 0;
            for (int i = 0; i < lines.size(); i++) {
                String line = lines.get(i);
                if (!line.isBlank() && !(i == 0 && isHeader(line))) {
                    count++;
                }
            }
            return count;
        } catch (IOException e) {
            log.debug("Result channel {} not readable yet: {}", path, e.toString());
            return 0;
        }
    }

    /**
     * Waits until the engine's writes look settled: every expected record is present, or the
     * file is non-empty and its size stopped changing between two polls. Gives up after
     * {@code maxWait}; the caller reads whatever is there.
     */
    public void awaitSettled(int expectedRecords, Duration grace, Duration pollInterval, Duration maxWait) {
        long deadline = System.nanoTime() + maxWait.toNanos();
        if (recordCount() >= expectedRecords) {
            return;
        }
        if (!sleep(grace)) {
            return;
        }
        long lastSize = -1;
        while (recordCount() < expectedRecords) {
            long size = size();
            if (size > 0 && size == lastSize) {
                return;
            }
            if (System.nanoTime() >= deadline) {
                log.warn("Result channel {} not settled after {}", path, maxWait);
                return;
            }
            lastSize = size;
            if (!sleep(pollInterval)) {
                return;
            }
        }
    }

    /**
     * Reads every parseable record. Lines that are not two CSV fields with a non-blank name
     * are skipped with a warning. Names are kept verbatim, including surrounding spaces.
     */
    public ChannelRead read() {
        if (!Files.exists(path)) {
            return ChannelRead.of(ChannelStatus.MISSING);
        }
        List<String> lines;
        try {
            lines = readLines();
        } catch (IOException e) {
            log.warn("Could not read result channel {}: {}", path, e.toString());
            return ChannelRead.of(ChannelStatus.UNREADABLE);
        }
        if (lines.stream().allMatch(String::isBlank)) {
            return ChannelRead.of(ChannelStatus.EMPTY);
        }

        List<ResultRecord> records = new ArrayList<>();
        int skipped = 0;
        boolean first = true;
        for (String line : lines) {
            if (line.isBlank()) {
                continue;
            }
            if (first) {
                first = false;
                if (isHeader(line)) {
                    continue;
                }
            }
            ResultRecord record = parseLine(line);
            if (record == null) {
                log.warn("Skipping malformed result line: {}", line);
                skipped++;
            } else {
                records.add(record);
            }
        }
        return new ChannelRead(ChannelStatus.WRITTEN, List.copyOf(records), skipped);
    }

    static ResultRecord parseLine(String line) {
        try (CSVParser parser = CSVParser.parse(line, FORMAT)) {
            List<CSVRecord> parsed = parser.getRecords();
            if (parsed.size() != 1 || parsed.get(0).size() != 2) {
                return null;
            }
            CSVRecord r = parsed.get(0);
            String identifier = r.get(0);
            if (identifier.isBlank()) {
                return null;
            }
            return new ResultRecord(identifier, r.get(1).strip());
        } catch (IOException | UncheckedIOException e) {
            return null;
        }
    }

    // The engine appends in its platform charset; undecodable bytes become U+FFFD.
    private List<String> readLines() throws IOException {
        return new String(Files.readAllBytes(path), StandardCharsets.UTF_8).lines().toList();
    }

    private static boolean isHeader(String line) {
        return HEADER.equalsIgnoreCase(line.strip());
    }

    private long size() {
        try {
            return Files.exists(path) ? Files.size(path) : -1;
        } catch (IOException e) {
            return -1;
        }
    }

    private static boolean sleep(Duration duration) {
        try {
            Thread.sleep(duration.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
