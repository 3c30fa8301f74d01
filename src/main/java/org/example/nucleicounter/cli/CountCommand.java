package org.example.nucleicounter.cli;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.nucleicounter.model.BatchResult;
import org.example.nucleicounter.model.ImageOutcome;
import org.example.nucleicounter.model.RunMode;
import org.example.nucleicounter.service.BatchService;
import org.example.nucleicounter.service.SettingsNotConfiguredException;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.util.Arrays;
import java.util.List;

/**
 * Command-line mode: a single image path as the only positional argument counts that image
 * headlessly and prints the result. Without one, the HTTP service runs instead.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CountCommand implements CommandLineRunner, ExitCodeGenerator {

    static final int EXIT_FAILED = 1;
    static final int EXIT_NOT_CONFIGURED = 2;

    private final BatchService batchService;

    private PrintStream out = System.out;
    private int exitCode;

    public static boolean isSingleImage(String... args) {
        return positional(args).size() == 1;
    }

    @Override
    public void run(String... args) {
        if (!isSingleImage(args)) {
            return;
        }
        String image = positional(args).get(0);
        log.info("Running in command-line mode for image: {}", image);
        try {
            BatchResult result = batchService.countNow(List.of(image), RunMode.HEADLESS);
            ImageOutcome outcome = result.outcomes().get(image.strip());
            if (outcome != null && outcome.succeeded()) {
                out.println("Nuclei count: " + outcome.count());
                exitCode = 0;
            } else {
                String reason = outcome == null ? "no result" : outcome.detail();
                out.println("Failed to count nuclei: " + reason);
                exitCode = EXIT_FAILED;
            }
        } catch (SettingsNotConfiguredException e) {
            out.println(e.getMessage());
            out.println("Start the service without arguments and PUT /api/settings, or edit the settings file.");
            exitCode = EXIT_NOT_CONFIGURED;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    void setOut(PrintStream out) {
        this.out = out;
    }

    private static List<String> positional(String... args) {
        if (args == null) {
            return List.of();
        }
        return Arrays.stream(args)
                .filter(a -> a != null && !a.startsWith("--"))
                .toList();
    }
}
