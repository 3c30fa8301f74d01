package org.example.nucleicounter.engine;

import lombok.extern.slf4j.Slf4j;
import org.example.nucleicounter.model.RunMode;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs the external engine against a synthesized macro and waits for it within a timeout.
 * Timeout and cancellation share the same path: the whole process tree is killed and the
 * caller goes on to harvest whatever results were already flushed.
 */
@Slf4j
@Component
public class EngineProcessSupervisor {

    private static final int MAX_OUTPUT_CHARS = 64 * 1024;

    @Value("${engine.headless-flag:--headless}")
    private String headlessFlag = "--headless";

    @Value("${engine.script-flag:-macro}")
    private String scriptFlag = "-macro";

    @Value("${engine.poll-interval:PT0.2S}")
    private Duration pollInterval = Duration.ofMillis(200);

    @Value("${engine.kill-grace:PT5S}")
    private Duration killGrace = Duration.ofSeconds(5);

    public EngineExecution execute(EngineLaunch launch) {
        if (launch.cancelRequested().getAsBoolean()) {
            log.info("Batch cancelled before the engine was started");
            return EngineExecution.cancelled("", Duration.ZERO);
        }
        List<String> cmd = command(launch);
        log.info("Running engine: {}", String.join(" ", cmd));

        ProcessBuilder pb = new ProcessBuilder(cmd);
        pb.redirectErrorStream(true);
        pb.redirectOutput(launch.outputLog().toFile());
        Path workingDir = launch.engine().toAbsolutePath().getParent();
        if (workingDir != null) {
            pb.directory(workingDir.toFile());
        }

        long start = System.nanoTime();
        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            log.error("Engine could not be started: {}", e.getMessage());
            return EngineExecution.launchFailed(e.getMessage());
        }
        return await(process, launch, start);
    }

    List<String> command(EngineLaunch launch) {
        List<String> cmd = new ArrayList<>();
        cmd.add(launch.engine().toString());
        if (launch.runMode() == RunMode.HEADLESS && headlessFlag != null && !headlessFlag.isBlank()) {
            cmd.add(headlessFlag);
        }
        if (scriptFlag != null && !scriptFlag.isBlank()) {
            cmd.add(scriptFlag);
        }
        cmd.add(launch.script().toAbsolutePath().toString());
        return cmd;
    }

    private EngineExecution await(Process process, EngineLaunch launch, long start) {
        long deadline = start + launch.timeout().toNanos();
        try {
            while (true) {
                if (process.waitFor(pollInterval.toMillis(), TimeUnit.MILLISECONDS)) {
                    int exit = process.exitValue();
                    if (exit != 0) {
                        log.warn("Engine exited with code {}", exit);
                    } else {
                        log.info("Engine exited normally");
                    }
                    return EngineExecution.exited(exit, readOutput(launch.outputLog()), elapsedSince(start));
                }
                if (launch.cancelRequested().getAsBoolean()) {
                    log.info("Cancelling engine process {}", process.pid());
                    killTree(process);
                    return EngineExecution.cancelled(readOutput(launch.outputLog()), elapsedSince(start));
                }
                if (launch.runMode() == RunMode.INSPECT && launch.resultsComplete().getAsBoolean()) {
                    log.info("All results written, leaving engine process {} running for inspection", process.pid());
                    return EngineExecution.detached(readOutput(launch.outputLog()), elapsedSince(start));
                }
                if (System.nanoTime() >= deadline) {
                    log.warn("Engine timed out after {}, killing process tree", launch.timeout());
                    killTree(process);
                    return EngineExecution.timedOut(readOutput(launch.outputLog()), elapsedSince(start));
                }
            }
        } catch (InterruptedException e) {
            log.warn("Interrupted while waiting for engine, killing process tree");
            killTree(process);
            Thread.currentThread().interrupt();
            return EngineExecution.cancelled(readOutput(launch.outputLog()), elapsedSince(start));
        }
    }

    private void killTree(Process process) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
        try {
            if (!process.waitFor(killGrace.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Engine process {} still alive {} after kill", process.pid(), killGrace);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static String readOutput(Path outputLog) {
        try {
            if (!Files.exists(outputLog)) {
                return "";
            }
            String out = new String(Files.readAllBytes(outputLog), StandardCharsets.UTF_8);
            return out.length() > MAX_OUTPUT_CHARS ? out.substring(out.length() - MAX_OUTPUT_CHARS) : out;
        } catch (IOException e) {
            log.warn("Could not read engine output {}: {}", outputLog, e.toString());
            return "";
        }
    }

    private static Duration elapsedSince(long start) {
        return Duration.ofNanos(System.nanoTime() - start);
    }
}
