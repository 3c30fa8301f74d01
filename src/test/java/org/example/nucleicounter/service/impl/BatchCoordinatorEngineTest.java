package org.example.nucleicounter.service.impl;

import org.example.nucleicounter.engine.EngineProcessSupervisor;
import org.example.nucleicounter.engine.FakeEngine;
import org.example.nucleicounter.model.BatchResult;
import org.example.nucleicounter.model.EngineSettings;
import org.example.nucleicounter.model.OutcomeStatus;
import org.example.nucleicounter.model.ProcessingRecipe;
import org.example.nucleicounter.model.RunMode;
import org.example.nucleicounter.script.MacroTemplateLoader;
import org.example.nucleicounter.script.RecipeFragments;
import org.example.nucleicounter.script.ScriptSynthesizer;
import org.example.nucleicounter.service.SettingsStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.test.util.ReflectionTestUtils;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Runs the coordinator against a shell script standing in for the engine process.
 */
@EnabledOnOs({OS.LINUX, OS.MAC})
class BatchCoordinatorEngineTest {

    @TempDir
    Path tmp;

    private BatchCoordinator coordinator;
    private SettingsStore settingsStore;

    @BeforeEach
    void setUp() {
        MacroTemplateLoader loader = new MacroTemplateLoader(new DefaultResourceLoader());
        EngineProcessSupervisor supervisor = new EngineProcessSupervisor();
        ReflectionTestUtils.setField(supervisor, "pollInterval", Duration.ofMillis(50));
        settingsStore = mock(SettingsStore.class);
        coordinator = new BatchCoordinator(settingsStore, new ScriptSynthesizer(loader, new RecipeFragments(loader)),
                supervisor, new OutcomeReconciler());
        ReflectionTestUtils.setField(coordinator, "workDir", tmp.resolve("work").toString());
        ReflectionTestUtils.setField(coordinator, "channelGrace", Duration.ofMillis(50));
        ReflectionTestUtils.setField(coordinator, "channelPollInterval", Duration.ofMillis(50));
        ReflectionTestUtils.setField(coordinator, "channelMaxWait", Duration.ofSeconds(1));
    }

    @Test
    void harvestsRecordsWrittenByEngine() throws IOException {
        useEngine("printf 'Filename,Count\\nx.jpg,12\\ny.jpg,7\\n' > \"$RESULT\"");

        BatchResult result = coordinator.run(List.of("/img/x.jpg", "/img/y.jpg"), ProcessingRecipe.builtIn(),
                RunMode.HEADLESS);

        assertThat(result.execution().cleanExit()).isTrue();
        assertThat(result.nucleiTotal()).isEqualTo(19);
    }

    @Test
    void timeoutGivesPartialCredit() throws IOException {
        ReflectionTestUtils.setField(coordinator, "baseTimeout", Duration.ofMillis(500));
        ReflectionTestUtils.setField(coordinator, "perImageTimeout", Duration.ZERO);
        useEngine("printf 'Filename,Count\\nx.jpg,5\\n' > \"$RESULT\"\nsleep 30");

        BatchResult result = coordinator.run(List.of("/img/x.jpg", "/img/y.jpg"), ProcessingRecipe.builtIn(),
                RunMode.HEADLESS);

        assertThat(result.timedOut()).isTrue();
        assertThat(result.outcomes().get("/img/x.jpg").count()).isEqualTo(5);
        assertThat(result.outcomes().get("/img/y.jpg").status()).isEqualTo(OutcomeStatus.NOT_IN_OUTPUT);
    }

    private void useEngine(String body) throws IOException {
        Path engine = FakeEngine.write(tmp, body);
        when(settingsStore.load()).thenReturn(Optional.of(EngineSettings.builder().enginePath(engine.toString()).build()));
    }
}
