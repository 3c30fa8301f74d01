package org.example.nucleicounter;

import org.example.nucleicounter.cli.CountCommand;
import org.example.nucleicounter.service.BatchService;
import org.example.nucleicounter.service.SettingsStore;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
class NucleiCounterApplicationTests {

    @Autowired
    private BatchService batchService;

    @Autowired
    private SettingsStore settingsStore;

    @Autowired
    private CountCommand countCommand;

    @Test
    void contextLoads() {
        assertThat(batchService).isNotNull();
        assertThat(settingsStore).isNotNull();
        assertThat(countCommand.getExitCode()).isZero();
    }
}
