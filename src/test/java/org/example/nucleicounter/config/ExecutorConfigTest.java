package org.example.nucleicounter.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.test.context.ContextConfiguration;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ContextConfiguration(classes = {ExecutorConfig.class})
class ExecutorConfigTest {

    @Autowired
    @Qualifier("engineExecutor")
    private ThreadPoolTaskExecutor engineExecutor;

    @BeforeEach
    void setUp() {
        MDC.clear();
    }

    @AfterEach
    void tearDown() {
        MDC.clear();
    }

    @Test
    void runsOnSingleEngineThread() {
        assertThat(engineExecutor.getCorePoolSize()).isEqualTo(1);
        assertThat(engineExecutor.getMaxPoolSize()).isEqualTo(1);
        assertThat(engineExecutor.getThreadNamePrefix()).isEqualTo("engine-");
    }

    @Test
    void propagatesBatchIdToWorker() throws Exception {
        MDC.put("batchId", "42");
        CompletableFuture<String> seen = new CompletableFuture<>();

        engineExecutor.execute(() -> seen.complete(MDC.get("batchId")));

        assertThat(seen.get(5, TimeUnit.SECONDS)).isEqualTo("42");
    }

    @Test
    void clearsContextAfterTask() throws Exception {
        MDC.put("batchId", "7");
        engineExecutor.submit(() -> { }).get(5, TimeUnit.SECONDS);
        MDC.clear();

        CompletableFuture<String> seen = new CompletableFuture<>();
        engineExecutor.execute(() -> seen.complete(MDC.get("batchId")));

        assertThat(seen.get(5, TimeUnit.SECONDS)).isNull();
    }
}
