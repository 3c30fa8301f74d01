package org.example.nucleicounter.config;

import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;

/**
 * The engine worker. A single thread, so batch runs are serialized and never share the
 * engine, while HTTP threads return as soon as a batch is queued.
 */
@Configuration
@Slf4j
public class ExecutorConfig {

    @Value("${engine.queue-capacity:100}")
    private int queueCapacity;

    @Bean("engineExecutor")
    public ThreadPoolTaskExecutor engineExecutor() {
        log.info("Creating single-thread engine executor (queue capacity {})", queueCapacity);
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("engine-");
        executor.setTaskDecorator(mdcPropagating());
        return executor;
    }

    static TaskDecorator mdcPropagating() {
        return runnable -> {
            final Map<String, String> context = MDC.getCopyOfContextMap();
            return () -> {
                if (context != null) {
                    MDC.setContextMap(context);
                }
                try {
                    runnable.run();
                } finally {
                    MDC.clear();
                }
            };
        };
    }
}
