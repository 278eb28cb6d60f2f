package com.purchasingpower.synthflow.configuration;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Thread pools for the only blocking calls in a run: candidate generation and test execution.
 */
@Slf4j
@Configuration
public class SynthesisExecutorConfig {

    @Bean(name = "candidateExecutor")
    public ThreadPoolTaskExecutor candidateExecutor(SynthesisProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();

        int poolSize = properties.getMultishot().getExecutorPoolSize();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);

        // Queue capacity - candidates wait here when every thread is busy
        executor.setQueueCapacity(100);

        executor.setThreadNamePrefix("candidate-");

        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);

        executor.initialize();

        log.info("✅ Candidate executor configured: core={}, max={}, queue={}",
                executor.getCorePoolSize(),
                executor.getMaxPoolSize(),
                executor.getQueueCapacity());

        return executor;
    }
}
