package com.purchasingpower.chemflow.configuration;

import com.purchasingpower.chemflow.config.InferenceProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Thread pool for per-cluster classification.
 *
 * Cluster classification is pure and reads only the cluster's own entries,
 * so clusters are fanned out across this pool. Graph writes never run here.
 */
@Slf4j
@Configuration
public class InferenceExecutorConfig {

    @Bean(name = "inferenceExecutor")
    public Executor inferenceExecutor(InferenceProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();

        executor.setCorePoolSize(properties.getParallelism());
        executor.setMaxPoolSize(properties.getParallelism());

        // Clusters are queued, never rejected
        executor.setQueueCapacity(Integer.MAX_VALUE);

        executor.setThreadNamePrefix("cluster-infer-");

        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);

        executor.initialize();

        log.info("✅ Inference executor configured: threads={}", executor.getCorePoolSize());

        return executor;
    }
}
