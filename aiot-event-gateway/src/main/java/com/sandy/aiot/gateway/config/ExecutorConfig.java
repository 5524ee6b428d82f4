package com.sandy.aiot.gateway.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Bounded pools for on-demand analysis. Diagnostic tasks wait on pattern detection, so the two
 * run on separate pools.
 */
@Configuration
public class ExecutorConfig {

    public static final String PATTERN_EXECUTOR = "patternExecutor";
    public static final String DIAGNOSTIC_EXECUTOR = "diagnosticExecutor";

    @Bean(name = PATTERN_EXECUTOR)
    public ThreadPoolTaskExecutor patternExecutor(@Value("${gateway.patterns.pool-size:8}") int poolSize) {
        return boundedPool("pattern-", poolSize, 1000);
    }

    @Bean(name = DIAGNOSTIC_EXECUTOR)
    public ThreadPoolTaskExecutor diagnosticExecutor(@Value("${gateway.diagnostics.pool-size:20}") int poolSize) {
        return boundedPool("diagnostic-", poolSize, 500);
    }

    private ThreadPoolTaskExecutor boundedPool(String prefix, int poolSize, int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix(prefix);
        executor.setDaemon(true);
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }
}
