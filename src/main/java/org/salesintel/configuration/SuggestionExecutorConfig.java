package org.salesintel.configuration;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Bounded pool for suggestion calls. A task abandoned by a timed-out caller keeps its thread until
 * the remote call returns.
 */
@Configuration
public class SuggestionExecutorConfig {

    @Bean(name = "suggestionExecutor")
    public ThreadPoolTaskExecutor suggestionExecutor(@Value("${mapping.suggestion.pool-size:4}") int poolSize,
                                                     @Value("${mapping.suggestion.queue-capacity:20}") int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("suggest-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }
}
