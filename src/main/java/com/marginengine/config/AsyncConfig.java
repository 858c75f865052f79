package com.marginengine.config;

import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Worker pool for the liquidation monitor.
 *
 * <p>{@code liquidationExecutor} bounds the fan-out of liquidation and trigger submissions
 * during a price crash. A full queue rejects the submission (AbortPolicy) instead of
 * running it on the tick thread, which would then wait on an unrelated position's lock.
 * The monitor treats a rejection as deferred to the next tick.
 */
@Configuration
public class AsyncConfig {

    @Value("${marginengine.liquidation.core-pool-size:4}")
    private int corePoolSize;

    @Value("${marginengine.liquidation.max-pool-size:16}")
    private int maxPoolSize;

    @Value("${marginengine.liquidation.queue-capacity:1000}")
    private int queueCapacity;

    @Bean("liquidationExecutor")
    public ThreadPoolTaskExecutor liquidationExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("liquidation-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        return executor;
    }
}
