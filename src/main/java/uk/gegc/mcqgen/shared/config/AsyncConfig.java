package uk.gegc.mcqgen.shared.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pool used when a batch of queries is generated in parallel.
 */
@Configuration
@Slf4j
public class AsyncConfig {

    @Value("${async.ai.core-pool-size:2}")
    private int aiCorePoolSize;

    @Value("${async.ai.max-pool-size:4}")
    private int aiMaxPoolSize;

    @Value("${async.ai.queue-capacity:50}")
    private int aiQueueCapacity;

    @Value("${async.ai.keep-alive-seconds:60}")
    private int aiKeepAliveSeconds;

    @Bean(name = "aiTaskExecutor")
    public Executor aiTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(aiCorePoolSize);
        executor.setMaxPoolSize(aiMaxPoolSize);
        executor.setQueueCapacity(aiQueueCapacity);
        executor.setKeepAliveSeconds(aiKeepAliveSeconds);
        executor.setThreadNamePrefix("mcq-");

        // Caller runs the task if the queue is full
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());

        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();

        log.info("AI Task Executor configured - Core: {}, Max: {}, Queue: {}, KeepAlive: {}s",
                aiCorePoolSize, aiMaxPoolSize, aiQueueCapacity, aiKeepAliveSeconds);

        return executor;
    }
}
