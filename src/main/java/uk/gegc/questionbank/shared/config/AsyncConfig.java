package uk.gegc.questionbank.shared.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pools for the question bank.
 * <p>
 * The sampling pool serves short per-descriptor index reads fanned out by a single request.
 * The repair pool drives long-running repair runs, one thread per run.
 * Both are injected by name; nothing here runs through {@code @Async}.
 */
@Configuration
@Slf4j
public class AsyncConfig {

    @Value("${async.sampling.core-pool-size:8}")
    private int samplingCorePoolSize;

    @Value("${async.sampling.max-pool-size:16}")
    private int samplingMaxPoolSize;

    @Value("${async.sampling.queue-capacity:200}")
    private int samplingQueueCapacity;

    @Value("${async.sampling.keep-alive-seconds:60}")
    private int samplingKeepAliveSeconds;

    @Value("${async.repair.core-pool-size:1}")
    private int repairCorePoolSize;

    @Value("${async.repair.max-pool-size:2}")
    private int repairMaxPoolSize;

    @Value("${async.repair.queue-capacity:10}")
    private int repairQueueCapacity;

    /**
     * Executor for per-descriptor counting and sampling.
     * Caller-runs on saturation so a burst degrades to sequential reads instead of failing.
     */
    @Bean(name = "samplingTaskExecutor")
    public Executor samplingTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(samplingCorePoolSize);
        executor.setMaxPoolSize(samplingMaxPoolSize);
        executor.setQueueCapacity(samplingQueueCapacity);
        executor.setKeepAliveSeconds(samplingKeepAliveSeconds);
        executor.setThreadNamePrefix("sampling-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        executor.initialize();

        log.info("Sampling Task Executor configured - Core: {}, Max: {}, Queue: {}, KeepAlive: {}s",
                samplingCorePoolSize, samplingMaxPoolSize, samplingQueueCapacity, samplingKeepAliveSeconds);
        return executor;
    }

    /**
     * Executor for repair runs.
     */
    @Bean(name = "repairTaskExecutor")
    public Executor repairTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(repairCorePoolSize);
        executor.setMaxPoolSize(repairMaxPoolSize);
        executor.setQueueCapacity(repairQueueCapacity);
        executor.setThreadNamePrefix("repair-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        // a run interrupted by shutdown resumes from its last committed page
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();

        log.info("Repair Task Executor configured - Core: {}, Max: {}, Queue: {}",
                repairCorePoolSize, repairMaxPoolSize, repairQueueCapacity);
        return executor;
    }
}
