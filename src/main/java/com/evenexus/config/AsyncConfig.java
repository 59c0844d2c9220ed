package com.evenexus.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Thread pools for the appraisal pipeline.
 *
 * <ul>
 *   <li>{@code orderBookFetchExecutor} runs the fetch workers. Each request submits at most
 *       {@code evenexus.appraisal.max-concurrency} workers, so the pool size bounds the number
 *       of appraisals that fetch fully in parallel.</li>
 *   <li>{@code appraisalExecutor} runs whole valuations for callers that want a cancellable
 *       {@link java.util.concurrent.Future}. Kept separate so coordinators never wait on
 *       workers queued behind them in the same pool.</li>
 * </ul>
 *
 * <p>Both pools use caller-runs on saturation: a rejected fetch worker drains the queue on the
 * requesting thread instead of failing the request. After shutdown, submissions are rejected
 * with an exception.
 */
@Configuration
public class AsyncConfig {

    @Value("${evenexus.async.fetch-pool-size:20}")
    private int fetchPoolSize;

    @Value("${evenexus.async.fetch-queue-capacity:200}")
    private int fetchQueueCapacity;

    @Value("${evenexus.async.appraisal-pool-size:4}")
    private int appraisalPoolSize;

    @Value("${evenexus.async.appraisal-queue-capacity:50}")
    private int appraisalQueueCapacity;

    @Bean("orderBookFetchExecutor")
    public ThreadPoolTaskExecutor orderBookFetchExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(fetchPoolSize);
        executor.setMaxPoolSize(fetchPoolSize);
        executor.setQueueCapacity(fetchQueueCapacity);
        executor.setThreadNamePrefix("orderbook-");
        executor.setRejectedExecutionHandler(new CallerRunsUnlessShutdownPolicy());
        // In-flight fetches are interrupted on shutdown; their results would be discarded anyway.
        executor.setWaitForTasksToCompleteOnShutdown(false);
        return executor;
    }

    @Bean("appraisalExecutor")
    public ThreadPoolTaskExecutor appraisalExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(appraisalPoolSize);
        executor.setMaxPoolSize(appraisalPoolSize);
        executor.setQueueCapacity(appraisalQueueCapacity);
        executor.setThreadNamePrefix("appraisal-");
        executor.setRejectedExecutionHandler(new CallerRunsUnlessShutdownPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        return executor;
    }
}
