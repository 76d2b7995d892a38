package com.purchasingpower.depgraph.configuration;

import com.purchasingpower.depgraph.config.InferenceProperties;
import com.purchasingpower.depgraph.config.RealtimeProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;

/**
 * Thread pools and the clock shared by inference and the realtime layer.
 *
 * <ul>
 *   <li>{@code inferenceExecutor} - parallel frontier expansion, sized by {@code depgraph.inference.max-concurrency}
 *   <li>{@code autoInferenceExecutor} - change-driven rule evaluation, sized by
 *       {@code depgraph.inference.max-concurrent-inferences}
 *   <li>{@code queryRefreshExecutor} - fan-out of one polling tick, sized by {@code depgraph.realtime.max-concurrency}
 *   <li>{@code realtimePollingScheduler} - runs the polling tick
 * </ul>
 *
 * @since 2.0.0
 */
@Slf4j
@Configuration
public class ExecutorConfig {

    @Bean(name = "inferenceExecutor")
    public ThreadPoolTaskExecutor inferenceExecutor(InferenceProperties properties) {
        return boundedPool("inference-", properties.getMaxConcurrency(), 1000);
    }

    @Bean(name = "autoInferenceExecutor")
    public ThreadPoolTaskExecutor autoInferenceExecutor(InferenceProperties properties) {
        return boundedPool("auto-inference-", properties.getMaxConcurrentInferences(), 500);
    }

    @Bean(name = "queryRefreshExecutor")
    public ThreadPoolTaskExecutor queryRefreshExecutor(RealtimeProperties properties) {
        return boundedPool("query-refresh-", properties.getMaxConcurrency(), 1000);
    }

    @Bean(name = "realtimePollingScheduler")
    public ThreadPoolTaskScheduler realtimePollingScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("realtime-poll-");
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.initialize();
        return scheduler;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    private static ThreadPoolTaskExecutor boundedPool(String prefix, int threads, int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();

        // Fixed size: core == max
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix(prefix);

        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();

        log.info("✅ Executor '{}' configured: threads={}, queue={}", prefix, threads, queueCapacity);
        return executor;
    }
}
