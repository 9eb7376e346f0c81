package com.phillippitts.podcastbuddy.config;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Exposes the LLM reader pool through Micrometer.
 *
 * <ul>
 *   <li>llm.pool.size - current number of threads</li>
 *   <li>llm.pool.active - readers currently streaming</li>
 *   <li>llm.pool.queued - readers waiting for a thread</li>
 *   <li>llm.pool.completed - cumulative completed readers</li>
 * </ul>
 *
 * <p>Also logs a pool summary every 5 minutes.
 */
@Configuration
public class ThreadPoolMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(ThreadPoolMetricsConfig.class);

    private final ObjectProvider<ThreadPoolTaskExecutor> llmExecutorProvider;

    public ThreadPoolMetricsConfig(
            @Qualifier("llmStreamExecutor") ObjectProvider<ThreadPoolTaskExecutor> llmExecutorProvider) {
        this.llmExecutorProvider = llmExecutorProvider;
    }

    @Bean
    public MeterBinder llmExecutorMetrics() {
        return registry -> {
            ThreadPoolExecutor executor = llmExecutorProvider.getObject().getThreadPoolExecutor();

            Gauge.builder("llm.pool.size", executor, ThreadPoolExecutor::getPoolSize)
                    .description("Current number of threads in the LLM reader pool")
                    .register(registry);

            Gauge.builder("llm.pool.active", executor, ThreadPoolExecutor::getActiveCount)
                    .description("Number of token readers currently streaming")
                    .register(registry);

            Gauge.builder("llm.pool.queued", executor, e -> e.getQueue().size())
                    .description("Number of token readers waiting for a thread")
                    .register(registry);

            Gauge.builder("llm.pool.completed", executor, ThreadPoolExecutor::getCompletedTaskCount)
                    .description("Cumulative count of completed token readers")
                    .register(registry);

            LOG.info("LLM reader pool metrics registered: llm.pool.* available via /actuator/metrics");
        };
    }

    @Scheduled(fixedRate = 300_000) // 5 minutes
    public void logThreadPoolHealth() {
        ThreadPoolExecutor executor = llmExecutorProvider.getObject().getThreadPoolExecutor();
        LOG.info("LLM reader pool: size={}/{}, active={}, queued={}, completed={}",
                executor.getPoolSize(),
                executor.getMaximumPoolSize(),
                executor.getActiveCount(),
                executor.getQueue().size(),
                executor.getCompletedTaskCount());
    }
}
