package com.phillippitts.podcastbuddy.config;

import com.phillippitts.podcastbuddy.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pools for the turn pipeline.
 *
 * <p>Pool sizes come from {@link ThreadPoolProperties} ({@code threadpool.llm.*} and
 * {@code threadpool.playback.*}).
 *
 * <p>MDC propagation: both pools copy the Log4j2 ThreadContext of the submitting thread, so the
 * {@code sessionId} and {@code turnId} keys follow a turn onto its worker threads.
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Executor for model token readers.
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.AbortPolicy}. A reader run on the turn thread
     * would block it for the whole reply and defeat the model timeout, so a full pool fails the
     * turn instead.
     */
    @Bean(name = "llmStreamExecutor")
    public ThreadPoolTaskExecutor llmStreamExecutor() {
        return build(threadPoolProperties.getLlm(), new ThreadPoolExecutor.AbortPolicy());
    }

    /**
     * Executor for external player processes.
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.CallerRunsPolicy} for backpressure.
     */
    @Bean(name = "playbackExecutor")
    public ThreadPoolTaskExecutor playbackExecutor() {
        return build(threadPoolProperties.getPlayback(), new ThreadPoolExecutor.CallerRunsPolicy());
    }

    private static ThreadPoolTaskExecutor build(ThreadPoolProperties.PoolProperties props,
                                                RejectedExecutionHandler rejectionHandler) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(rejectionHandler);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.setTaskDecorator(mdcPropagating());
        executor.initialize();
        return executor;
    }

    static TaskDecorator mdcPropagating() {
        return runnable -> {
            Map<String, String> contextMap = ThreadContext.getImmutableContext();
            return () -> {
                Map<String, String> previous = ThreadContext.getImmutableContext();
                try {
                    if (contextMap != null && !contextMap.isEmpty()) {
                        ThreadContext.putAll(contextMap);
                    }
                    runnable.run();
                } finally {
                    ThreadContext.clearAll();
                    if (previous != null && !previous.isEmpty()) {
                        ThreadContext.putAll(previous);
                    }
                }
            };
        };
    }
}
