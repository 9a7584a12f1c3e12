package com.phillippitts.hazardscan.config;

import com.phillippitts.hazardscan.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Configuration for the thread pools that drive hazard analysis.
 *
 * <p>Two pools are kept apart so that a chain waiting on a backend never occupies the thread the
 * backend itself needs:
 * <ul>
 *   <li>{@code orchestrationExecutor} runs cache computations and fallback chains</li>
 *   <li>{@code inferenceExecutor} runs individual backend calls, one per attempt</li>
 * </ul>
 *
 * <p>Pool sizes are configured via {@link ThreadPoolProperties} ({@code threadpool.*}).
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Executor for cache computations and fallback chains.
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.AbortPolicy}. A chain must never run on the
     * submitting thread, so when the pool and queue are full the request fails fast as
     * overloaded and {@code analyzeAsync} still returns at once.
     *
     * @return configured orchestration executor
     */
    @Bean(name = "orchestrationExecutor")
    public ThreadPoolTaskExecutor orchestrationExecutor() {
        return buildExecutor(threadPoolProperties.getOrchestration(),
                new ThreadPoolExecutor.AbortPolicy());
    }

    /**
     * Executor for individual backend calls.
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.AbortPolicy}. A rejected attempt is recorded
     * as a failure and the chain moves on, so a saturated pool can never stall the caller past
     * the tier timeout.
     *
     * @return configured inference executor
     */
    @Bean(name = "inferenceExecutor")
    public ThreadPoolTaskExecutor inferenceExecutor() {
        return buildExecutor(threadPoolProperties.getInference(),
                new ThreadPoolExecutor.AbortPolicy());
    }

    private ThreadPoolTaskExecutor buildExecutor(ThreadPoolProperties.PoolProperties props,
                                                 RejectedExecutionHandler rejection) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(rejection);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.setTaskDecorator(threadContextDecorator());
        executor.initialize();
        return executor;
    }

    /**
     * Copies the Log4j2 ThreadContext (requestId and friends) from the submitting thread to the
     * worker thread, restoring the worker's previous context afterwards.
     */
    static TaskDecorator threadContextDecorator() {
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
