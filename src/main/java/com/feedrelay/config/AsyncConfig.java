package com.feedrelay.config;

import com.feedrelay.event.RecordCreatedEvent;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.aop.interceptor.AsyncUncaughtExceptionHandler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.AsyncConfigurer;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Runs {@link RecordCreatedEvent} listeners off the ingest request thread.
 *
 * <p>When the queue is full the publishing thread runs the fan-out itself, so ingest slows down
 * instead of dropping webhook triggers.
 */
@Configuration
public class AsyncConfig implements AsyncConfigurer {

    public static final String FANOUT_EXECUTOR = "recordFanoutExecutor";

    private static final Logger log = LoggerFactory.getLogger(AsyncConfig.class);

    private final AsyncProperties asyncProperties;

    public AsyncConfig(AsyncProperties asyncProperties) {
        this.asyncProperties = asyncProperties;
    }

    @Bean(FANOUT_EXECUTOR)
    public ThreadPoolTaskExecutor recordFanoutExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(asyncProperties.getCorePoolSize());
        executor.setMaxPoolSize(asyncProperties.getMaxPoolSize());
        executor.setQueueCapacity(asyncProperties.getQueueCapacity());
        executor.setThreadNamePrefix("fanout-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        return executor;
    }

    @Override
    public Executor getAsyncExecutor() {
        return recordFanoutExecutor();
    }

    @Override
    public AsyncUncaughtExceptionHandler getAsyncUncaughtExceptionHandler() {
        return (throwable, method, params) -> {
            for (Object param : params) {
                if (param instanceof RecordCreatedEvent event) {
                    log.error("Fan-out of record {} failed in {}.{}", event.getDataRecord().getId(),
                            method.getDeclaringClass().getSimpleName(), method.getName(), throwable);
                    return;
                }
            }
            log.error("Async call {}.{} failed", method.getDeclaringClass().getSimpleName(), method.getName(),
                    throwable);
        };
    }
}
