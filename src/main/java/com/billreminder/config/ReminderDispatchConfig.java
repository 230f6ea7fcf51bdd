package com.billreminder.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.RejectedExecutionHandler;

@Configuration
public class ReminderDispatchConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(name = "reminderDispatchExecutor")
    public Executor reminderDispatchExecutor(ReminderProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        int threads = Math.max(1, properties.dispatchThreads());
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(Math.max(10, properties.dispatchQueueCapacity()));
        executor.setRejectedExecutionHandler(callerRunsUnlessShutdown());
        executor.setThreadNamePrefix("reminder-dispatch-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }

    /**
     * A full queue runs the task on the cycle thread. Once the pool is shut down the task is
     * rejected, so the caller learns about it instead of waiting on a task that never runs.
     */
    static RejectedExecutionHandler callerRunsUnlessShutdown() {
        return (task, pool) -> {
            if (pool.isShutdown()) {
                throw new RejectedExecutionException("Reminder dispatch pool is shut down");
            }
            task.run();
        };
    }
}
