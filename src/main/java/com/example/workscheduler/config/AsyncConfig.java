package com.example.workscheduler.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Threads and clock used by the scheduler.
 * <p>
 * The loop owns exactly one thread so ticks never overlap within a process.
 * Next-run updates for a batch are issued concurrently on a separate pool.
 */
@Slf4j
@EnableAsync
@Configuration
public class AsyncConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Dedicated thread running the scheduler loop.
     */
    @Bean(name = "schedulerLoopExecutor", destroyMethod = "shutdownNow")
    public ExecutorService schedulerLoopExecutor() {
        log.info("Creating single-thread executor for the scheduler loop");

        var factory = new CustomizableThreadFactory("scheduler-loop-");
        factory.setDaemon(true);
        return Executors.newSingleThreadExecutor(factory);
    }

    /**
     * Pool for the independent per-item next-run updates issued after a dispatch.
     */
    @Bean(name = "scheduleUpdateExecutor", destroyMethod = "shutdown")
    public ExecutorService scheduleUpdateExecutor(WorkSchedulerProperties properties) {
        log.info("Creating schedule update executor with {} threads", properties.getUpdatePoolSize());

        return Executors.newFixedThreadPool(properties.getUpdatePoolSize(), new CustomizableThreadFactory("schedule-update-"));
    }

    /**
     * Task executor for Spring's @Async annotation (alerts).
     */
    @Bean(name = "taskExecutor")
    public TaskExecutor taskExecutor() {
        var executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(4);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("async-alert-");
        executor.setRejectedExecutionHandler((r, e) -> {
            log.warn("Task rejected from async executor, running in caller thread");
            if (!e.isShutdown()) {
                r.run();
            }
        });
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();

        return executor;
    }
}
