package com.example.ttlreaper.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.SimpleAsyncTaskExecutor;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Timer pool for deferred deletions, periodic policy ticks and @Scheduled jobs; worker pool for
 * reconciliation passes; one thread per watch stream.
 */
@Configuration
@EnableScheduling
public class SchedulerConfig {

    public static final String TIMER_POOL = "reaperTimerPool";
    public static final String WORKER_POOL = "reconcileWorkerPool";
    public static final String WATCH_EXECUTOR = "watchExecutor";

    @Bean(name = TIMER_POOL)
    public ThreadPoolTaskScheduler reaperTimerPool(ReaperProperties properties) {
        ThreadPoolTaskScheduler s = new ThreadPoolTaskScheduler();
        s.setPoolSize(properties.getSchedulerThreads());
        s.setThreadNamePrefix("reaper-timer-");
        s.setRemoveOnCancelPolicy(true);
        s.initialize();
        return s;
    }

    @Bean(name = WORKER_POOL)
    public ThreadPoolTaskExecutor reconcileWorkerPool(ReaperProperties properties) {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(properties.getWorkerThreads());
        e.setMaxPoolSize(properties.getWorkerThreads());
        e.setThreadNamePrefix("reconcile-");
        e.initialize();
        return e;
    }

    @Bean(name = WATCH_EXECUTOR)
    public TaskExecutor watchExecutor() {
        SimpleAsyncTaskExecutor e = new SimpleAsyncTaskExecutor("watch-");
        e.setDaemon(true);
        return e;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
