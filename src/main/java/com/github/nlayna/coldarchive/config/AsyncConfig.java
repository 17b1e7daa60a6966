package com.github.nlayna.coldarchive.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.concurrent.Executor;

@Configuration
@RequiredArgsConstructor
public class AsyncConfig {

    private final ArchiveProperties archiveProperties;

    /**
     * Single delivery thread, so observers see each job's events in the order they were published.
     * A full queue rejects; {@code NotificationHub} decides what to do with the event.
     */
    @Bean(name = "notificationExecutor")
    public ThreadPoolTaskExecutor notificationExecutor() {
        return boundedExecutor("notify-", 1, 10_000);
    }

    @Bean(name = "downloadExecutor")
    public Executor downloadExecutor() {
        return boundedExecutor("restore-download-", archiveProperties.getDownload().getThreadPoolSize(), 100);
    }

    @Bean(name = "restoreScheduler")
    public ThreadPoolTaskScheduler restoreScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.setThreadNamePrefix("restore-poll-");
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(30);
        scheduler.initialize();
        return scheduler;
    }

    /**
     * Fixed-size pool: core and max are both {@code threads}, so the pool never grows past it.
     */
    public static ThreadPoolTaskExecutor boundedExecutor(String threadNamePrefix, int threads, int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix(threadNamePrefix);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }
}
