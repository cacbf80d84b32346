package com.example.concierge.assistant.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.util.concurrent.ThreadPoolExecutor;

@Configuration
public class AssistantConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    /** Blocking upstream calls; one task per source per searched date. */
    @Bean(name = "sourceExecutor")
    public ThreadPoolTaskExecutor sourceExecutor(AssistantSearchProperties props) {
        return pool("source-", props.getSourcePoolSize(), 200);
    }

    /** CPU-only reconciliation, kept off the request threads. */
    @Bean(name = "reconcileExecutor")
    public ThreadPoolTaskExecutor reconcileExecutor(AssistantSearchProperties props) {
        return pool("reconcile-", props.getReconcilePoolSize(), 100);
    }

    @Bean(name = "turnExecutor")
    public ThreadPoolTaskExecutor turnExecutor(AssistantSearchProperties props) {
        return pool("turn-", props.getTurnPoolSize(), 100);
    }

    private static ThreadPoolTaskExecutor pool(String prefix, int size, int queue) {
        ThreadPoolTaskExecutor ex = new ThreadPoolTaskExecutor();
        ex.setCorePoolSize(Math.max(1, size));
        ex.setMaxPoolSize(Math.max(1, size) * 2);
        ex.setQueueCapacity(queue);
        ex.setThreadNamePrefix(prefix);
        ex.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        ex.setWaitForTasksToCompleteOnShutdown(true);
        ex.setAwaitTerminationSeconds(10);
        ex.initialize();
        return ex;
    }
}
