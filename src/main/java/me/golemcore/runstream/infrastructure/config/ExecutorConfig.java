package me.golemcore.runstream.infrastructure.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Executors for run workers and tool invocations. Both are shut down with the
 * application context.
 */
@Configuration
@RequiredArgsConstructor
public class ExecutorConfig {

    private final RunStreamProperties properties;

    /**
     * One task per active run. Runs block on the upstream stream for their whole
     * lifetime, so the pool grows with the number of busy conversations.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService conversationRunExecutor() {
        return Executors.newCachedThreadPool(namedDaemonThreads("run-worker"));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService toolExecutor() {
        int poolSize = Math.max(1, properties.getTools().getPoolSize());
        return Executors.newFixedThreadPool(poolSize, namedDaemonThreads("tool"));
    }

    private static ThreadFactory namedDaemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
