package com.agentsearch.config;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.agentsearch.exception.BackendConfigurationException;

import lombok.extern.slf4j.Slf4j;

/**
 * The one bounded worker pool used for page fetches. Shared by every pipeline
 * run in the process; shut down with the application context.
 */
@Slf4j
@Configuration
public class FetchPoolConfig {

    @Bean(destroyMethod = "shutdown")
    public ExecutorService pageFetchExecutor(AgentSearchProperties properties) {
        int workers = properties.getMaxWorkers();
        if (workers < 1) {
            throw new BackendConfigurationException(
                "agent-search.deep-search.max-workers must be at least 1, got " + workers);
        }
        log.info("Page fetch pool: {} workers", workers);
        return Executors.newFixedThreadPool(workers, namedThreads("page-fetch-"));
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
