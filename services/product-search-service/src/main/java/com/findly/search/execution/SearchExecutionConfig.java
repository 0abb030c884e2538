package com.findly.search.execution;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class SearchExecutionConfig {

    /**
     * Runs one search pipeline per task so the request thread can enforce the global timeout.
     * Submissions beyond the queue capacity are rejected.
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService searchExecutor(SearchExecutionProperties properties) {
        return boundedPool(Math.max(2, properties.getPoolSize()), properties.getSearchQueueCapacity());
    }

    /**
     * Hard-bounded side calls made from inside a pipeline (LLM price inference).
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService auxiliaryExecutor(SearchExecutionProperties properties) {
        return boundedPool(Math.max(1, properties.getAuxPoolSize()), properties.getAuxQueueCapacity());
    }

    /**
     * Single worker with a bounded queue; analytics events beyond capacity are rejected and dropped.
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService analyticsExecutor(SearchExecutionProperties properties) {
        return boundedPool(1, properties.getAnalyticsQueueCapacity());
    }

    static ThreadPoolExecutor boundedPool(int threads, int queueCapacity) {
        return new ThreadPoolExecutor(
            threads,
            threads,
            0L,
            TimeUnit.MILLISECONDS,
            new ArrayBlockingQueue<>(Math.max(1, queueCapacity)),
            new ThreadPoolExecutor.AbortPolicy()
        );
    }
}
