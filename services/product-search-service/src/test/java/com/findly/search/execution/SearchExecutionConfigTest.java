package com.findly.search.execution;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class SearchExecutionConfigTest {

    private final SearchExecutionConfig config = new SearchExecutionConfig();

    @Test
    void poolsUseConfiguredQueueCapacities() {
        SearchExecutionProperties properties = new SearchExecutionProperties();
        properties.setPoolSize(3);
        properties.setSearchQueueCapacity(7);
        properties.setAuxQueueCapacity(0);

        ThreadPoolExecutor search = (ThreadPoolExecutor) config.searchExecutor(properties);
        ThreadPoolExecutor aux = (ThreadPoolExecutor) config.auxiliaryExecutor(properties);
        try {
            assertThat(search.getMaximumPoolSize()).isEqualTo(3);
            assertThat(search.getQueue().remainingCapacity()).isEqualTo(7);
            assertThat(aux.getQueue().remainingCapacity()).isEqualTo(1);
        } finally {
            search.shutdown();
            aux.shutdown();
        }
    }

    @Test
    void fullQueueRejectsSubmissions() throws Exception {
        ExecutorService pool = SearchExecutionConfig.boundedPool(1, 1);
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch started = new CountDownLatch(1);
        try {
            pool.submit(() -> {
                started.countDown();
                release.await();
                return null;
            });
            assertThat(started.await(2, TimeUnit.SECONDS)).isTrue();
            pool.submit(() -> null);

            assertThatThrownBy(() -> pool.submit(() -> null)).isInstanceOf(RejectedExecutionException.class);
        } finally {
            release.countDown();
            pool.shutdownNow();
        }
    }
}
