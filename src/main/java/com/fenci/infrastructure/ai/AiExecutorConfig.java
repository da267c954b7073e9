package com.fenci.infrastructure.ai;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Dedicated pool for model calls, kept off the common fork-join pool. Requests beyond the
 * queue are rejected and the caller falls back to smart mode.
 */
@Slf4j
@Configuration
public class AiExecutorConfig {

    @Value("${ai.executor.pool-size:4}")
    private int poolSize;

    @Value("${ai.executor.queue-capacity:16}")
    private int queueCapacity;

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService aiExecutor() {
        AtomicInteger threadCount = new AtomicInteger();
        ThreadPoolExecutor executor = new ThreadPoolExecutor(
                poolSize, poolSize, 60L, TimeUnit.SECONDS,
                new ArrayBlockingQueue<>(queueCapacity),
                r -> {
                    Thread t = new Thread(r, "ai-segment-" + threadCount.incrementAndGet());
                    t.setDaemon(true);
                    return t;
                },
                new ThreadPoolExecutor.AbortPolicy());
        executor.allowCoreThreadTimeOut(true);
        log.info("[AiExecutorConfig] AI executor ready (threads={}, queue={})", poolSize, queueCapacity);
        return executor;
    }
}
