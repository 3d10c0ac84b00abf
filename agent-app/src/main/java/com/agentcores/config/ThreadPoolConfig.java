package com.agentcores.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 任务执行线程池配置类。
 * <p>
 * 支持的拒绝策略：AbortPolicy（默认）、DiscardPolicy、DiscardOldestPolicy、CallerRunsPolicy。
 * 非 AbortPolicy 时被丢弃的任务不会立即记为失败，只能等租约到期后由回收任务处理。
 * </p>
 *
 * @author agentcores
 * @since 2026-03-06
 */
@Slf4j
@Configuration
public class ThreadPoolConfig {

    /**
     * Task 执行专用线程池：
     * 1) 与调度线程解耦，轮询线程不会被 api_call / delay 阻塞；
     * 2) 默认 queue-capacity=0，claim 后立即开始执行，租约计时与实际执行对齐。
     */
    @Bean(name = "taskExecutionWorker", destroyMethod = "shutdown")
    @ConditionalOnMissingBean(name = "taskExecutionWorker")
    public ThreadPoolExecutor taskExecutionWorker(
            @Value("${executor.worker.core-size:8}") int coreSize,
            @Value("${executor.worker.max-size:8}") int maxSize,
            @Value("${executor.worker.keep-alive-seconds:60}") long keepAliveSeconds,
            @Value("${executor.worker.queue-capacity:0}") int queueCapacity,
            @Value("${executor.worker.rejection-policy:AbortPolicy}") String rejectionPolicy,
            @Value("${executor.worker.thread-name-prefix:task-exec-worker-}") String threadNamePrefix) {
        int normalizedCoreSize = Math.max(coreSize, 1);
        int normalizedMaxSize = Math.max(maxSize, normalizedCoreSize);
        int normalizedQueueCapacity = Math.max(queueCapacity, 0);
        BlockingQueue<Runnable> queue = normalizedQueueCapacity == 0
                ? new SynchronousQueue<>()
                : new LinkedBlockingQueue<>(normalizedQueueCapacity);
        AtomicInteger threadIndex = new AtomicInteger(0);
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName(threadNamePrefix + threadIndex.incrementAndGet());
            thread.setDaemon(false);
            return thread;
        };
        ThreadPoolExecutor executor = new ThreadPoolExecutor(
                normalizedCoreSize,
                normalizedMaxSize,
                Math.max(keepAliveSeconds, 0L),
                TimeUnit.SECONDS,
                queue,
                threadFactory,
                buildRejectedExecutionHandler(rejectionPolicy));
        log.info("TASK_WORKER_POOL_READY coreSize={}, maxSize={}, queueCapacity={}, rejectionPolicy={}",
                normalizedCoreSize, normalizedMaxSize, normalizedQueueCapacity, rejectionPolicy);
        return executor;
    }

    static RejectedExecutionHandler buildRejectedExecutionHandler(String policy) {
        if ("DiscardPolicy".equals(policy)) {
            return new ThreadPoolExecutor.DiscardPolicy();
        }
        if ("DiscardOldestPolicy".equals(policy)) {
            return new ThreadPoolExecutor.DiscardOldestPolicy();
        }
        if ("CallerRunsPolicy".equals(policy)) {
            return new ThreadPoolExecutor.CallerRunsPolicy();
        }
        if ("AbortPolicy".equals(policy)) {
            return new ThreadPoolExecutor.AbortPolicy();
        }
        log.warn("Unknown rejection policy '{}', fallback to AbortPolicy", policy);
        return new ThreadPoolExecutor.AbortPolicy();
    }

}
