package com.agentcores.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * 调度器隔离配置：
 * 1) taskExecutorScheduler 承载任务 claim 轮询；
 * 2) taskWatchdogScheduler 承载每次执行的超时看门狗，停机时不等待未到期的看门狗；
 * 3) daemonScheduler 承载租约回收等守护任务。
 */
@Slf4j
@Configuration
public class SchedulingConfig {

    @Bean(name = "taskExecutorScheduler")
    public ThreadPoolTaskScheduler taskExecutorScheduler(
            @Value("${scheduling.task-executor.pool-size:1}") int poolSize,
            @Value("${scheduling.task-executor.await-termination-seconds:30}") int awaitTerminationSeconds) {
        return buildScheduler(poolSize, "task-executor-scheduler-", true, awaitTerminationSeconds);
    }

    @Bean(name = "taskWatchdogScheduler")
    public ThreadPoolTaskScheduler taskWatchdogScheduler(
            @Value("${scheduling.watchdog.pool-size:2}") int poolSize) {
        return buildScheduler(poolSize, "task-watchdog-", false, 0);
    }

    @Bean(name = "daemonScheduler")
    public ThreadPoolTaskScheduler daemonScheduler(
            @Value("${scheduling.daemon.pool-size:1}") int poolSize,
            @Value("${scheduling.daemon.await-termination-seconds:30}") int awaitTerminationSeconds) {
        return buildScheduler(poolSize, "daemon-scheduler-", true, awaitTerminationSeconds);
    }

    private ThreadPoolTaskScheduler buildScheduler(int poolSize,
                                                   String threadNamePrefix,
                                                   boolean waitOnShutdown,
                                                   int awaitTerminationSeconds) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(Math.max(poolSize, 1));
        scheduler.setThreadNamePrefix(threadNamePrefix);
        scheduler.setWaitForTasksToCompleteOnShutdown(waitOnShutdown);
        scheduler.setAwaitTerminationSeconds(Math.max(awaitTerminationSeconds, 0));
        // 看门狗在任务正常结束时被取消，需要立即移出队列
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setErrorHandler(throwable ->
                log.error("SCHEDULED_TASK_FAILED scheduler={}, error={}",
                        threadNamePrefix, throwable.getMessage(), throwable));
        return scheduler;
    }
}
