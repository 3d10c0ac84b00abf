package com.agentcores.domain.task.service;

import com.agentcores.domain.task.model.entity.AgentTaskEntity;
import com.agentcores.domain.task.model.valobj.DispatchError;
import com.agentcores.domain.task.model.valobj.DispatchOutcome;
import com.agentcores.domain.task.model.valobj.RetryBackoffPolicy;
import com.agentcores.types.enums.ResponseCode;
import com.agentcores.types.enums.TaskStatusEnum;

import java.time.LocalDateTime;

/**
 * Task 生命周期领域服务：把一次执行结果应用到持有租约的任务上。
 * <p>
 * 每次失败计入一次重试；计入后仍低于 max_retries 时回到 PENDING 并进入退避，
 * 否则进入终态 FAILED，最后一次错误写入输出。retry_count 永不超过 max_retries。
 * </p>
 */
public class TaskLifecycleDomainService {

    private final RetryBackoffPolicy backoffPolicy;

    public TaskLifecycleDomainService(RetryBackoffPolicy backoffPolicy) {
        this.backoffPolicy = backoffPolicy;
    }

    /**
     * 应用分派结果。调用方已确认任务仍由当前执行者持有。
     */
    public Decision applyOutcome(AgentTaskEntity task, DispatchOutcome outcome, LocalDateTime now) {
        if (task.isCancelRequested()) {
            task.finishCancelled(now);
            return Decision.CANCELLED;
        }
        if (outcome.isSuccess()) {
            task.complete(outcome.output(), now);
            return Decision.COMPLETED;
        }
        return applyFailure(task, outcome.error(), now);
    }

    /**
     * 应用一次失败（执行错误、超时或租约过期）。
     */
    public Decision applyFailure(AgentTaskEntity task, DispatchError error, LocalDateTime now) {
        if (task.isCancelRequested()) {
            task.finishCancelled(now);
            return Decision.CANCELLED;
        }
        int priorRetryCount = task.normalizedRetryCount();
        if (priorRetryCount + 1 < task.normalizedMaxRetries()) {
            LocalDateTime retryAt = now.plus(backoffPolicy.delayFor(priorRetryCount));
            task.scheduleRetry(error.summary(), retryAt, now);
            return Decision.RETRY_SCHEDULED;
        }
        task.failTerminally(error.summary(), error.toOutput(), now);
        return Decision.FAILED;
    }

    /**
     * 本进程看门狗到点：视作一次超时失败，已登记取消请求时直接取消。
     */
    public Decision applyTimeout(AgentTaskEntity task, LocalDateTime now) {
        DispatchError error = DispatchError.of(ResponseCode.TIMEOUT,
                "Execution exceeded " + task.getTimeoutSeconds() + "s");
        return applyFailure(task, error, now);
    }

    /**
     * 持有者已不在（实例崩溃），租约到期后被回收：同样计入一次失败。
     */
    public Decision applyLeaseExpired(AgentTaskEntity task, LocalDateTime now) {
        DispatchError error = DispatchError.of(ResponseCode.LEASE_EXPIRED,
                "Lease expired after " + task.getTimeoutSeconds() + "s without completion");
        return applyFailure(task, error, now);
    }

    /**
     * 运行中任务被取消，执行被放弃，结果不再回写。
     */
    public Decision applyCancelled(AgentTaskEntity task, LocalDateTime now) {
        task.finishCancelled(now);
        return Decision.CANCELLED;
    }

    /**
     * 结果决策，附带审计用的状态流转路径。
     */
    public enum Decision {
        COMPLETED(TaskStatusEnum.COMPLETED),
        RETRY_SCHEDULED(TaskStatusEnum.FAILED, TaskStatusEnum.PENDING),
        FAILED(TaskStatusEnum.FAILED),
        CANCELLED(TaskStatusEnum.CANCELLED);

        private final TaskStatusEnum[] path;

        Decision(TaskStatusEnum... path) {
            this.path = path;
        }

        /**
         * 从 RUNNING 出发依次经过的状态。
         */
        public TaskStatusEnum[] path() {
            return path.clone();
        }

        public TaskStatusEnum finalStatus() {
            return path[path.length - 1];
        }
    }
}
