package com.agentcores.domain.task.model.entity;

import com.agentcores.types.common.Constants;
import com.agentcores.types.enums.ResponseCode;
import com.agentcores.types.enums.TaskStatusEnum;
import com.agentcores.types.enums.TaskTypeEnum;
import com.agentcores.types.exception.AppException;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * 任务领域实体
 *
 * @author agentcores
 * @since 2026-03-04
 */
@Data
public class AgentTaskEntity {

    /**
     * 主键 ID
     */
    private Long id;

    /**
     * 所属租户 ID（与所属 Agent 的租户一致）
     */
    private Long tenantId;

    /**
     * 所属 Agent ID
     */
    private Long agentId;

    /**
     * 任务类型
     */
    private TaskTypeEnum taskType;

    /**
     * 优先级 0..10，越大越先调度
     */
    private Integer priority;

    /**
     * 状态
     */
    private TaskStatusEnum status;

    /**
     * 输入 (JSONB)
     */
    private Map<String, Object> inputData;

    /**
     * 输出 (JSONB)，终态前为 null；终态失败时保存最后一次错误
     */
    private Map<String, Object> outputData;

    /**
     * 已失败并计入重试的次数，恒不大于 maxRetries
     */
    private Integer retryCount;

    /**
     * 最大重试次数
     */
    private Integer maxRetries;

    /**
     * 超时秒数，同时是执行租约时长
     */
    private Integer timeoutSeconds;

    /**
     * 最近一次失败原因
     */
    private String lastError;

    /**
     * 最早可再次调度的时间（重试退避）
     */
    private LocalDateTime nextRunAt;

    /**
     * 运行中收到的取消请求
     */
    private Boolean cancelRequested;

    /**
     * claim 持有者
     */
    private String claimOwner;

    /**
     * claim 时间
     */
    private LocalDateTime claimAt;

    /**
     * lease 过期时间
     */
    private LocalDateTime leaseUntil;

    /**
     * 执行代际（每次 claim 递增）
     */
    private Integer executionAttempt;

    /**
     * 版本号 (乐观锁)
     */
    private Integer version;

    private Long createdBy;

    private LocalDateTime createdAt;

    private LocalDateTime startedAt;

    private LocalDateTime completedAt;

    private LocalDateTime updatedAt;

    /**
     * 验证任务是否有效
     */
    public void validate() {
        if (tenantId == null) {
            throw new IllegalStateException("Tenant ID cannot be null");
        }
        if (agentId == null) {
            throw new IllegalStateException("Agent ID cannot be null");
        }
        if (taskType == null) {
            throw new IllegalStateException("Task type cannot be null");
        }
        if (status == null) {
            throw new IllegalStateException("Status cannot be null");
        }
        if (priority == null || priority < Constants.MIN_PRIORITY || priority > Constants.MAX_PRIORITY) {
            throw new IllegalStateException("Priority out of range: " + priority);
        }
        if (timeoutSeconds == null || timeoutSeconds <= 0) {
            throw new IllegalStateException("Timeout seconds must be positive");
        }
        if (maxRetries == null || maxRetries < 0) {
            throw new IllegalStateException("Max retries must be non-negative");
        }
        if (normalizedRetryCount() > maxRetries) {
            throw new IllegalStateException("Retry count exceeds max retries");
        }
    }

    /**
     * 是否满足 PENDING -> RUNNING 的前置条件（不含配额与并发）。
     */
    public boolean isDispatchable(LocalDateTime now) {
        return status == TaskStatusEnum.PENDING
                && !Boolean.TRUE.equals(cancelRequested)
                && (nextRunAt == null || !nextRunAt.isAfter(now));
    }

    /**
     * PENDING -> RUNNING，取得租约。
     */
    public void claim(String owner, int nextAttempt, LocalDateTime now) {
        if (owner == null || owner.isBlank()) {
            throw new IllegalStateException("Claim owner cannot be empty");
        }
        if (status != TaskStatusEnum.PENDING) {
            throw invalidTransition(TaskStatusEnum.RUNNING);
        }
        this.claimOwner = owner;
        this.claimAt = now;
        this.leaseUntil = now.plusSeconds(Math.max(timeoutSeconds == null ? 1 : timeoutSeconds, 1));
        this.executionAttempt = nextAttempt;
        this.status = TaskStatusEnum.RUNNING;
        this.startedAt = now;
        this.updatedAt = now;
    }

    /**
     * RUNNING -> COMPLETED
     */
    public void complete(Map<String, Object> output, LocalDateTime now) {
        requireRunning(TaskStatusEnum.COMPLETED);
        this.status = TaskStatusEnum.COMPLETED;
        this.outputData = output;
        this.lastError = null;
        this.completedAt = now;
        this.leaseUntil = null;
        this.updatedAt = now;
    }

    /**
     * RUNNING -> FAILED -> PENDING：计入一次重试并进入退避。
     */
    public void scheduleRetry(String error, LocalDateTime retryAt, LocalDateTime now) {
        requireRunning(TaskStatusEnum.PENDING);
        if (!hasRetryBudget()) {
            throw new IllegalStateException("Retry budget exhausted for task: " + id);
        }
        this.retryCount = normalizedRetryCount() + 1;
        this.status = TaskStatusEnum.PENDING;
        this.lastError = error;
        this.nextRunAt = retryAt;
        this.leaseUntil = null;
        this.updatedAt = now;
    }

    /**
     * RUNNING -> FAILED（终态），错误保存在输出中。
     */
    public void failTerminally(String error, Map<String, Object> errorOutput, LocalDateTime now) {
        requireRunning(TaskStatusEnum.FAILED);
        if (hasRetryBudget()) {
            this.retryCount = normalizedRetryCount() + 1;
        }
        this.status = TaskStatusEnum.FAILED;
        this.lastError = error;
        this.outputData = errorOutput;
        this.completedAt = now;
        this.leaseUntil = null;
        this.updatedAt = now;
    }

    /**
     * 用户取消：PENDING 直接取消；RUNNING 只记录取消请求，由持有租约的执行者收尾。
     *
     * @return true 表示已进入 CANCELLED，false 表示已登记取消请求
     */
    public boolean cancel(LocalDateTime now) {
        if (status == TaskStatusEnum.PENDING) {
            this.status = TaskStatusEnum.CANCELLED;
            this.completedAt = now;
            this.updatedAt = now;
            return true;
        }
        if (status == TaskStatusEnum.RUNNING) {
            if (Boolean.TRUE.equals(cancelRequested)) {
                throw invalidTransition(TaskStatusEnum.CANCELLED);
            }
            this.cancelRequested = true;
            this.updatedAt = now;
            return false;
        }
        throw invalidTransition(TaskStatusEnum.CANCELLED);
    }

    /**
     * RUNNING -> CANCELLED，执行者观察到取消请求后收尾。
     */
    public void finishCancelled(LocalDateTime now) {
        requireRunning(TaskStatusEnum.CANCELLED);
        this.status = TaskStatusEnum.CANCELLED;
        this.completedAt = now;
        this.leaseUntil = null;
        this.updatedAt = now;
    }

    public boolean isClaimOwner(String owner, Integer attempt) {
        if (owner == null || attempt == null) {
            return false;
        }
        return owner.equals(this.claimOwner) && attempt.equals(this.executionAttempt);
    }

    public boolean isLeaseExpired(LocalDateTime now) {
        return status == TaskStatusEnum.RUNNING && leaseUntil != null && !leaseUntil.isAfter(now);
    }

    public boolean isCancelRequested() {
        return Boolean.TRUE.equals(cancelRequested);
    }

    /**
     * 终态：COMPLETED、CANCELLED，以及预算耗尽后的 FAILED。
     */
    public boolean isTerminal() {
        return status == TaskStatusEnum.COMPLETED
                || status == TaskStatusEnum.CANCELLED
                || status == TaskStatusEnum.FAILED;
    }

    public boolean hasRetryBudget() {
        return normalizedRetryCount() < normalizedMaxRetries();
    }

    public int normalizedRetryCount() {
        return retryCount == null ? 0 : Math.max(retryCount, 0);
    }

    public int normalizedMaxRetries() {
        return maxRetries == null ? 0 : Math.max(maxRetries, 0);
    }

    public int nextExecutionAttempt() {
        return executionAttempt == null ? 1 : executionAttempt + 1;
    }

    private void requireRunning(TaskStatusEnum target) {
        if (status != TaskStatusEnum.RUNNING) {
            throw invalidTransition(target);
        }
    }

    private AppException invalidTransition(TaskStatusEnum target) {
        return new AppException(ResponseCode.INVALID_TRANSITION,
                "Task " + id + " cannot transition from " + (status == null ? null : status.getCode())
                        + " to " + target.getCode());
    }
}
