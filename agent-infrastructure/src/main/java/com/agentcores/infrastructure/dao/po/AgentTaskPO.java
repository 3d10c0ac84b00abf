package com.agentcores.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 任务 PO
 *
 * @author agentcores
 * @since 2026-03-05
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentTaskPO {

    /**
     * 主键 ID
     */
    private Long id;

    /**
     * 租户 ID
     */
    private Long tenantId;

    /**
     * Agent ID (与 tenant_id 组成复合外键关联 agents)
     */
    private Long agentId;

    /**
     * 任务类型 code
     */
    private String taskType;

    private Integer priority;

    /**
     * 状态 code
     */
    private String status;

    /**
     * 输入 (JSONB)
     */
    private String inputData;

    /**
     * 输出 (JSONB)
     */
    private String outputData;

    /**
     * 当前重试次数
     */
    private Integer retryCount;

    /**
     * 最大重试次数
     */
    private Integer maxRetries;

    private Integer timeoutSeconds;

    private String lastError;

    private LocalDateTime nextRunAt;

    private Boolean cancelRequested;

    /**
     * claim 持有者
     */
    private String claimOwner;

    private LocalDateTime claimAt;

    /**
     * lease 过期时间
     */
    private LocalDateTime leaseUntil;

    /**
     * 执行代际
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
}
