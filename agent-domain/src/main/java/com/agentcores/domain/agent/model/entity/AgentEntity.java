package com.agentcores.domain.agent.model.entity;

import com.agentcores.types.enums.AgentStatusEnum;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * Agent 领域实体
 *
 * @author agentcores
 * @since 2026-03-03
 */
@Data
public class AgentEntity {

    /**
     * 主键 ID
     */
    private Long id;

    /**
     * 所属租户 ID
     */
    private Long tenantId;

    /**
     * 名称（租户内唯一）
     */
    private String name;

    /**
     * 声明类型（自由文本，如 text_processing / api_calls）
     */
    private String agentType;

    private String description;

    /**
     * 状态
     */
    private AgentStatusEnum status;

    /**
     * 配置 (JSONB)
     */
    private Map<String, Object> configuration;

    private Long createdBy;

    /**
     * 版本号 (乐观锁)
     */
    private Integer version;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    public void validate() {
        if (tenantId == null) {
            throw new IllegalStateException("Tenant ID cannot be null");
        }
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalStateException("Agent name cannot be empty");
        }
        if (status == null) {
            throw new IllegalStateException("Status cannot be null");
        }
        if (configuration == null) {
            throw new IllegalStateException("Configuration cannot be null");
        }
    }

    public boolean isTerminated() {
        return status == AgentStatusEnum.TERMINATED;
    }

    public boolean acceptsTasks() {
        return status != null && status.acceptsTasks();
    }

    public void terminate() {
        this.status = AgentStatusEnum.TERMINATED;
        this.updatedAt = LocalDateTime.now();
    }
}
