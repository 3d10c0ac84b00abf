package com.agentcores.domain.tenant.model.entity;

import com.agentcores.domain.tenant.model.valobj.TenantQuota;
import com.agentcores.types.enums.TenantTierEnum;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 租户领域实体
 *
 * @author agentcores
 * @since 2026-03-03
 */
@Data
public class TenantEntity {

    /**
     * 主键 ID
     */
    private Long id;

    /**
     * 展示名称（全局唯一）
     */
    private String name;

    /**
     * URL 友好的唯一标识，可作为登录时的租户选择器
     */
    private String slug;

    /**
     * 订阅等级
     */
    private TenantTierEnum tier;

    /**
     * Agent 数量上限
     */
    private Integer maxAgents;

    /**
     * 每小时进入 RUNNING 的任务数上限
     */
    private Integer maxTasksPerHour;

    /**
     * 是否启用（租户只做软停用）
     */
    private Boolean active;

    private Integer version;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    public void validate() {
        if (name == null || name.isBlank()) {
            throw new IllegalStateException("Tenant name cannot be empty");
        }
        if (slug == null || slug.isBlank()) {
            throw new IllegalStateException("Tenant slug cannot be empty");
        }
        if (tier == null) {
            throw new IllegalStateException("Tenant tier cannot be null");
        }
        if (maxAgents == null || maxAgents < 0 || maxTasksPerHour == null || maxTasksPerHour < 0) {
            throw new IllegalStateException("Tenant limits must be non-negative");
        }
    }

    /**
     * 按等级配额初始化资源上限。
     */
    public void applyQuota(TenantQuota quota) {
        this.maxAgents = quota.maxAgents();
        this.maxTasksPerHour = quota.maxTasksPerHour();
    }

    public void rename(String newName) {
        this.name = newName;
        this.updatedAt = LocalDateTime.now();
    }

    public boolean isActive() {
        return Boolean.TRUE.equals(active);
    }

    public int hourlyTaskLimit() {
        return maxTasksPerHour == null ? 0 : Math.max(maxTasksPerHour, 0);
    }
}
