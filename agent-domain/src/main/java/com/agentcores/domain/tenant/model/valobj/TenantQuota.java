package com.agentcores.domain.tenant.model.valobj;

/**
 * 等级配额。
 *
 * @param maxAgents Agent 数量上限
 * @param maxTasksPerHour 每小时可进入 RUNNING 的任务数
 */
public record TenantQuota(int maxAgents, int maxTasksPerHour) {

    public TenantQuota {
        if (maxAgents < 0 || maxTasksPerHour < 0) {
            throw new IllegalArgumentException("Tenant quota must be non-negative");
        }
    }
}
