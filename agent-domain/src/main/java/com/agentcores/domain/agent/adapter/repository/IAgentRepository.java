package com.agentcores.domain.agent.adapter.repository;

import com.agentcores.domain.agent.model.entity.AgentEntity;
import com.agentcores.domain.auth.model.valobj.TenantContext;
import com.agentcores.types.enums.AgentStatusEnum;

import java.util.List;

/**
 * Agent 仓储接口
 *
 * @author agentcores
 * @since 2026-03-03
 */
public interface IAgentRepository {

    /**
     * 保存 Agent。租户内重名时抛出 DUPLICATE_AGENT_NAME。
     */
    AgentEntity save(AgentEntity entity);

    /**
     * 更新 Agent (带乐观锁)
     */
    AgentEntity update(TenantContext context, AgentEntity entity);

    /**
     * 根据 ID 查询，跨租户返回 null
     */
    AgentEntity findById(TenantContext context, Long id);

    /**
     * 查询租户内未终止的 Agent
     */
    List<AgentEntity> findByTenant(TenantContext context);

    /**
     * 按名称查询
     */
    AgentEntity findByName(TenantContext context, String name);

    /**
     * 统计租户内未终止的 Agent 数量
     */
    long countActive(TenantContext context);

    /**
     * 条件更新状态（当前状态为 expected 时才更新）
     */
    boolean transitionStatus(TenantContext context, Long agentId, AgentStatusEnum expected, AgentStatusEnum target);
}
