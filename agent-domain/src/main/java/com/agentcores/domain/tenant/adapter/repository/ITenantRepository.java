package com.agentcores.domain.tenant.adapter.repository;

import com.agentcores.domain.auth.model.valobj.TenantContext;
import com.agentcores.domain.tenant.model.entity.TenantEntity;

/**
 * 租户仓储接口
 *
 * @author agentcores
 * @since 2026-03-03
 */
public interface ITenantRepository {

    /**
     * 保存租户。名称或 slug 冲突时抛出 DUPLICATE_TENANT。
     */
    TenantEntity save(TenantEntity entity);

    /**
     * 更新当前租户 (带乐观锁)
     */
    TenantEntity update(TenantContext context, TenantEntity entity);

    /**
     * 查询当前上下文所属租户
     */
    TenantEntity findCurrent(TenantContext context);

    /**
     * 登录前按 ID 解析租户选择器
     */
    TenantEntity findById(Long id);

    /**
     * 登录前按 slug 解析租户选择器
     */
    TenantEntity findBySlug(String slug);

    /**
     * 名称或 slug 是否已被占用
     */
    boolean existsByNameOrSlug(String name, String slug);

    /**
     * 在当前事务内锁定当前租户行，串行化同一租户内依赖计数的检查（如最后一个 owner）。
     */
    void lockCurrent(TenantContext context);
}
