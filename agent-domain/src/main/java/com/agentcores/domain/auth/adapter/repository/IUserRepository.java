package com.agentcores.domain.auth.adapter.repository;

import com.agentcores.domain.auth.model.entity.UserEntity;
import com.agentcores.domain.auth.model.valobj.TenantContext;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 用户仓储接口
 *
 * @author agentcores
 * @since 2026-03-03
 */
public interface IUserRepository {

    /**
     * 保存用户。同租户内邮箱冲突时抛出 DUPLICATE_EMAIL。
     */
    UserEntity save(UserEntity entity);

    /**
     * 更新用户 (带乐观锁)
     */
    UserEntity update(TenantContext context, UserEntity entity);

    /**
     * 记录最近登录时间，不参与乐观锁
     */
    void touchLastLogin(TenantContext context, LocalDateTime loginAt);

    /**
     * 根据 ID 查询，只返回上下文租户内的用户
     */
    UserEntity findById(TenantContext context, Long id);

    /**
     * 查询租户内全部用户
     */
    List<UserEntity> findByTenant(TenantContext context);

    /**
     * 登录前按租户和邮箱查询
     */
    UserEntity findByTenantAndEmail(Long tenantId, String email);

    /**
     * 统计租户内启用的 owner 数量
     */
    long countActiveOwners(TenantContext context);
}
