package com.agentcores.domain.auth.model.valobj;

import com.agentcores.types.enums.UserRoleEnum;

import java.util.Objects;

/**
 * 已解析的租户上下文。
 * <p>
 * 由访问令牌构造，请求生命周期内不可变。所有租户范围的仓储方法都以它为必填参数，
 * 查询条件中的 tenant_id 只来源于这里，不接受客户端传入。
 * </p>
 *
 * @param tenantId 租户 ID
 * @param userId 用户 ID；后台执行器上下文为 null
 * @param role 角色；后台执行器上下文为 null
 * @param tokenFamilyId 会话所属令牌族；后台执行器上下文为 null
 */
public record TenantContext(Long tenantId, Long userId, UserRoleEnum role, String tokenFamilyId) {

    public TenantContext {
        Objects.requireNonNull(tenantId, "tenantId");
    }

    /**
     * 后台执行器使用的上下文，只携带任务所属租户。
     */
    public static TenantContext worker(Long tenantId) {
        return new TenantContext(tenantId, null, null, null);
    }

    public boolean ownsTenant(Long resourceTenantId) {
        return resourceTenantId != null && tenantId.equals(resourceTenantId);
    }
}
