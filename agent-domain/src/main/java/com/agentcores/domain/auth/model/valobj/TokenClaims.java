package com.agentcores.domain.auth.model.valobj;

import com.agentcores.types.enums.UserRoleEnum;

import java.time.Instant;

/**
 * 令牌声明。
 * <p>
 * 访问令牌携带用户、租户、角色；刷新令牌的 tokenId 即轮换标识，服务端使用后失效。
 * </p>
 *
 * @param kind 令牌种类
 * @param userId sub
 * @param tenantId tid
 * @param role role，刷新令牌为 null
 * @param familyId fam，令牌族
 * @param tokenId jti
 * @param issuedAt iat
 * @param expiresAt exp
 */
public record TokenClaims(TokenKind kind,
                          Long userId,
                          Long tenantId,
                          UserRoleEnum role,
                          String familyId,
                          String tokenId,
                          Instant issuedAt,
                          Instant expiresAt) {

    public boolean isExpiredAt(Instant now) {
        return expiresAt == null || !expiresAt.isAfter(now);
    }

    public TenantContext toTenantContext() {
        return new TenantContext(tenantId, userId, role, familyId);
    }
}
