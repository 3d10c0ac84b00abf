package com.agentcores.domain.auth.model.entity;

import lombok.Data;

import java.time.LocalDateTime;

/**
 * 令牌族：一次登录派生出的所有令牌共享同一个族 ID。
 */
@Data
public class TokenFamilyEntity {

    private String id;

    private Long tenantId;

    private Long userId;

    private Boolean revoked;

    private String revokedReason;

    private LocalDateTime revokedAt;

    private LocalDateTime createdAt;

    public boolean isRevoked() {
        return Boolean.TRUE.equals(revoked);
    }
}
