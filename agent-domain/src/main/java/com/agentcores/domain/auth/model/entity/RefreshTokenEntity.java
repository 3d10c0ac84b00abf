package com.agentcores.domain.auth.model.entity;

import lombok.Data;

import java.time.LocalDateTime;

/**
 * 刷新令牌的服务端轮换记录。tokenId 对应令牌内的 jti。
 */
@Data
public class RefreshTokenEntity {

    private String tokenId;

    private String familyId;

    private Long tenantId;

    private Long userId;

    private LocalDateTime issuedAt;

    private LocalDateTime expiresAt;

    private Boolean consumed;

    private LocalDateTime consumedAt;

    public boolean isConsumed() {
        return Boolean.TRUE.equals(consumed);
    }
}
