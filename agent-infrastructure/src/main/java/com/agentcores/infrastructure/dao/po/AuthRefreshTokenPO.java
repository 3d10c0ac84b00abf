package com.agentcores.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 刷新令牌轮换记录 PO
 *
 * @author agentcores
 * @since 2026-03-05
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuthRefreshTokenPO {

    /**
     * jti
     */
    private String tokenId;
    private String familyId;
    private Long tenantId;
    private Long userId;
    private LocalDateTime issuedAt;
    private LocalDateTime expiresAt;
    private Boolean consumed;
    private LocalDateTime consumedAt;
}
