package com.agentcores.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 令牌族 PO
 *
 * @author agentcores
 * @since 2026-03-05
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuthTokenFamilyPO {

    private String id;
    private Long tenantId;
    private Long userId;
    private Boolean revoked;
    private String revokedReason;
    private LocalDateTime revokedAt;
    private LocalDateTime createdAt;
}
