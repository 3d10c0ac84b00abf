package com.agentcores.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 邀请 PO
 *
 * @author agentcores
 * @since 2026-03-05
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InvitationPO {

    private Long id;
    private Long tenantId;
    private String email;
    private String role;
    private String token;
    private Long invitedBy;
    private LocalDateTime expiresAt;
    private Boolean consumed;
    private LocalDateTime consumedAt;
    private LocalDateTime createdAt;
}
