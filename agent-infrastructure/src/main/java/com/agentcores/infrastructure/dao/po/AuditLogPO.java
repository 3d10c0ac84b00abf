package com.agentcores.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 审计日志 PO
 *
 * @author agentcores
 * @since 2026-03-05
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuditLogPO {

    private Long id;
    private Long tenantId;
    private Long actorUserId;
    private String eventType;
    private String targetType;
    private String targetId;
    private String capability;
    private String outcome;

    /**
     * 详情 (JSONB)
     */
    private String detail;
    private LocalDateTime createdAt;
}
