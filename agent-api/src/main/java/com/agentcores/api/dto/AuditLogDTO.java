package com.agentcores.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * 审计日志 DTO。
 */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class AuditLogDTO {

    private Long id;
    private Long tenantId;
    private Long actorUserId;
    private String eventType;
    private String targetType;
    private String targetId;
    private String capability;
    private String outcome;
    private Map<String, Object> detail;
    private LocalDateTime createdAt;
}
