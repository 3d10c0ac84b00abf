package com.agentcores.domain.audit.model.entity;

import com.agentcores.types.enums.AuditEventTypeEnum;
import com.agentcores.types.enums.AuditOutcomeEnum;
import com.agentcores.types.enums.CapabilityEnum;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 审计日志领域实体。只追加，不修改。
 *
 * @author agentcores
 * @since 2026-03-03
 */
@Data
public class AuditLogEntity {

    private Long id;

    /**
     * 所属租户（跨租户访问记录在发起方租户下）
     */
    private Long tenantId;

    /**
     * 操作者用户 ID，后台执行器为 null
     */
    private Long actorUserId;

    private AuditEventTypeEnum eventType;

    private String targetType;

    private String targetId;

    /**
     * 授权判定涉及的能力
     */
    private CapabilityEnum capability;

    private AuditOutcomeEnum outcome;

    private Map<String, Object> detail;

    private LocalDateTime createdAt;

    /**
     * 创建授权判定记录。
     */
    public static AuditLogEntity authorization(Long tenantId,
                                               Long actorUserId,
                                               CapabilityEnum capability,
                                               boolean allowed,
                                               String targetType,
                                               Object targetId,
                                               String reason) {
        AuditLogEntity entity = base(tenantId, actorUserId, AuditEventTypeEnum.AUTHORIZATION, targetType, targetId);
        entity.setCapability(capability);
        entity.setOutcome(allowed ? AuditOutcomeEnum.ALLOWED : AuditOutcomeEnum.DENIED);
        if (reason != null) {
            entity.getDetail().put("reason", reason);
        }
        return entity;
    }

    /**
     * 创建任务状态流转记录。
     */
    public static AuditLogEntity transition(Long tenantId,
                                            Long actorUserId,
                                            Long taskId,
                                            String from,
                                            String to,
                                            String cause) {
        AuditLogEntity entity = base(tenantId, actorUserId, AuditEventTypeEnum.TASK_TRANSITION, "task", taskId);
        entity.setOutcome(AuditOutcomeEnum.TRANSITION);
        entity.getDetail().put("from", from);
        entity.getDetail().put("to", to);
        if (cause != null) {
            entity.getDetail().put("cause", cause);
        }
        return entity;
    }

    /**
     * 创建普通事件记录。
     */
    public static AuditLogEntity event(Long tenantId,
                                       Long actorUserId,
                                       AuditEventTypeEnum eventType,
                                       AuditOutcomeEnum outcome,
                                       String targetType,
                                       Object targetId) {
        AuditLogEntity entity = base(tenantId, actorUserId, eventType, targetType, targetId);
        entity.setOutcome(outcome);
        return entity;
    }

    public AuditLogEntity with(String key, Object value) {
        if (value != null) {
            this.detail.put(key, value);
        }
        return this;
    }

    private static AuditLogEntity base(Long tenantId,
                                       Long actorUserId,
                                       AuditEventTypeEnum eventType,
                                       String targetType,
                                       Object targetId) {
        AuditLogEntity entity = new AuditLogEntity();
        entity.setTenantId(tenantId);
        entity.setActorUserId(actorUserId);
        entity.setEventType(eventType);
        entity.setTargetType(targetType);
        entity.setTargetId(targetId == null ? null : String.valueOf(targetId));
        entity.setDetail(new LinkedHashMap<>());
        entity.setCreatedAt(LocalDateTime.now());
        return entity;
    }
}
