package com.agentcores.infrastructure.repository.audit;

import com.agentcores.domain.audit.adapter.repository.IAuditLogRepository;
import com.agentcores.domain.audit.model.entity.AuditLogEntity;
import com.agentcores.domain.auth.model.valobj.TenantContext;
import com.agentcores.infrastructure.dao.AuditLogDao;
import com.agentcores.infrastructure.dao.po.AuditLogPO;
import com.agentcores.infrastructure.util.JsonCodec;
import com.agentcores.types.enums.AuditEventTypeEnum;
import com.agentcores.types.enums.AuditOutcomeEnum;
import com.agentcores.types.enums.CapabilityEnum;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * 审计日志仓储实现类。
 *
 * @author agentcores
 * @since 2026-03-05
 */
@Repository
public class AuditLogRepositoryImpl implements IAuditLogRepository {

    private final AuditLogDao auditLogDao;
    private final JsonCodec jsonCodec;

    public AuditLogRepositoryImpl(AuditLogDao auditLogDao, JsonCodec jsonCodec) {
        this.auditLogDao = auditLogDao;
        this.jsonCodec = jsonCodec;
    }

    @Override
    public AuditLogEntity append(AuditLogEntity entity) {
        AuditLogPO po = AuditLogPO.builder()
                .tenantId(entity.getTenantId())
                .actorUserId(entity.getActorUserId())
                .eventType(entity.getEventType().getCode())
                .targetType(entity.getTargetType())
                .targetId(entity.getTargetId())
                .capability(entity.getCapability() == null ? null : entity.getCapability().name())
                .outcome(entity.getOutcome().getCode())
                .detail(jsonCodec.writeValue(entity.getDetail()))
                .build();
        auditLogDao.insert(po);
        entity.setId(po.getId());
        return entity;
    }

    @Override
    public List<AuditLogEntity> findRecent(TenantContext context,
                                           AuditEventTypeEnum eventType,
                                           AuditOutcomeEnum outcome,
                                           int limit) {
        return auditLogDao.selectRecent(context.tenantId(),
                        eventType == null ? null : eventType.getCode(),
                        outcome == null ? null : outcome.getCode(),
                        limit).stream()
                .map(this::toEntity)
                .toList();
    }

    private AuditLogEntity toEntity(AuditLogPO po) {
        AuditLogEntity entity = new AuditLogEntity();
        entity.setId(po.getId());
        entity.setTenantId(po.getTenantId());
        entity.setActorUserId(po.getActorUserId());
        entity.setEventType(AuditEventTypeEnum.fromCode(po.getEventType()));
        entity.setTargetType(po.getTargetType());
        entity.setTargetId(po.getTargetId());
        entity.setCapability(po.getCapability() == null ? null : CapabilityEnum.valueOf(po.getCapability()));
        entity.setOutcome(AuditOutcomeEnum.fromCode(po.getOutcome()));
        entity.setDetail(jsonCodec.readMap(po.getDetail()));
        entity.setCreatedAt(po.getCreatedAt());
        return entity;
    }
}
