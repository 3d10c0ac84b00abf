package com.agentcores.test.support;

import com.agentcores.domain.audit.adapter.repository.IAuditLogRepository;
import com.agentcores.domain.audit.model.entity.AuditLogEntity;
import com.agentcores.domain.auth.model.valobj.TenantContext;
import com.agentcores.types.enums.AuditEventTypeEnum;
import com.agentcores.types.enums.AuditOutcomeEnum;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 内存审计仓储，只追加。
 */
public class InMemoryAuditLogRepository implements IAuditLogRepository {

    private final List<AuditLogEntity> entries = Collections.synchronizedList(new ArrayList<>());
    private long nextId = 1;

    @Override
    public synchronized AuditLogEntity append(AuditLogEntity entity) {
        entity.setId(nextId++);
        entries.add(entity);
        return entity;
    }

    @Override
    public List<AuditLogEntity> findRecent(TenantContext context,
                                           AuditEventTypeEnum eventType,
                                           AuditOutcomeEnum outcome,
                                           int limit) {
        List<AuditLogEntity> snapshot = all();
        Collections.reverse(snapshot);
        return snapshot.stream()
                .filter(entry -> context.ownsTenant(entry.getTenantId()))
                .filter(entry -> eventType == null || entry.getEventType() == eventType)
                .filter(entry -> outcome == null || entry.getOutcome() == outcome)
                .limit(limit)
                .toList();
    }

    public List<AuditLogEntity> all() {
        synchronized (entries) {
            return new ArrayList<>(entries);
        }
    }

    public List<AuditLogEntity> ofType(AuditEventTypeEnum eventType) {
        return all().stream().filter(entry -> entry.getEventType() == eventType).toList();
    }

    /**
     * 某任务的状态流转序列，形如 pending->running。
     */
    public List<String> transitionsOf(Long taskId) {
        return ofType(AuditEventTypeEnum.TASK_TRANSITION).stream()
                .filter(entry -> String.valueOf(taskId).equals(entry.getTargetId()))
                .map(entry -> entry.getDetail().get("from") + "->" + entry.getDetail().get("to"))
                .toList();
    }
}
