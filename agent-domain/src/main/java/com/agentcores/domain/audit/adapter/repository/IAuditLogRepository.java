package com.agentcores.domain.audit.adapter.repository;

import com.agentcores.domain.audit.model.entity.AuditLogEntity;
import com.agentcores.domain.auth.model.valobj.TenantContext;
import com.agentcores.types.enums.AuditEventTypeEnum;
import com.agentcores.types.enums.AuditOutcomeEnum;

import java.util.List;

/**
 * 审计日志仓储接口（只追加）
 *
 * @author agentcores
 * @since 2026-03-03
 */
public interface IAuditLogRepository {

    /**
     * 追加一条审计记录
     */
    AuditLogEntity append(AuditLogEntity entity);

    /**
     * 按条件查询租户内审计记录，按时间倒序
     *
     * @param eventType 可空
     * @param outcome 可空
     */
    List<AuditLogEntity> findRecent(TenantContext context,
                                    AuditEventTypeEnum eventType,
                                    AuditOutcomeEnum outcome,
                                    int limit);
}
