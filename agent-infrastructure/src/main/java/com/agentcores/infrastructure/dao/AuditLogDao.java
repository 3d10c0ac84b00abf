package com.agentcores.infrastructure.dao;

import com.agentcores.infrastructure.dao.po.AuditLogPO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

/**
 * 审计日志 DAO（只追加）
 */
@Mapper
public interface AuditLogDao {

    int insert(AuditLogPO po);

    List<AuditLogPO> selectRecent(@Param("tenantId") Long tenantId,
                                  @Param("eventType") String eventType,
                                  @Param("outcome") String outcome,
                                  @Param("limit") Integer limit);
}
