package com.agentcores.infrastructure.dao;

import com.agentcores.infrastructure.dao.po.AgentPO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

/**
 * Agent DAO
 *
 * @author agentcores
 * @since 2026-03-05
 */
@Mapper
public interface AgentDao {

    int insert(AgentPO po);

    /**
     * 根据 ID + 租户更新 (带乐观锁)
     */
    int updateWithVersion(AgentPO po);

    AgentPO selectByIdAndTenant(@Param("id") Long id, @Param("tenantId") Long tenantId);

    /**
     * 查询租户内未终止的 Agent
     */
    List<AgentPO> selectActiveByTenant(@Param("tenantId") Long tenantId);

    AgentPO selectActiveByName(@Param("tenantId") Long tenantId, @Param("name") String name);

    long countActiveByTenant(@Param("tenantId") Long tenantId);

    int updateStatusIfMatch(@Param("id") Long id,
                            @Param("tenantId") Long tenantId,
                            @Param("expected") String expected,
                            @Param("target") String target);
}
