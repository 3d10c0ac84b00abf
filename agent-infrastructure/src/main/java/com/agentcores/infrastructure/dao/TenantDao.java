package com.agentcores.infrastructure.dao;

import com.agentcores.infrastructure.dao.po.TenantPO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

/**
 * 租户 DAO
 *
 * @author agentcores
 * @since 2026-03-05
 */
@Mapper
public interface TenantDao {

    int insert(TenantPO po);

    /**
     * 根据 ID 更新 (带乐观锁)
     */
    int updateWithVersion(TenantPO po);

    TenantPO selectById(@Param("id") Long id);

    TenantPO selectBySlug(@Param("slug") String slug);

    int countByNameOrSlug(@Param("name") String name, @Param("slug") String slug);

    /**
     * 锁定租户行，串行化同一租户的配额检查与 owner 计数
     */
    Long lockById(@Param("id") Long id);
}
