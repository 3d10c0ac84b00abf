package com.agentcores.infrastructure.dao;

import com.agentcores.infrastructure.dao.po.UserPO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 用户 DAO
 *
 * @author agentcores
 * @since 2026-03-05
 */
@Mapper
public interface UserDao {

    int insert(UserPO po);

    /**
     * 根据 ID + 租户更新 (带乐观锁)
     */
    int updateWithVersion(UserPO po);

    int updateLastLoginAt(@Param("id") Long id,
                          @Param("tenantId") Long tenantId,
                          @Param("lastLoginAt") LocalDateTime lastLoginAt);

    UserPO selectByIdAndTenant(@Param("id") Long id, @Param("tenantId") Long tenantId);

    List<UserPO> selectByTenant(@Param("tenantId") Long tenantId);

    UserPO selectByTenantAndEmail(@Param("tenantId") Long tenantId, @Param("email") String email);

    long countActiveByRole(@Param("tenantId") Long tenantId, @Param("role") String role);
}
