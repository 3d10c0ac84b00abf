package com.agentcores.infrastructure.dao;

import com.agentcores.infrastructure.dao.po.InvitationPO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 邀请 DAO
 */
@Mapper
public interface InvitationDao {

    int insert(InvitationPO po);

    InvitationPO selectByToken(@Param("token") String token);

    InvitationPO selectPendingByEmail(@Param("tenantId") Long tenantId,
                                      @Param("email") String email,
                                      @Param("now") LocalDateTime now);

    List<InvitationPO> selectPending(@Param("tenantId") Long tenantId, @Param("now") LocalDateTime now);

    int markConsumed(@Param("id") Long id, @Param("consumedAt") LocalDateTime consumedAt);
}
