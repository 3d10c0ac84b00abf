package com.agentcores.infrastructure.dao;

import com.agentcores.infrastructure.dao.po.AuthRefreshTokenPO;
import com.agentcores.infrastructure.dao.po.AuthTokenFamilyPO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

/**
 * 令牌族 / 刷新令牌 DAO
 */
@Mapper
public interface AuthTokenDao {

    int insertFamily(AuthTokenFamilyPO po);

    AuthTokenFamilyPO selectFamily(@Param("id") String id);

    int revokeFamily(@Param("id") String id, @Param("reason") String reason);

    int revokeFamiliesOfUser(@Param("tenantId") Long tenantId,
                             @Param("userId") Long userId,
                             @Param("reason") String reason);

    int insertRefreshToken(AuthRefreshTokenPO po);

    AuthRefreshTokenPO selectRefreshToken(@Param("tokenId") String tokenId);

    int consumeRefreshToken(@Param("tokenId") String tokenId);
}
