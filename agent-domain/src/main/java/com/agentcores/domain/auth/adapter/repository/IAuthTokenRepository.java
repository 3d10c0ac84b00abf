package com.agentcores.domain.auth.adapter.repository;

import com.agentcores.domain.auth.model.entity.RefreshTokenEntity;
import com.agentcores.domain.auth.model.entity.TokenFamilyEntity;

/**
 * 令牌族与刷新令牌轮换状态仓储。
 * <p>
 * 只有会话签发流程写入这里。
 * </p>
 */
public interface IAuthTokenRepository {

    TokenFamilyEntity createFamily(TokenFamilyEntity family);

    TokenFamilyEntity findFamily(String familyId);

    /**
     * 吊销令牌族，已吊销时返回 false
     */
    boolean revokeFamily(String familyId, String reason);

    /**
     * 吊销用户全部未吊销的令牌族，返回被吊销的族 ID 数量
     */
    int revokeFamiliesOfUser(Long tenantId, Long userId, String reason);

    RefreshTokenEntity saveRefreshToken(RefreshTokenEntity token);

    RefreshTokenEntity findRefreshToken(String tokenId);

    /**
     * 条件消费刷新令牌（consumed = false 时才成功），并发重放中只有一方成功
     */
    boolean consumeRefreshToken(String tokenId);
}
