package com.agentcores.infrastructure.repository.auth;

import com.agentcores.domain.auth.adapter.repository.IAuthTokenRepository;
import com.agentcores.domain.auth.model.entity.RefreshTokenEntity;
import com.agentcores.domain.auth.model.entity.TokenFamilyEntity;
import com.agentcores.infrastructure.dao.AuthTokenDao;
import com.agentcores.infrastructure.dao.po.AuthRefreshTokenPO;
import com.agentcores.infrastructure.dao.po.AuthTokenFamilyPO;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

/**
 * 令牌族 / 刷新令牌仓储实现类。
 */
@Slf4j
@Repository
public class AuthTokenRepositoryImpl implements IAuthTokenRepository {

    private final AuthTokenDao authTokenDao;

    public AuthTokenRepositoryImpl(AuthTokenDao authTokenDao) {
        this.authTokenDao = authTokenDao;
    }

    @Override
    public TokenFamilyEntity createFamily(TokenFamilyEntity family) {
        authTokenDao.insertFamily(AuthTokenFamilyPO.builder()
                .id(family.getId())
                .tenantId(family.getTenantId())
                .userId(family.getUserId())
                .build());
        return toEntity(authTokenDao.selectFamily(family.getId()));
    }

    @Override
    public TokenFamilyEntity findFamily(String familyId) {
        return toEntity(authTokenDao.selectFamily(familyId));
    }

    @Override
    public boolean revokeFamily(String familyId, String reason) {
        return authTokenDao.revokeFamily(familyId, reason) > 0;
    }

    @Override
    public int revokeFamiliesOfUser(Long tenantId, Long userId, String reason) {
        return authTokenDao.revokeFamiliesOfUser(tenantId, userId, reason);
    }

    @Override
    public RefreshTokenEntity saveRefreshToken(RefreshTokenEntity token) {
        authTokenDao.insertRefreshToken(AuthRefreshTokenPO.builder()
                .tokenId(token.getTokenId())
                .familyId(token.getFamilyId())
                .tenantId(token.getTenantId())
                .userId(token.getUserId())
                .issuedAt(token.getIssuedAt())
                .expiresAt(token.getExpiresAt())
                .consumed(false)
                .build());
        return token;
    }

    @Override
    public RefreshTokenEntity findRefreshToken(String tokenId) {
        AuthRefreshTokenPO po = authTokenDao.selectRefreshToken(tokenId);
        if (po == null) {
            return null;
        }
        RefreshTokenEntity entity = new RefreshTokenEntity();
        entity.setTokenId(po.getTokenId());
        entity.setFamilyId(po.getFamilyId());
        entity.setTenantId(po.getTenantId());
        entity.setUserId(po.getUserId());
        entity.setIssuedAt(po.getIssuedAt());
        entity.setExpiresAt(po.getExpiresAt());
        entity.setConsumed(po.getConsumed());
        entity.setConsumedAt(po.getConsumedAt());
        return entity;
    }

    @Override
    public boolean consumeRefreshToken(String tokenId) {
        return authTokenDao.consumeRefreshToken(tokenId) > 0;
    }

    private TokenFamilyEntity toEntity(AuthTokenFamilyPO po) {
        if (po == null) {
            return null;
        }
        TokenFamilyEntity entity = new TokenFamilyEntity();
        entity.setId(po.getId());
        entity.setTenantId(po.getTenantId());
        entity.setUserId(po.getUserId());
        entity.setRevoked(po.getRevoked());
        entity.setRevokedReason(po.getRevokedReason());
        entity.setRevokedAt(po.getRevokedAt());
        entity.setCreatedAt(po.getCreatedAt());
        return entity;
    }
}
