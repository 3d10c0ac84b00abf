package com.agentcores.domain.auth.model.valobj;

import java.time.Instant;

/**
 * 一次签发得到的令牌对。
 */
public record IssuedSession(String accessToken,
                            Instant accessExpiresAt,
                            String refreshToken,
                            String refreshTokenId,
                            Instant refreshExpiresAt,
                            String familyId) {
}
