package com.agentcores.domain.auth.adapter.gateway;

import com.agentcores.domain.auth.model.valobj.TokenClaims;
import com.agentcores.domain.auth.model.valobj.TokenKind;

/**
 * 令牌编解码端口。
 */
public interface ITokenCodec {

    /**
     * 签名并编码声明。
     */
    String encode(TokenClaims claims);

    /**
     * 校验签名、种类与有效期后解码。
     *
     * @param token 令牌字符串
     * @param expectedKind 期望的令牌种类
     * @return 声明
     * @throws com.agentcores.types.exception.AppException 签名错误或格式错误时为 INVALID_TOKEN，过期为 EXPIRED_TOKEN
     */
    TokenClaims decode(String token, TokenKind expectedKind);
}
