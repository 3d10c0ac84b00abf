package com.agentcores.infrastructure.auth;

import com.agentcores.domain.auth.adapter.gateway.ITokenCodec;
import com.agentcores.domain.auth.model.valobj.TokenClaims;
import com.agentcores.domain.auth.model.valobj.TokenKind;
import com.agentcores.infrastructure.util.JsonCodec;
import com.agentcores.types.enums.ResponseCode;
import com.agentcores.types.enums.UserRoleEnum;
import com.agentcores.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Instant;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * HS256 紧凑令牌编解码。
 * <p>
 * 格式为 base64url(header).base64url(claims).base64url(signature)，
 * 声明包含 sub / tid / role / fam / jti / typ / iat / exp / iss。
 * 签名比较使用常量时间比较。
 * </p>
 *
 * @author agentcores
 * @since 2026-03-05
 */
@Slf4j
@Component
public class HmacTokenCodec implements ITokenCodec {

    private static final String HMAC_ALGORITHM = "HmacSHA256";
    private static final int MIN_KEY_BYTES = 32;
    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();
    private static final Base64.Decoder DECODER = Base64.getUrlDecoder();

    private final byte[] signingKey;
    private final String issuer;
    private final JsonCodec jsonCodec;
    private final String encodedHeader;

    public HmacTokenCodec(@Value("${app.auth.token.signing-key:}") String signingKey,
                          @Value("${app.auth.token.issuer:agentcores}") String issuer,
                          JsonCodec jsonCodec) {
        if (StringUtils.isBlank(signingKey)
                || signingKey.getBytes(StandardCharsets.UTF_8).length < MIN_KEY_BYTES) {
            throw new IllegalStateException("app.auth.token.signing-key must be at least "
                    + MIN_KEY_BYTES + " bytes");
        }
        this.signingKey = signingKey.getBytes(StandardCharsets.UTF_8);
        this.issuer = issuer;
        this.jsonCodec = jsonCodec;
        Map<String, Object> header = new LinkedHashMap<>();
        header.put("alg", "HS256");
        header.put("typ", "JWT");
        this.encodedHeader = ENCODER.encodeToString(jsonCodec.writeBytes(header));
    }

    @Override
    public String encode(TokenClaims claims) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("sub", String.valueOf(claims.userId()));
        payload.put("tid", claims.tenantId());
        if (claims.role() != null) {
            payload.put("role", claims.role().getCode());
        }
        payload.put("fam", claims.familyId());
        payload.put("jti", claims.tokenId());
        payload.put("typ", claims.kind().getClaim());
        payload.put("iat", claims.issuedAt().getEpochSecond());
        payload.put("exp", claims.expiresAt().getEpochSecond());
        payload.put("iss", issuer);
        String signingInput = encodedHeader + "." + ENCODER.encodeToString(jsonCodec.writeBytes(payload));
        return signingInput + "." + ENCODER.encodeToString(sign(signingInput));
    }

    @Override
    public TokenClaims decode(String token, TokenKind expectedKind) {
        if (StringUtils.isBlank(token)) {
            throw invalid("empty token");
        }
        String[] parts = token.split("\\.");
        if (parts.length != 3) {
            throw invalid("malformed token");
        }
        byte[] expected = sign(parts[0] + "." + parts[1]);
        byte[] actual;
        Map<String, Object> payload;
        try {
            actual = DECODER.decode(parts[2]);
            payload = jsonCodec.readBytes(DECODER.decode(parts[1]));
        } catch (IllegalArgumentException | IOException ex) {
            throw invalid("undecodable token");
        }
        if (!MessageDigest.isEqual(expected, actual)) {
            throw invalid("bad signature");
        }
        if (!StringUtils.equals(issuer, asText(payload.get("iss")))) {
            throw invalid("issuer mismatch");
        }
        TokenKind kind = TokenKind.fromClaim(asText(payload.get("typ")));
        if (kind != expectedKind) {
            throw invalid("unexpected token kind");
        }
        Long userId = asLong(payload.get("sub"));
        Long tenantId = asLong(payload.get("tid"));
        Long issuedAt = asLong(payload.get("iat"));
        Long expiresAt = asLong(payload.get("exp"));
        String familyId = asText(payload.get("fam"));
        String tokenId = asText(payload.get("jti"));
        if (userId == null || tenantId == null || issuedAt == null || expiresAt == null
                || StringUtils.isAnyBlank(familyId, tokenId)) {
            throw invalid("missing claims");
        }
        UserRoleEnum role = null;
        if (kind == TokenKind.ACCESS) {
            role = UserRoleEnum.fromCode(asText(payload.get("role")));
            if (role == null) {
                throw invalid("missing role");
            }
        }
        TokenClaims claims = new TokenClaims(kind, userId, tenantId, role, familyId, tokenId,
                Instant.ofEpochSecond(issuedAt), Instant.ofEpochSecond(expiresAt));
        if (claims.isExpiredAt(Instant.now())) {
            throw new AppException(ResponseCode.EXPIRED_TOKEN);
        }
        return claims;
    }

    private byte[] sign(String signingInput) {
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(new SecretKeySpec(signingKey, HMAC_ALGORITHM));
            return mac.doFinal(signingInput.getBytes(StandardCharsets.UTF_8));
        } catch (GeneralSecurityException ex) {
            throw new IllegalStateException("HMAC-SHA256 unavailable", ex);
        }
    }

    private AppException invalid(String reason) {
        log.debug("TOKEN_REJECTED reason={}", reason);
        return new AppException(ResponseCode.INVALID_TOKEN);
    }

    private static String asText(Object value) {
        return value == null ? null : String.valueOf(value);
    }

    private static Long asLong(Object value) {
        if (value instanceof Number number) {
            return number.longValue();
        }
        if (value instanceof String text && StringUtils.isNumeric(text)) {
            return Long.parseLong(text);
        }
        return null;
    }
}
