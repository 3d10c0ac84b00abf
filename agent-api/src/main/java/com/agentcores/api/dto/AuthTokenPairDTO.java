package com.agentcores.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 令牌对 DTO。
 */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class AuthTokenPairDTO {

    private String accessToken;
    private String refreshToken;
    private String tokenType;
    private LocalDateTime accessExpiresAt;
    private LocalDateTime refreshExpiresAt;
}
