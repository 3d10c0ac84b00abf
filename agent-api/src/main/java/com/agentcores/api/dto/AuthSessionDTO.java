package com.agentcores.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 登录 / 注册成功后的会话 DTO。
 */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class AuthSessionDTO {

    private String accessToken;
    private String refreshToken;
    private String tokenType;
    private LocalDateTime accessExpiresAt;
    private LocalDateTime refreshExpiresAt;
    private UserSummaryDTO user;
    private TenantDTO tenant;
}
