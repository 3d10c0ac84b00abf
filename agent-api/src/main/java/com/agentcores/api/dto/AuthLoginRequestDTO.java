package com.agentcores.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;

/**
 * 登录请求 DTO。tenantSelector 可为租户 ID 或 slug。
 */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class AuthLoginRequestDTO {

    private String email;
    private String password;
    private String tenantSelector;
}
