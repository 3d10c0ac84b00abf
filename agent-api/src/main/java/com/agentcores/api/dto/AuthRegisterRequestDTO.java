package com.agentcores.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;

/**
 * 注册请求 DTO。
 * 提供 invitationToken 时走邀请接受流程，否则按 tenantName/tenantSlug 创建新组织。
 */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class AuthRegisterRequestDTO {

    private String tenantName;
    private String tenantSlug;
    private String invitationToken;
    private String email;
    private String password;
    private String fullName;
}
