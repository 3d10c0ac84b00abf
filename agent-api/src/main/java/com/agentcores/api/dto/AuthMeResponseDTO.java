package com.agentcores.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;

import java.util.List;

/**
 * 当前登录态信息 DTO。
 */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class AuthMeResponseDTO {

    private UserSummaryDTO user;
    private TenantDTO tenant;
    private String role;
    private List<String> capabilities;
}
