package com.agentcores.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 邀请 DTO。token 仅在创建时返回。
 */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class InvitationDTO {

    private Long id;
    private String email;
    private String role;
    private String token;
    private LocalDateTime expiresAt;
    private Boolean consumed;
    private Long invitedBy;
    private LocalDateTime createdAt;
}
