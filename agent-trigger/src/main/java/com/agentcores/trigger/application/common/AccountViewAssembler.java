package com.agentcores.trigger.application.common;

import com.agentcores.api.dto.AgentDTO;
import com.agentcores.api.dto.AuthSessionDTO;
import com.agentcores.api.dto.AuthTokenPairDTO;
import com.agentcores.api.dto.InvitationDTO;
import com.agentcores.api.dto.TenantDTO;
import com.agentcores.api.dto.UserSummaryDTO;
import com.agentcores.domain.agent.model.entity.AgentEntity;
import com.agentcores.domain.auth.model.entity.InvitationEntity;
import com.agentcores.domain.auth.model.entity.UserEntity;
import com.agentcores.domain.auth.model.valobj.IssuedSession;
import com.agentcores.domain.tenant.model.entity.TenantEntity;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;

/**
 * 账号、租户、Agent 视图组装器。口令哈希不出现在任何视图中。
 */
@Component
public class AccountViewAssembler {

    private static final String TOKEN_TYPE = "Bearer";

    public UserSummaryDTO toUserSummary(UserEntity user) {
        if (user == null) {
            return null;
        }
        UserSummaryDTO dto = new UserSummaryDTO();
        dto.setId(user.getId());
        dto.setTenantId(user.getTenantId());
        dto.setEmail(user.getEmail());
        dto.setFullName(user.getFullName());
        dto.setRole(user.getRole() == null ? null : user.getRole().getCode());
        dto.setActive(user.isActive());
        dto.setLastLoginAt(user.getLastLoginAt());
        dto.setCreatedAt(user.getCreatedAt());
        return dto;
    }

    public TenantDTO toTenant(TenantEntity tenant) {
        if (tenant == null) {
            return null;
        }
        TenantDTO dto = new TenantDTO();
        dto.setId(tenant.getId());
        dto.setName(tenant.getName());
        dto.setSlug(tenant.getSlug());
        dto.setTier(tenant.getTier() == null ? null : tenant.getTier().getCode());
        dto.setMaxAgents(tenant.getMaxAgents());
        dto.setMaxTasksPerHour(tenant.getMaxTasksPerHour());
        dto.setActive(tenant.isActive());
        dto.setCreatedAt(tenant.getCreatedAt());
        return dto;
    }

    /**
     * @param includeToken 仅在创建邀请时返回 token
     */
    public InvitationDTO toInvitation(InvitationEntity invitation, boolean includeToken) {
        InvitationDTO dto = new InvitationDTO();
        dto.setId(invitation.getId());
        dto.setEmail(invitation.getEmail());
        dto.setRole(invitation.getRole() == null ? null : invitation.getRole().getCode());
        dto.setToken(includeToken ? invitation.getToken() : null);
        dto.setExpiresAt(invitation.getExpiresAt());
        dto.setConsumed(Boolean.TRUE.equals(invitation.getConsumed()));
        dto.setInvitedBy(invitation.getInvitedBy());
        dto.setCreatedAt(invitation.getCreatedAt());
        return dto;
    }

    public AgentDTO toAgent(AgentEntity agent) {
        if (agent == null) {
            return null;
        }
        AgentDTO dto = new AgentDTO();
        dto.setId(agent.getId());
        dto.setTenantId(agent.getTenantId());
        dto.setName(agent.getName());
        dto.setAgentType(agent.getAgentType());
        dto.setDescription(agent.getDescription());
        dto.setStatus(agent.getStatus() == null ? null : agent.getStatus().getCode());
        dto.setConfiguration(agent.getConfiguration());
        dto.setCreatedBy(agent.getCreatedBy());
        dto.setCreatedAt(agent.getCreatedAt());
        dto.setUpdatedAt(agent.getUpdatedAt());
        return dto;
    }

    public AuthSessionDTO toSession(IssuedSession session, UserEntity user, TenantEntity tenant) {
        AuthSessionDTO dto = new AuthSessionDTO();
        dto.setAccessToken(session.accessToken());
        dto.setRefreshToken(session.refreshToken());
        dto.setTokenType(TOKEN_TYPE);
        dto.setAccessExpiresAt(toLocal(session.accessExpiresAt()));
        dto.setRefreshExpiresAt(toLocal(session.refreshExpiresAt()));
        dto.setUser(toUserSummary(user));
        dto.setTenant(toTenant(tenant));
        return dto;
    }

    public AuthTokenPairDTO toTokenPair(IssuedSession session) {
        AuthTokenPairDTO dto = new AuthTokenPairDTO();
        dto.setAccessToken(session.accessToken());
        dto.setRefreshToken(session.refreshToken());
        dto.setTokenType(TOKEN_TYPE);
        dto.setAccessExpiresAt(toLocal(session.accessExpiresAt()));
        dto.setRefreshExpiresAt(toLocal(session.refreshExpiresAt()));
        return dto;
    }

    public static LocalDateTime toLocal(Instant instant) {
        return instant == null ? null : LocalDateTime.ofInstant(instant, ZoneId.systemDefault());
    }
}
