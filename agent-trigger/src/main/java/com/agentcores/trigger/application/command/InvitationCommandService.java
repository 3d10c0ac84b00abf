package com.agentcores.trigger.application.command;

import com.agentcores.api.dto.InvitationCreateRequestDTO;
import com.agentcores.api.dto.InvitationDTO;
import com.agentcores.domain.audit.adapter.repository.IAuditLogRepository;
import com.agentcores.domain.audit.model.entity.AuditLogEntity;
import com.agentcores.domain.auth.adapter.repository.IInvitationRepository;
import com.agentcores.domain.auth.adapter.repository.IUserRepository;
import com.agentcores.domain.auth.model.entity.InvitationEntity;
import com.agentcores.domain.auth.model.valobj.TenantContext;
import com.agentcores.domain.authorization.service.AuthorizationGuardDomainService;
import com.agentcores.trigger.application.common.AccountViewAssembler;
import com.agentcores.types.enums.AuditEventTypeEnum;
import com.agentcores.types.enums.AuditOutcomeEnum;
import com.agentcores.types.enums.CapabilityEnum;
import com.agentcores.types.enums.ResponseCode;
import com.agentcores.types.enums.UserRoleEnum;
import com.agentcores.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.security.SecureRandom;
import java.time.LocalDateTime;
import java.util.Base64;
import java.util.List;

/**
 * 邀请写用例。
 */
@Slf4j
@Service
public class InvitationCommandService {

    private static final SecureRandom SECURE_RANDOM = new SecureRandom();

    private final IInvitationRepository invitationRepository;
    private final IUserRepository userRepository;
    private final IAuditLogRepository auditLogRepository;
    private final AuthorizationGuardDomainService authorizationGuard;
    private final AccountViewAssembler accountViewAssembler;
    private final int invitationTtlDays;

    public InvitationCommandService(IInvitationRepository invitationRepository,
                                    IUserRepository userRepository,
                                    IAuditLogRepository auditLogRepository,
                                    AuthorizationGuardDomainService authorizationGuard,
                                    AccountViewAssembler accountViewAssembler,
                                    @Value("${app.auth.invitation.ttl-days:7}") int invitationTtlDays) {
        this.invitationRepository = invitationRepository;
        this.userRepository = userRepository;
        this.auditLogRepository = auditLogRepository;
        this.authorizationGuard = authorizationGuard;
        this.accountViewAssembler = accountViewAssembler;
        this.invitationTtlDays = Math.max(invitationTtlDays, 1);
    }

    public InvitationDTO create(TenantContext context, InvitationCreateRequestDTO request) {
        authorizationGuard.requireInTenant(context, CapabilityEnum.INVITE_USERS, "invitation");
        if (request == null) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "请求体不能为空");
        }
        String email = AuthSessionCommandService.normalizeEmail(request.getEmail());
        if (StringUtils.isBlank(email) || !email.contains("@")) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "A valid email is required");
        }
        UserRoleEnum role = UserRoleEnum.fromCode(request.getRole());
        if (role == null) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "role is required");
        }
        if (role == UserRoleEnum.OWNER && context.role() != UserRoleEnum.OWNER) {
            throw new AppException(ResponseCode.PERMISSION_DENIED, "Only an owner can invite another owner");
        }
        LocalDateTime now = LocalDateTime.now();
        if (invitationRepository.findPendingByEmail(context, email, now) != null) {
            throw new AppException(ResponseCode.INVITATION_EXISTS);
        }
        if (userRepository.findByTenantAndEmail(context.tenantId(), email) != null) {
            throw new AppException(ResponseCode.DUPLICATE_EMAIL);
        }

        InvitationEntity invitation = new InvitationEntity();
        invitation.setTenantId(context.tenantId());
        invitation.setEmail(email);
        invitation.setRole(role);
        invitation.setToken(generateToken());
        invitation.setInvitedBy(context.userId());
        invitation.setExpiresAt(now.plusDays(invitationTtlDays));
        invitation.setConsumed(false);
        invitation.setCreatedAt(now);
        InvitationEntity saved = invitationRepository.save(invitation);

        auditLogRepository.append(AuditLogEntity.event(context.tenantId(), context.userId(),
                        AuditEventTypeEnum.INVITATION_CREATED, AuditOutcomeEnum.ALLOWED, "invitation", saved.getId())
                .with("email", email)
                .with("role", role.getCode()));
        log.info("INVITATION_CREATED tenantId={}, invitationId={}, role={}, invitedBy={}",
                context.tenantId(), saved.getId(), role, context.userId());
        return accountViewAssembler.toInvitation(saved, true);
    }

    public List<InvitationDTO> listPending(TenantContext context) {
        authorizationGuard.requireInTenant(context, CapabilityEnum.INVITE_USERS, "invitation");
        return invitationRepository.findPending(context, LocalDateTime.now()).stream()
                .map(invitation -> accountViewAssembler.toInvitation(invitation, false))
                .toList();
    }

    private String generateToken() {
        byte[] bytes = new byte[32];
        SECURE_RANDOM.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }
}
