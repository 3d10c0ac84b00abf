package com.agentcores.trigger.application.command;

import com.agentcores.api.dto.UserRoleUpdateRequestDTO;
import com.agentcores.api.dto.UserSummaryDTO;
import com.agentcores.domain.audit.adapter.repository.IAuditLogRepository;
import com.agentcores.domain.audit.model.entity.AuditLogEntity;
import com.agentcores.domain.auth.adapter.repository.IUserRepository;
import com.agentcores.domain.auth.model.entity.UserEntity;
import com.agentcores.domain.auth.model.valobj.TenantContext;
import com.agentcores.domain.authorization.service.AuthorizationGuardDomainService;
import com.agentcores.domain.tenant.adapter.repository.ITenantRepository;
import com.agentcores.trigger.application.common.AccountViewAssembler;
import com.agentcores.types.enums.AuditEventTypeEnum;
import com.agentcores.types.enums.AuditOutcomeEnum;
import com.agentcores.types.enums.CapabilityEnum;
import com.agentcores.types.enums.ResponseCode;
import com.agentcores.types.enums.UserRoleEnum;
import com.agentcores.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * 用户管理写用例：列表、角色变更、停用。
 * <p>
 * 访问令牌携带角色，角色变更与停用都会立即吊销该用户的全部令牌族，新角色在重新登录后生效。
 * 租户内最后一个启用的 owner 既不能降级也不能停用，计数前先锁定租户行。
 * </p>
 */
@Slf4j
@Service
public class UserManagementCommandService {

    private final IUserRepository userRepository;
    private final ITenantRepository tenantRepository;
    private final IAuditLogRepository auditLogRepository;
    private final AuthorizationGuardDomainService authorizationGuard;
    private final AuthSessionCommandService authSessionCommandService;
    private final AccountViewAssembler accountViewAssembler;

    public UserManagementCommandService(IUserRepository userRepository,
                                        ITenantRepository tenantRepository,
                                        IAuditLogRepository auditLogRepository,
                                        AuthorizationGuardDomainService authorizationGuard,
                                        AuthSessionCommandService authSessionCommandService,
                                        AccountViewAssembler accountViewAssembler) {
        this.userRepository = userRepository;
        this.tenantRepository = tenantRepository;
        this.auditLogRepository = auditLogRepository;
        this.authorizationGuard = authorizationGuard;
        this.authSessionCommandService = authSessionCommandService;
        this.accountViewAssembler = accountViewAssembler;
    }

    public List<UserSummaryDTO> list(TenantContext context) {
        authorizationGuard.requireInTenant(context, CapabilityEnum.VIEW_USERS, "user");
        return userRepository.findByTenant(context).stream()
                .map(accountViewAssembler::toUserSummary)
                .toList();
    }

    @Transactional(rollbackFor = Exception.class)
    public UserSummaryDTO changeRole(TenantContext context, Long userId, UserRoleUpdateRequestDTO request) {
        UserEntity target = requireManageable(context, userId);
        UserRoleEnum newRole = UserRoleEnum.fromCode(request == null ? null : request.getRole());
        if (newRole == null) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "role is required");
        }
        if (userId.equals(context.userId())) {
            throw new AppException(ResponseCode.PERMISSION_DENIED, "Users cannot change their own role");
        }
        if (newRole == UserRoleEnum.OWNER && context.role() != UserRoleEnum.OWNER) {
            throw new AppException(ResponseCode.PERMISSION_DENIED, "Only an owner can grant the owner role");
        }
        UserRoleEnum previous = target.getRole();
        if (previous == newRole) {
            return accountViewAssembler.toUserSummary(target);
        }
        if (previous == UserRoleEnum.OWNER) {
            requireAnotherOwner(context, target, "demoted");
        }

        target.changeRole(newRole);
        UserEntity updated = userRepository.update(context, target);
        int revokedFamilies = authSessionCommandService.revokeAllSessions(context.tenantId(), userId, "role_changed");
        auditLogRepository.append(AuditLogEntity.event(context.tenantId(), context.userId(),
                        AuditEventTypeEnum.USER_ROLE_CHANGED, AuditOutcomeEnum.ALLOWED, "user", userId)
                .with("from", previous.getCode())
                .with("to", newRole.getCode())
                .with("revoked_families", revokedFamilies));
        log.info("USER_ROLE_CHANGED tenantId={}, userId={}, from={}, to={}, revokedFamilies={}, operator={}",
                context.tenantId(), userId, previous, newRole, revokedFamilies, context.userId());
        return accountViewAssembler.toUserSummary(updated);
    }

    @Transactional(rollbackFor = Exception.class)
    public UserSummaryDTO deactivate(TenantContext context, Long userId) {
        UserEntity target = requireManageable(context, userId);
        if (userId.equals(context.userId())) {
            throw new AppException(ResponseCode.PERMISSION_DENIED, "Users cannot deactivate themselves");
        }
        if (!target.isActive()) {
            return accountViewAssembler.toUserSummary(target);
        }
        if (target.getRole() == UserRoleEnum.OWNER) {
            requireAnotherOwner(context, target, "deactivated");
        }

        target.deactivate();
        UserEntity updated = userRepository.update(context, target);
        int revokedFamilies = authSessionCommandService.revokeAllSessions(context.tenantId(), userId, "user_deactivated");
        auditLogRepository.append(AuditLogEntity.event(context.tenantId(), context.userId(),
                        AuditEventTypeEnum.USER_DEACTIVATED, AuditOutcomeEnum.ALLOWED, "user", userId)
                .with("revoked_families", revokedFamilies));
        log.info("USER_DEACTIVATED tenantId={}, userId={}, revokedFamilies={}, operator={}",
                context.tenantId(), userId, revokedFamilies, context.userId());
        return accountViewAssembler.toUserSummary(updated);
    }

    private UserEntity requireManageable(TenantContext context, Long userId) {
        UserEntity target = userRepository.findById(context, userId);
        authorizationGuard.require(context, CapabilityEnum.MANAGE_USERS,
                target == null ? null : target.getTenantId(), "user", userId);
        if (target.getRole() == UserRoleEnum.OWNER && context.role() != UserRoleEnum.OWNER) {
            throw new AppException(ResponseCode.PERMISSION_DENIED, "Only an owner can manage another owner");
        }
        return target;
    }

    private void requireAnotherOwner(TenantContext context, UserEntity owner, String action) {
        tenantRepository.lockCurrent(context);
        if (owner.isActive() && userRepository.countActiveOwners(context) <= 1) {
            throw new AppException(ResponseCode.PERMISSION_DENIED, "The last active owner cannot be " + action);
        }
    }
}
