package com.agentcores.trigger.application.command;

import com.agentcores.api.dto.AuthLoginRequestDTO;
import com.agentcores.api.dto.AuthLogoutResponseDTO;
import com.agentcores.api.dto.AuthMeResponseDTO;
import com.agentcores.api.dto.AuthRefreshRequestDTO;
import com.agentcores.api.dto.AuthRegisterRequestDTO;
import com.agentcores.api.dto.AuthSessionDTO;
import com.agentcores.api.dto.AuthTokenPairDTO;
import com.agentcores.domain.audit.adapter.repository.IAuditLogRepository;
import com.agentcores.domain.audit.model.entity.AuditLogEntity;
import com.agentcores.domain.auth.adapter.gateway.IPasswordHasher;
import com.agentcores.domain.auth.adapter.gateway.ITokenCodec;
import com.agentcores.domain.auth.adapter.repository.IAuthTokenRepository;
import com.agentcores.domain.auth.adapter.repository.IInvitationRepository;
import com.agentcores.domain.auth.adapter.repository.IUserRepository;
import com.agentcores.domain.auth.model.entity.InvitationEntity;
import com.agentcores.domain.auth.model.entity.RefreshTokenEntity;
import com.agentcores.domain.auth.model.entity.TokenFamilyEntity;
import com.agentcores.domain.auth.model.entity.UserEntity;
import com.agentcores.domain.auth.model.valobj.IssuedSession;
import com.agentcores.domain.auth.model.valobj.TenantContext;
import com.agentcores.domain.auth.model.valobj.TokenClaims;
import com.agentcores.domain.auth.model.valobj.TokenKind;
import com.agentcores.domain.authorization.service.PermissionTable;
import com.agentcores.domain.tenant.adapter.repository.ITenantRepository;
import com.agentcores.domain.tenant.model.entity.TenantEntity;
import com.agentcores.domain.tenant.service.TenantQuotaDomainService;
import com.agentcores.trigger.application.common.AccountViewAssembler;
import com.agentcores.types.common.Constants;
import com.agentcores.types.enums.AuditEventTypeEnum;
import com.agentcores.types.enums.AuditOutcomeEnum;
import com.agentcores.types.enums.ResponseCode;
import com.agentcores.types.enums.TenantTierEnum;
import com.agentcores.types.enums.UserRoleEnum;
import com.agentcores.types.exception.AppException;
import com.google.common.cache.Cache;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.Locale;
import java.util.UUID;

/**
 * 认证会话写用例：登录、刷新轮换、注册、登出与访问令牌解析。
 * <p>
 * 刷新令牌单次使用：每次刷新先以条件更新消费旧令牌，消费失败或重复使用即判定为重放，
 * 整个令牌族随之吊销。令牌族吊销状态经本地缓存加速，吊销时同步写入缓存。
 * </p>
 *
 * @author agentcores
 * @since 2026-03-06
 */
@Slf4j
@Service
public class AuthSessionCommandService {

    private static final String REVOKE_REASON_REUSE = "refresh_token_reuse";
    private static final String REVOKE_REASON_LOGOUT = "logout";
    private static final String REVOKE_REASON_INACTIVE = "user_inactive";
    private static final int MAX_NUMERIC_SELECTOR_LENGTH = 18;

    private final ITenantRepository tenantRepository;
    private final IUserRepository userRepository;
    private final IInvitationRepository invitationRepository;
    private final IAuthTokenRepository authTokenRepository;
    private final IAuditLogRepository auditLogRepository;
    private final ITokenCodec tokenCodec;
    private final IPasswordHasher passwordHasher;
    private final TenantQuotaDomainService tenantQuotaDomainService;
    private final AccountViewAssembler accountViewAssembler;
    private final Cache<String, Boolean> familyRevocationCache;
    private final Duration accessTtl;
    private final Duration refreshTtl;
    private final String dummyPasswordHash;

    public AuthSessionCommandService(ITenantRepository tenantRepository,
                                     IUserRepository userRepository,
                                     IInvitationRepository invitationRepository,
                                     IAuthTokenRepository authTokenRepository,
                                     IAuditLogRepository auditLogRepository,
                                     ITokenCodec tokenCodec,
                                     IPasswordHasher passwordHasher,
                                     TenantQuotaDomainService tenantQuotaDomainService,
                                     AccountViewAssembler accountViewAssembler,
                                     @Qualifier("familyRevocationCache") Cache<String, Boolean> familyRevocationCache,
                                     @Value("${app.auth.token.access-ttl-minutes:15}") long accessTtlMinutes,
                                     @Value("${app.auth.token.refresh-ttl-days:7}") long refreshTtlDays) {
        if (accessTtlMinutes <= 0 || refreshTtlDays <= 0) {
            throw new IllegalStateException("Token TTLs must be positive");
        }
        this.tenantRepository = tenantRepository;
        this.userRepository = userRepository;
        this.invitationRepository = invitationRepository;
        this.authTokenRepository = authTokenRepository;
        this.auditLogRepository = auditLogRepository;
        this.tokenCodec = tokenCodec;
        this.passwordHasher = passwordHasher;
        this.tenantQuotaDomainService = tenantQuotaDomainService;
        this.accountViewAssembler = accountViewAssembler;
        this.familyRevocationCache = familyRevocationCache;
        this.accessTtl = Duration.ofMinutes(accessTtlMinutes);
        this.refreshTtl = Duration.ofDays(refreshTtlDays);
        // 未知用户也走一次完整的哈希比较，使两种失败耗时一致
        this.dummyPasswordHash = passwordHasher.hash(UUID.randomUUID().toString());
    }

    public AuthSessionDTO login(AuthLoginRequestDTO request) {
        if (request == null) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "请求体不能为空");
        }
        String email = normalizeEmail(request.getEmail());
        String password = StringUtils.defaultString(request.getPassword());
        String selector = StringUtils.trimToEmpty(request.getTenantSelector());
        if (StringUtils.isAnyBlank(email, password, selector)) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "email, password and tenant_selector are required");
        }

        TenantEntity tenant = resolveTenant(selector);
        if (tenant == null || !tenant.isActive()) {
            log.info("AUTH_LOGIN_FAILED reason=tenant_not_found, selector={}", selector);
            throw new AppException(ResponseCode.TENANT_NOT_FOUND);
        }
        UserEntity user = userRepository.findByTenantAndEmail(tenant.getId(), email);
        boolean passwordMatched = passwordHasher.matches(password,
                user == null ? dummyPasswordHash : user.getPasswordHash());
        if (user == null || !passwordMatched || !user.isActive()) {
            auditLogRepository.append(AuditLogEntity.event(tenant.getId(), user == null ? null : user.getId(),
                            AuditEventTypeEnum.LOGIN_FAILED, AuditOutcomeEnum.DENIED, "user",
                            user == null ? null : user.getId())
                    .with("email", email));
            log.info("AUTH_LOGIN_FAILED reason=invalid_credentials, tenantId={}", tenant.getId());
            throw new AppException(ResponseCode.INVALID_CREDENTIALS);
        }

        LocalDateTime now = LocalDateTime.now();
        TenantContext context = new TenantContext(tenant.getId(), user.getId(), user.getRole(), null);
        userRepository.touchLastLogin(context, now);
        user.markLogin(now);

        IssuedSession session = issueSession(user, openFamily(user));
        auditLogRepository.append(AuditLogEntity.event(tenant.getId(), user.getId(),
                AuditEventTypeEnum.LOGIN, AuditOutcomeEnum.ALLOWED, "user", user.getId())
                .with("family_id", session.familyId()));
        log.info("AUTH_LOGIN tenantId={}, userId={}, role={}, familyId={}",
                tenant.getId(), user.getId(), user.getRole(), session.familyId());
        return accountViewAssembler.toSession(session, user, tenant);
    }

    /**
     * 刷新令牌轮换。旧令牌只能被消费一次；重复使用时吊销整个令牌族。
     */
    public AuthTokenPairDTO refresh(AuthRefreshRequestDTO request) {
        String token = request == null ? null : StringUtils.trimToNull(request.getRefreshToken());
        if (token == null) {
            throw new AppException(ResponseCode.INVALID_TOKEN);
        }
        TokenClaims claims = tokenCodec.decode(token, TokenKind.REFRESH);
        RefreshTokenEntity stored = authTokenRepository.findRefreshToken(claims.tokenId());
        if (stored == null || !StringUtils.equals(stored.getFamilyId(), claims.familyId())) {
            throw new AppException(ResponseCode.INVALID_TOKEN);
        }
        TokenFamilyEntity family = authTokenRepository.findFamily(claims.familyId());
        if (family == null || family.isRevoked()) {
            throw new AppException(ResponseCode.INVALID_TOKEN);
        }
        if (stored.isConsumed() || !authTokenRepository.consumeRefreshToken(claims.tokenId())) {
            revokeFamily(family.getId(), REVOKE_REASON_REUSE);
            auditLogRepository.append(AuditLogEntity.event(family.getTenantId(), family.getUserId(),
                            AuditEventTypeEnum.TOKEN_REUSE_DETECTED, AuditOutcomeEnum.DENIED, "token_family",
                            family.getId())
                    .with("token_id", claims.tokenId()));
            log.warn("AUTH_TOKEN_REUSE tenantId={}, userId={}, familyId={}, tokenId={}",
                    family.getTenantId(), family.getUserId(), family.getId(), claims.tokenId());
            throw new AppException(ResponseCode.TOKEN_REUSED);
        }

        TenantContext context = new TenantContext(claims.tenantId(), claims.userId(), null, family.getId());
        UserEntity user = userRepository.findById(context, claims.userId());
        TenantEntity tenant = tenantRepository.findById(claims.tenantId());
        if (user == null || !user.isActive() || tenant == null || !tenant.isActive()) {
            revokeFamily(family.getId(), REVOKE_REASON_INACTIVE);
            throw new AppException(ResponseCode.INVALID_TOKEN);
        }
        IssuedSession session = issueSession(user, family.getId());
        auditLogRepository.append(AuditLogEntity.event(user.getTenantId(), user.getId(),
                AuditEventTypeEnum.TOKEN_REFRESHED, AuditOutcomeEnum.ALLOWED, "token_family", family.getId()));
        log.info("AUTH_REFRESH tenantId={}, userId={}, familyId={}", user.getTenantId(), user.getId(), family.getId());
        return accountViewAssembler.toTokenPair(session);
    }

    /**
     * 注册：无邀请令牌时创建组织（首个用户为 owner），否则接受邀请加入既有租户。
     */
    @Transactional(rollbackFor = Exception.class)
    public AuthSessionDTO register(AuthRegisterRequestDTO request) {
        if (request == null) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "请求体不能为空");
        }
        String email = normalizeEmail(request.getEmail());
        if (StringUtils.isBlank(email) || !email.contains("@")) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "A valid email is required");
        }
        validatePassword(request.getPassword());
        String fullName = StringUtils.trimToNull(request.getFullName());

        if (StringUtils.isNotBlank(request.getInvitationToken())) {
            return acceptInvitation(request.getInvitationToken().trim(), email, request.getPassword(), fullName);
        }
        return createOrganization(request, email, fullName);
    }

    public AuthLogoutResponseDTO logout(TenantContext context) {
        boolean revoked = false;
        if (StringUtils.isNotBlank(context.tokenFamilyId())) {
            revoked = revokeFamily(context.tokenFamilyId(), REVOKE_REASON_LOGOUT);
        }
        auditLogRepository.append(AuditLogEntity.event(context.tenantId(), context.userId(),
                AuditEventTypeEnum.LOGOUT, AuditOutcomeEnum.ALLOWED, "token_family", context.tokenFamilyId()));
        log.info("AUTH_LOGOUT tenantId={}, userId={}, familyId={}, revoked={}",
                context.tenantId(), context.userId(), context.tokenFamilyId(), revoked);
        AuthLogoutResponseDTO dto = new AuthLogoutResponseDTO();
        dto.setRevoked(revoked);
        return dto;
    }

    public AuthMeResponseDTO me(TenantContext context) {
        UserEntity user = userRepository.findById(context, context.userId());
        TenantEntity tenant = tenantRepository.findCurrent(context);
        if (user == null || tenant == null) {
            throw new AppException(ResponseCode.INVALID_TOKEN);
        }
        AuthMeResponseDTO dto = new AuthMeResponseDTO();
        dto.setUser(accountViewAssembler.toUserSummary(user));
        dto.setTenant(accountViewAssembler.toTenant(tenant));
        dto.setRole(context.role() == null ? null : context.role().getCode());
        dto.setCapabilities(PermissionTable.capabilitiesOf(context.role()).stream()
                .map(Enum::name)
                .toList());
        return dto;
    }

    /**
     * 校验访问令牌并构造请求级租户上下文。
     */
    public TenantContext resolveAccessToken(String token) {
        if (StringUtils.isBlank(token)) {
            throw new AppException(ResponseCode.INVALID_TOKEN);
        }
        TokenClaims claims = tokenCodec.decode(token, TokenKind.ACCESS);
        if (isFamilyRevoked(claims.familyId())) {
            throw new AppException(ResponseCode.INVALID_TOKEN);
        }
        return claims.toTenantContext();
    }

    /**
     * 从 Authorization 头中解析 Bearer 令牌。
     */
    public static String parseBearer(String authorization) {
        if (StringUtils.isBlank(authorization)) {
            return null;
        }
        String value = authorization.trim();
        String prefix = Constants.BEARER_PREFIX;
        if (value.length() < prefix.length() || !value.regionMatches(true, 0, prefix, 0, prefix.length())) {
            return null;
        }
        return StringUtils.trimToNull(value.substring(prefix.length()));
    }

    /**
     * 吊销用户的全部令牌族（停用用户或变更角色时调用）。
     */
    public int revokeAllSessions(Long tenantId, Long userId, String reason) {
        int revoked = authTokenRepository.revokeFamiliesOfUser(tenantId, userId, reason);
        familyRevocationCache.invalidateAll();
        log.info("AUTH_SESSIONS_REVOKED tenantId={}, userId={}, families={}, reason={}",
                tenantId, userId, revoked, reason);
        return revoked;
    }

    private AuthSessionDTO createOrganization(AuthRegisterRequestDTO request, String email, String fullName) {
        String name = StringUtils.trimToNull(request.getTenantName());
        if (name == null) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "tenant_name is required");
        }
        String slug = slugify(StringUtils.defaultIfBlank(request.getTenantSlug(), name));
        if (StringUtils.isBlank(slug)) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "tenant_slug must contain letters or digits");
        }
        if (tenantRepository.existsByNameOrSlug(name, slug)) {
            throw new AppException(ResponseCode.DUPLICATE_TENANT);
        }

        TenantEntity tenant = new TenantEntity();
        tenant.setName(name);
        tenant.setSlug(slug);
        tenant.setTier(TenantTierEnum.FREE);
        tenant.applyQuota(tenantQuotaDomainService.quotaOf(TenantTierEnum.FREE));
        tenant.setActive(true);
        TenantEntity savedTenant = tenantRepository.save(tenant);

        UserEntity user = newUser(savedTenant.getId(), email, request.getPassword(), fullName, UserRoleEnum.OWNER);
        UserEntity savedUser = userRepository.save(user);

        auditLogRepository.append(AuditLogEntity.event(savedTenant.getId(), savedUser.getId(),
                        AuditEventTypeEnum.TENANT_REGISTERED, AuditOutcomeEnum.ALLOWED, "tenant", savedTenant.getId())
                .with("slug", slug));
        log.info("TENANT_REGISTERED tenantId={}, slug={}, ownerUserId={}", savedTenant.getId(), slug, savedUser.getId());
        IssuedSession session = issueSession(savedUser, openFamily(savedUser));
        return accountViewAssembler.toSession(session, savedUser, savedTenant);
    }

    private AuthSessionDTO acceptInvitation(String invitationToken, String email, String password, String fullName) {
        InvitationEntity invitation = invitationRepository.findByToken(invitationToken);
        if (invitation == null) {
            throw new AppException(ResponseCode.RESOURCE_NOT_FOUND, "Invitation not found");
        }
        LocalDateTime now = LocalDateTime.now();
        invitation.checkAcceptable(now);
        if (!StringUtils.equalsIgnoreCase(invitation.getEmail(), email)) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "Email does not match the invitation");
        }
        TenantEntity tenant = tenantRepository.findById(invitation.getTenantId());
        if (tenant == null || !tenant.isActive()) {
            throw new AppException(ResponseCode.RESOURCE_NOT_FOUND, "Invitation not found");
        }
        if (userRepository.findByTenantAndEmail(tenant.getId(), email) != null) {
            throw new AppException(ResponseCode.DUPLICATE_EMAIL);
        }
        if (!invitationRepository.markConsumed(invitation.getId(), now)) {
            throw new AppException(ResponseCode.INVITATION_CONSUMED);
        }
        invitation.markConsumed(now);

        UserEntity savedUser = userRepository.save(newUser(tenant.getId(), email, password, fullName, invitation.getRole()));
        auditLogRepository.append(AuditLogEntity.event(tenant.getId(), savedUser.getId(),
                        AuditEventTypeEnum.INVITATION_ACCEPTED, AuditOutcomeEnum.ALLOWED, "invitation", invitation.getId())
                .with("role", invitation.getRole().getCode()));
        log.info("INVITATION_ACCEPTED tenantId={}, invitationId={}, userId={}, role={}",
                tenant.getId(), invitation.getId(), savedUser.getId(), invitation.getRole());
        IssuedSession session = issueSession(savedUser, openFamily(savedUser));
        return accountViewAssembler.toSession(session, savedUser, tenant);
    }

    private UserEntity newUser(Long tenantId, String email, String password, String fullName, UserRoleEnum role) {
        UserEntity user = new UserEntity();
        user.setTenantId(tenantId);
        user.setEmail(email);
        user.setPasswordHash(passwordHasher.hash(password));
        user.setFullName(fullName);
        user.setRole(role);
        user.setActive(true);
        return user;
    }

    private String openFamily(UserEntity user) {
        TokenFamilyEntity family = new TokenFamilyEntity();
        family.setId(UUID.randomUUID().toString());
        family.setTenantId(user.getTenantId());
        family.setUserId(user.getId());
        family.setRevoked(false);
        authTokenRepository.createFamily(family);
        familyRevocationCache.put(family.getId(), Boolean.FALSE);
        return family.getId();
    }

    /**
     * 在指定令牌族下签发新的访问/刷新令牌对，角色取自当前用户记录。
     */
    private IssuedSession issueSession(UserEntity user, String familyId) {
        Instant now = Instant.now();
        Instant accessExpiresAt = now.plus(accessTtl);
        Instant refreshExpiresAt = now.plus(refreshTtl);
        String refreshTokenId = UUID.randomUUID().toString();

        String accessToken = tokenCodec.encode(new TokenClaims(TokenKind.ACCESS, user.getId(), user.getTenantId(),
                user.getRole(), familyId, UUID.randomUUID().toString(), now, accessExpiresAt));
        String refreshToken = tokenCodec.encode(new TokenClaims(TokenKind.REFRESH, user.getId(), user.getTenantId(),
                null, familyId, refreshTokenId, now, refreshExpiresAt));

        RefreshTokenEntity stored = new RefreshTokenEntity();
        stored.setTokenId(refreshTokenId);
        stored.setFamilyId(familyId);
        stored.setTenantId(user.getTenantId());
        stored.setUserId(user.getId());
        stored.setIssuedAt(AccountViewAssembler.toLocal(now));
        stored.setExpiresAt(AccountViewAssembler.toLocal(refreshExpiresAt));
        stored.setConsumed(false);
        authTokenRepository.saveRefreshToken(stored);
        return new IssuedSession(accessToken, accessExpiresAt, refreshToken, refreshTokenId, refreshExpiresAt, familyId);
    }

    private boolean revokeFamily(String familyId, String reason) {
        boolean revoked = authTokenRepository.revokeFamily(familyId, reason);
        familyRevocationCache.put(familyId, Boolean.TRUE);
        return revoked;
    }

    private boolean isFamilyRevoked(String familyId) {
        Boolean cached = familyRevocationCache.getIfPresent(familyId);
        if (cached != null) {
            return cached;
        }
        TokenFamilyEntity family = authTokenRepository.findFamily(familyId);
        boolean revoked = family == null || family.isRevoked();
        familyRevocationCache.put(familyId, revoked);
        return revoked;
    }

    private TenantEntity resolveTenant(String selector) {
        if (StringUtils.isNumeric(selector) && selector.length() <= MAX_NUMERIC_SELECTOR_LENGTH) {
            TenantEntity byId = tenantRepository.findById(Long.parseLong(selector));
            if (byId != null) {
                return byId;
            }
        }
        return tenantRepository.findBySlug(selector.toLowerCase(Locale.ROOT));
    }

    private static void validatePassword(String password) {
        if (password == null || password.length() < 8
                || !password.chars().anyMatch(Character::isUpperCase)
                || !password.chars().anyMatch(Character::isLowerCase)
                || !password.chars().anyMatch(Character::isDigit)) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER,
                    "Password must be at least 8 characters with upper, lower case letters and a digit");
        }
    }

    static String normalizeEmail(String email) {
        return StringUtils.trimToEmpty(email).toLowerCase(Locale.ROOT);
    }

    static String slugify(String raw) {
        String lowered = StringUtils.trimToEmpty(raw).toLowerCase(Locale.ROOT);
        String dashed = lowered.replaceAll("[^a-z0-9]+", "-");
        return StringUtils.strip(dashed, "-");
    }
}
