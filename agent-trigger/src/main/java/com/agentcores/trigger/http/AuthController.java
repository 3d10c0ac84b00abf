package com.agentcores.trigger.http;

import com.agentcores.api.dto.AuthLoginRequestDTO;
import com.agentcores.api.dto.AuthLogoutResponseDTO;
import com.agentcores.api.dto.AuthMeResponseDTO;
import com.agentcores.api.dto.AuthRefreshRequestDTO;
import com.agentcores.api.dto.AuthRegisterRequestDTO;
import com.agentcores.api.dto.AuthSessionDTO;
import com.agentcores.api.dto.AuthTokenPairDTO;
import com.agentcores.api.dto.InvitationCreateRequestDTO;
import com.agentcores.api.dto.InvitationDTO;
import com.agentcores.api.response.Response;
import com.agentcores.domain.auth.model.valobj.TenantContext;
import com.agentcores.domain.authorization.service.PermissionTable;
import com.agentcores.trigger.application.command.AuthSessionCommandService;
import com.agentcores.trigger.application.command.InvitationCommandService;
import com.agentcores.types.enums.CapabilityEnum;
import com.agentcores.types.enums.ResponseCode;
import com.agentcores.types.enums.UserRoleEnum;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 登录、刷新、注册与身份会话 API。
 * <p>
 * login / refresh / register 不需要访问令牌，其余接口的租户上下文由鉴权过滤器注入。
 * </p>
 */
@RestController
@RequestMapping("/api/auth")
public class AuthController {

    private final AuthSessionCommandService authSessionCommandService;
    private final InvitationCommandService invitationCommandService;

    public AuthController(AuthSessionCommandService authSessionCommandService,
                          InvitationCommandService invitationCommandService) {
        this.authSessionCommandService = authSessionCommandService;
        this.invitationCommandService = invitationCommandService;
    }

    @PostMapping("/login")
    public Response<AuthSessionDTO> login(@RequestBody AuthLoginRequestDTO request) {
        return success(authSessionCommandService.login(request));
    }

    @PostMapping("/refresh")
    public Response<AuthTokenPairDTO> refresh(@RequestBody AuthRefreshRequestDTO request) {
        return success(authSessionCommandService.refresh(request));
    }

    @PostMapping("/register")
    @ResponseStatus(HttpStatus.CREATED)
    public Response<AuthSessionDTO> register(@RequestBody AuthRegisterRequestDTO request) {
        return success(authSessionCommandService.register(request));
    }

    @PostMapping("/logout")
    public Response<AuthLogoutResponseDTO> logout(TenantContext context) {
        return success(authSessionCommandService.logout(context));
    }

    @GetMapping("/me")
    public Response<AuthMeResponseDTO> me(TenantContext context) {
        return success(authSessionCommandService.me(context));
    }

    /**
     * 角色 -> 能力表导出，供前端控制按钮可见性。
     */
    @GetMapping("/permissions")
    public Response<Map<String, List<String>>> permissions(TenantContext context) {
        Map<String, List<String>> table = new LinkedHashMap<>();
        for (Map.Entry<UserRoleEnum, Set<CapabilityEnum>> entry : PermissionTable.asMap().entrySet()) {
            table.put(entry.getKey().getCode(), entry.getValue().stream().map(CapabilityEnum::name).sorted().toList());
        }
        return success(table);
    }

    @PostMapping("/invitations")
    @ResponseStatus(HttpStatus.CREATED)
    public Response<InvitationDTO> createInvitation(TenantContext context,
                                                    @RequestBody InvitationCreateRequestDTO request) {
        return success(invitationCommandService.create(context, request));
    }

    @GetMapping("/invitations")
    public Response<List<InvitationDTO>> listInvitations(TenantContext context) {
        return success(invitationCommandService.listPending(context));
    }

    private <T> Response<T> success(T data) {
        return Response.<T>builder()
                .code(ResponseCode.SUCCESS.getCode())
                .info(ResponseCode.SUCCESS.getInfo())
                .data(data)
                .build();
    }
}
