package com.agentcores.trigger.http;

import com.agentcores.api.dto.UserRoleUpdateRequestDTO;
import com.agentcores.api.dto.UserSummaryDTO;
import com.agentcores.api.response.Response;
import com.agentcores.domain.auth.model.valobj.TenantContext;
import com.agentcores.trigger.application.command.UserManagementCommandService;
import com.agentcores.types.enums.ResponseCode;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * 租户内用户管理 API。
 */
@RestController
@RequestMapping("/api/users")
public class UserController {

    private final UserManagementCommandService userManagementCommandService;

    public UserController(UserManagementCommandService userManagementCommandService) {
        this.userManagementCommandService = userManagementCommandService;
    }

    @GetMapping
    public Response<List<UserSummaryDTO>> list(TenantContext context) {
        return success(userManagementCommandService.list(context));
    }

    @PutMapping("/{id}/role")
    public Response<UserSummaryDTO> changeRole(TenantContext context,
                                               @PathVariable("id") Long id,
                                               @RequestBody UserRoleUpdateRequestDTO request) {
        return success(userManagementCommandService.changeRole(context, id, request));
    }

    @PostMapping("/{id}/deactivate")
    public Response<UserSummaryDTO> deactivate(TenantContext context, @PathVariable("id") Long id) {
        return success(userManagementCommandService.deactivate(context, id));
    }

    private <T> Response<T> success(T data) {
        return Response.<T>builder()
                .code(ResponseCode.SUCCESS.getCode())
                .info(ResponseCode.SUCCESS.getInfo())
                .data(data)
                .build();
    }
}
