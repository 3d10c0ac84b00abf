package com.agentcores.trigger.http;

import com.agentcores.api.dto.TenantDTO;
import com.agentcores.api.dto.TenantUpdateRequestDTO;
import com.agentcores.api.response.Response;
import com.agentcores.domain.auth.model.valobj.TenantContext;
import com.agentcores.trigger.application.command.TenantCommandService;
import com.agentcores.types.enums.ResponseCode;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 当前租户设置 API。
 */
@RestController
@RequestMapping("/api/tenants")
public class TenantController {

    private final TenantCommandService tenantCommandService;

    public TenantController(TenantCommandService tenantCommandService) {
        this.tenantCommandService = tenantCommandService;
    }

    @GetMapping("/current")
    public Response<TenantDTO> current(TenantContext context) {
        return success(tenantCommandService.current(context));
    }

    @PutMapping("/current")
    public Response<TenantDTO> rename(TenantContext context, @RequestBody TenantUpdateRequestDTO request) {
        return success(tenantCommandService.rename(context, request));
    }

    private <T> Response<T> success(T data) {
        return Response.<T>builder()
                .code(ResponseCode.SUCCESS.getCode())
                .info(ResponseCode.SUCCESS.getInfo())
                .data(data)
                .build();
    }
}
