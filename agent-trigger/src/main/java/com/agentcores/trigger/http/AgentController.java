package com.agentcores.trigger.http;

import com.agentcores.api.dto.AgentDTO;
import com.agentcores.api.dto.AgentUpsertRequestDTO;
import com.agentcores.api.response.Response;
import com.agentcores.domain.auth.model.valobj.TenantContext;
import com.agentcores.trigger.application.command.AgentCommandService;
import com.agentcores.trigger.application.query.AgentQueryService;
import com.agentcores.types.enums.ResponseCode;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Agent 管理 API。跨租户 ID 一律按不存在处理。
 */
@RestController
@RequestMapping("/api/agents")
public class AgentController {

    private final AgentCommandService agentCommandService;
    private final AgentQueryService agentQueryService;

    public AgentController(AgentCommandService agentCommandService, AgentQueryService agentQueryService) {
        this.agentCommandService = agentCommandService;
        this.agentQueryService = agentQueryService;
    }

    @GetMapping
    public Response<List<AgentDTO>> list(TenantContext context) {
        return success(agentQueryService.list(context));
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public Response<AgentDTO> create(TenantContext context, @RequestBody AgentUpsertRequestDTO request) {
        return success(agentCommandService.create(context, request));
    }

    @GetMapping("/{id}")
    public Response<AgentDTO> get(TenantContext context, @PathVariable("id") Long id) {
        return success(agentQueryService.get(context, id));
    }

    @PutMapping("/{id}")
    public Response<AgentDTO> update(TenantContext context,
                                     @PathVariable("id") Long id,
                                     @RequestBody AgentUpsertRequestDTO request) {
        return success(agentCommandService.update(context, id, request));
    }

    @DeleteMapping("/{id}")
    public Response<AgentDTO> delete(TenantContext context, @PathVariable("id") Long id) {
        return success(agentCommandService.delete(context, id));
    }

    private <T> Response<T> success(T data) {
        return Response.<T>builder()
                .code(ResponseCode.SUCCESS.getCode())
                .info(ResponseCode.SUCCESS.getInfo())
                .data(data)
                .build();
    }
}
