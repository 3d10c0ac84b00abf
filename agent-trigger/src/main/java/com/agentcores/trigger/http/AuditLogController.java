package com.agentcores.trigger.http;

import com.agentcores.api.dto.AuditLogDTO;
import com.agentcores.api.response.Response;
import com.agentcores.domain.auth.model.valobj.TenantContext;
import com.agentcores.trigger.application.query.AuditLogQueryService;
import com.agentcores.types.enums.ResponseCode;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * 审计日志查询 API。
 */
@RestController
@RequestMapping("/api/audit-logs")
public class AuditLogController {

    private final AuditLogQueryService auditLogQueryService;

    public AuditLogController(AuditLogQueryService auditLogQueryService) {
        this.auditLogQueryService = auditLogQueryService;
    }

    @GetMapping
    public Response<List<AuditLogDTO>> list(TenantContext context,
                                            @RequestParam(value = "eventType", required = false) String eventType,
                                            @RequestParam(value = "outcome", required = false) String outcome,
                                            @RequestParam(value = "limit", required = false) Integer limit) {
        return Response.<List<AuditLogDTO>>builder()
                .code(ResponseCode.SUCCESS.getCode())
                .info(ResponseCode.SUCCESS.getInfo())
                .data(auditLogQueryService.list(context, eventType, outcome, limit))
                .build();
    }
}
