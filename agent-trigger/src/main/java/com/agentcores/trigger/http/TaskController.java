package com.agentcores.trigger.http;

import com.agentcores.api.dto.TaskActionResponseDTO;
import com.agentcores.api.dto.TaskCreateRequestDTO;
import com.agentcores.api.dto.TaskDetailDTO;
import com.agentcores.api.response.Response;
import com.agentcores.domain.auth.model.valobj.TenantContext;
import com.agentcores.trigger.application.command.TaskLifecycleCommandService;
import com.agentcores.trigger.application.query.TaskQueryService;
import com.agentcores.types.enums.ResponseCode;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Task API：创建、查询、执行与取消。execute / cancel 为异步受理，返回 202 与当前状态。
 */
@RestController
@RequestMapping("/api/tasks")
public class TaskController {

    private final TaskLifecycleCommandService taskLifecycleCommandService;
    private final TaskQueryService taskQueryService;

    public TaskController(TaskLifecycleCommandService taskLifecycleCommandService,
                          TaskQueryService taskQueryService) {
        this.taskLifecycleCommandService = taskLifecycleCommandService;
        this.taskQueryService = taskQueryService;
    }

    @GetMapping
    public Response<List<TaskDetailDTO>> list(TenantContext context,
                                              @RequestParam(value = "status", required = false) String status,
                                              @RequestParam(value = "agentId", required = false) Long agentId,
                                              @RequestParam(value = "limit", required = false) Integer limit) {
        return success(taskQueryService.list(context, status, agentId, limit));
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public Response<TaskDetailDTO> create(TenantContext context, @RequestBody TaskCreateRequestDTO request) {
        return success(taskLifecycleCommandService.create(context, request));
    }

    @GetMapping("/{id}")
    public Response<TaskDetailDTO> get(TenantContext context, @PathVariable("id") Long id) {
        return success(taskQueryService.get(context, id));
    }

    @PostMapping("/{id}/execute")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public Response<TaskActionResponseDTO> execute(TenantContext context, @PathVariable("id") Long id) {
        return success(taskLifecycleCommandService.execute(context, id));
    }

    @PostMapping("/{id}/cancel")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public Response<TaskActionResponseDTO> cancel(TenantContext context, @PathVariable("id") Long id) {
        return success(taskLifecycleCommandService.cancel(context, id));
    }

    private <T> Response<T> success(T data) {
        return Response.<T>builder()
                .code(ResponseCode.SUCCESS.getCode())
                .info(ResponseCode.SUCCESS.getInfo())
                .data(data)
                .build();
    }
}
