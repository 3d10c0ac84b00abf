package com.agentcores.domain.task.service;

import com.agentcores.domain.task.adapter.gateway.IHttpCallGateway;
import com.agentcores.domain.task.model.valobj.ApiCallInput;
import com.agentcores.domain.task.model.valobj.DispatchError;
import com.agentcores.domain.task.model.valobj.DispatchOutcome;
import com.agentcores.domain.task.model.valobj.HttpCallResult;
import com.agentcores.domain.task.model.valobj.TaskInput;
import com.agentcores.domain.task.model.valobj.TextOperation;
import com.agentcores.domain.task.model.valobj.TextProcessingInput;
import com.agentcores.domain.task.model.valobj.WorkflowInput;
import com.agentcores.domain.task.model.valobj.WorkflowStep;
import com.agentcores.types.enums.ResponseCode;
import com.agentcores.types.enums.TaskTypeEnum;
import com.agentcores.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Task 分派领域服务：按任务类型执行并返回结果或类型化错误。
 * <p>
 * 不做任何持久化，状态记录只由生命周期管理负责，因此同一输入可以安全重试。
 * 挂起只发生在 api_call 的出站 I/O 和 delay 步骤内。
 * </p>
 */
@Slf4j
@Service
public class TaskDispatchDomainService {

    private final TaskInputDomainService taskInputDomainService;
    private final IHttpCallGateway httpCallGateway;

    public TaskDispatchDomainService(TaskInputDomainService taskInputDomainService,
                                     IHttpCallGateway httpCallGateway) {
        this.taskInputDomainService = taskInputDomainService;
        this.httpCallGateway = httpCallGateway;
    }

    /**
     * 执行任务。
     *
     * @param taskType 任务类型
     * @param inputData 原始输入
     * @param timeBudget 墙钟上限（任务的 timeout_seconds）
     */
    public DispatchOutcome dispatch(TaskTypeEnum taskType, Map<String, Object> inputData, Duration timeBudget) {
        TaskInput input;
        try {
            input = taskInputDomainService.parse(taskType, inputData);
        } catch (AppException ex) {
            return DispatchOutcome.failure(DispatchError.of(ResponseCode.EXECUTION_ERROR,
                    "Invalid input: " + ex.getInfo()));
        }
        long deadlineNanos = System.nanoTime() + Math.max(timeBudget.toNanos(), 0L);
        return dispatch(input, deadlineNanos);
    }

    private DispatchOutcome dispatch(TaskInput input, long deadlineNanos) {
        return switch (input.type()) {
            case TEXT_PROCESSING -> runText((TextProcessingInput) input);
            case API_CALL -> runApiCall((ApiCallInput) input, deadlineNanos);
            case WORKFLOW -> runWorkflow((WorkflowInput) input, deadlineNanos);
        };
    }

    private DispatchOutcome runText(TextProcessingInput input) {
        TextOperation operation = TextOperation.fromCode(input.operation());
        if (operation == null) {
            return DispatchOutcome.failure(DispatchError.of(ResponseCode.UNSUPPORTED_OPERATION,
                    "Unsupported text operation: " + input.operation()));
        }
        Map<String, Object> output = new LinkedHashMap<>();
        output.put("operation", operation.getCode());
        output.put("result", operation.apply(input.text()));
        return DispatchOutcome.success(output);
    }

    private DispatchOutcome runApiCall(ApiCallInput input, long deadlineNanos) {
        Duration remaining = remaining(deadlineNanos);
        if (remaining.isZero()) {
            return DispatchOutcome.failure(DispatchError.of(ResponseCode.TIMEOUT, "No time left for api_call"));
        }
        HttpCallResult result;
        try {
            result = httpCallGateway.call(input, remaining);
        } catch (AppException ex) {
            ResponseCode kind = ResponseCode.TIMEOUT.getCode().equals(ex.getCode())
                    ? ResponseCode.TIMEOUT
                    : ResponseCode.EXECUTION_ERROR;
            return DispatchOutcome.failure(DispatchError.of(kind, ex.getInfo()));
        }
        if (!result.isSuccessful()) {
            return DispatchOutcome.failure(new DispatchError(ResponseCode.EXECUTION_ERROR,
                    input.method() + " " + input.url() + " returned " + result.statusCode(),
                    result.statusCode(), null));
        }
        Map<String, Object> output = new LinkedHashMap<>();
        output.put("status_code", result.statusCode());
        output.put("body", result.json() != null ? result.json() : result.body());
        if (result.truncated()) {
            output.put("truncated", true);
        }
        return DispatchOutcome.success(output);
    }

    private DispatchOutcome runWorkflow(WorkflowInput input, long deadlineNanos) {
        List<Map<String, Object>> results = new ArrayList<>();
        for (WorkflowStep step : input.steps()) {
            if (Thread.currentThread().isInterrupted()) {
                return DispatchOutcome.failure(DispatchError.of(ResponseCode.EXECUTION_ERROR,
                        "Workflow interrupted before step '" + step.name() + "'")
                        .withPartialResults(List.copyOf(results)));
            }
            DispatchOutcome stepOutcome = runStep(step, deadlineNanos);
            if (!stepOutcome.isSuccess()) {
                DispatchError error = stepOutcome.error();
                return DispatchOutcome.failure(new DispatchError(error.kind(),
                        "Step '" + step.name() + "' failed: " + error.message(),
                        error.upstreamStatus(), List.copyOf(results)));
            }
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("step", step.name());
            entry.put("type", step.type().getCode());
            entry.put("output", stepOutcome.output());
            results.add(entry);
        }
        Map<String, Object> output = new LinkedHashMap<>();
        output.put("steps_completed", results.size());
        output.put("results", results);
        return DispatchOutcome.success(output);
    }

    private DispatchOutcome runStep(WorkflowStep step, long deadlineNanos) {
        return switch (step.type()) {
            case DELAY -> runDelay(step.delaySeconds(), deadlineNanos);
            case LOG -> {
                log.info("WORKFLOW_STEP_LOG step={}, message={}", step.name(), step.message());
                Map<String, Object> output = new LinkedHashMap<>();
                output.put("message", step.message());
                yield DispatchOutcome.success(output);
            }
            case TEXT_PROCESSING, API_CALL -> dispatch(step.nested(), deadlineNanos);
        };
    }

    private DispatchOutcome runDelay(double seconds, long deadlineNanos) {
        long requestedMillis = (long) Math.ceil(seconds * 1000d);
        long remainingMillis = remaining(deadlineNanos).toMillis();
        long sleepMillis = Math.min(requestedMillis, remainingMillis);
        try {
            Thread.sleep(sleepMillis);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return DispatchOutcome.failure(DispatchError.of(ResponseCode.EXECUTION_ERROR, "Delay interrupted"));
        }
        if (requestedMillis > remainingMillis) {
            return DispatchOutcome.failure(DispatchError.of(ResponseCode.TIMEOUT,
                    "Delay of " + seconds + "s exceeds the task timeout"));
        }
        Map<String, Object> output = new LinkedHashMap<>();
        output.put("delayed_seconds", seconds);
        return DispatchOutcome.success(output);
    }

    private Duration remaining(long deadlineNanos) {
        long remaining = deadlineNanos - System.nanoTime();
        return remaining <= 0 ? Duration.ZERO : Duration.ofNanos(remaining);
    }
}
