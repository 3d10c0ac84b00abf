package com.agentcores.domain.task.service;

import com.agentcores.domain.task.model.valobj.ApiCallInput;
import com.agentcores.domain.task.model.valobj.TaskInput;
import com.agentcores.domain.task.model.valobj.TextProcessingInput;
import com.agentcores.domain.task.model.valobj.WorkflowInput;
import com.agentcores.domain.task.model.valobj.WorkflowStep;
import com.agentcores.domain.task.model.valobj.WorkflowStepType;
import com.agentcores.types.enums.ResponseCode;
import com.agentcores.types.enums.TaskTypeEnum;
import com.agentcores.types.exception.AppException;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * 任务输入领域服务：把 input_data 解析为按任务类型区分的已校验输入。
 * <p>
 * 结构错误（缺字段、类型不符、非法 URL）在创建时以 ILLEGAL_PARAMETER 拒绝；
 * text_processing 的操作名只校验非空，词表外的操作在执行时报 UNSUPPORTED_OPERATION。
 * </p>
 */
@Service
public class TaskInputDomainService {

    static final int MAX_WORKFLOW_STEPS = 50;

    private static final Set<String> HTTP_METHODS = Set.of("GET", "POST", "PUT", "PATCH", "DELETE", "HEAD");

    public TaskInput parse(TaskTypeEnum taskType, Map<String, Object> inputData) {
        if (taskType == null) {
            throw illegal("task_type is required");
        }
        Map<String, Object> input = inputData == null ? Collections.emptyMap() : inputData;
        return switch (taskType) {
            case TEXT_PROCESSING -> parseText(input, "input_data");
            case API_CALL -> parseApiCall(input, "input_data");
            case WORKFLOW -> parseWorkflow(input);
        };
    }

    private TextProcessingInput parseText(Map<String, Object> input, String path) {
        Object text = input.get("text");
        if (!(text instanceof String textValue)) {
            throw illegal(path + ".text must be a string");
        }
        String operation = stringValue(input.get("operation"));
        if (StringUtils.isBlank(operation)) {
            throw illegal(path + ".operation is required");
        }
        return new TextProcessingInput(operation.trim(), textValue);
    }

    private ApiCallInput parseApiCall(Map<String, Object> input, String path) {
        String url = stringValue(input.get("url"));
        if (StringUtils.isBlank(url)) {
            throw illegal(path + ".url is required");
        }
        URI uri;
        try {
            uri = URI.create(url.trim());
        } catch (IllegalArgumentException ex) {
            throw illegal(path + ".url is malformed");
        }
        String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
        if (!("http".equals(scheme) || "https".equals(scheme)) || StringUtils.isBlank(uri.getHost())) {
            throw illegal(path + ".url must be an absolute http(s) url");
        }
        String method = StringUtils.defaultIfBlank(stringValue(input.get("method")), "GET").trim().toUpperCase(Locale.ROOT);
        if (!HTTP_METHODS.contains(method)) {
            throw illegal(path + ".method is not supported: " + method);
        }
        Map<String, String> headers = new LinkedHashMap<>();
        Object rawHeaders = input.get("headers");
        if (rawHeaders != null) {
            if (!(rawHeaders instanceof Map<?, ?> headerMap)) {
                throw illegal(path + ".headers must be an object");
            }
            headerMap.forEach((key, value) -> headers.put(String.valueOf(key), value == null ? "" : String.valueOf(value)));
        }
        Object body = input.containsKey("body") ? input.get("body") : input.get("data");
        return new ApiCallInput(method, uri.toString(), Collections.unmodifiableMap(headers), body);
    }

    private WorkflowInput parseWorkflow(Map<String, Object> input) {
        Object rawSteps = input.get("steps");
        if (!(rawSteps instanceof List<?> stepList) || stepList.isEmpty()) {
            throw illegal("input_data.steps must be a non-empty array");
        }
        if (stepList.size() > MAX_WORKFLOW_STEPS) {
            throw illegal("input_data.steps exceeds " + MAX_WORKFLOW_STEPS + " steps");
        }
        List<WorkflowStep> steps = new ArrayList<>(stepList.size());
        for (int i = 0; i < stepList.size(); i++) {
            steps.add(parseStep(stepList.get(i), i));
        }
        return new WorkflowInput(Collections.unmodifiableList(steps));
    }

    @SuppressWarnings("unchecked")
    private WorkflowStep parseStep(Object rawStep, int index) {
        String path = "input_data.steps[" + index + "]";
        if (!(rawStep instanceof Map<?, ?>)) {
            throw illegal(path + " must be an object");
        }
        Map<String, Object> step = (Map<String, Object>) rawStep;
        WorkflowStepType type = WorkflowStepType.fromCode(stringValue(step.get("type")));
        if (type == null) {
            throw illegal(path + ".type must be one of delay, log, text_processing, api_call");
        }
        String name = StringUtils.defaultIfBlank(stringValue(step.get("name")), "step-" + (index + 1));
        Map<String, Object> params = step.get("params") instanceof Map<?, ?> nested
                ? (Map<String, Object>) nested
                : step;
        return switch (type) {
            case DELAY -> new WorkflowStep(name, type, parseDelay(params.get("seconds"), path), null, null);
            case LOG -> new WorkflowStep(name, type, null,
                    StringUtils.defaultString(stringValue(params.get("message"))), null);
            case TEXT_PROCESSING -> new WorkflowStep(name, type, null, null, parseText(params, path));
            case API_CALL -> new WorkflowStep(name, type, null, null, parseApiCall(params, path));
        };
    }

    private Double parseDelay(Object raw, String path) {
        if (!(raw instanceof Number number)) {
            throw illegal(path + ".seconds must be a number");
        }
        double seconds = number.doubleValue();
        if (seconds < 0 || Double.isNaN(seconds) || Double.isInfinite(seconds)) {
            throw illegal(path + ".seconds must be non-negative");
        }
        return seconds;
    }

    private String stringValue(Object value) {
        return value == null ? null : String.valueOf(value);
    }

    private AppException illegal(String message) {
        return new AppException(ResponseCode.ILLEGAL_PARAMETER, message);
    }
}
