package com.agentcores.domain.task.model.valobj;

import com.agentcores.types.enums.ResponseCode;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 分派执行的类型化错误。
 *
 * @param kind UNSUPPORTED_OPERATION / EXECUTION_ERROR / TIMEOUT / LEASE_EXPIRED
 * @param message 错误描述
 * @param upstreamStatus api_call 的上游 HTTP 状态，可空
 * @param partialResults workflow 短路前已完成步骤的结果，可空
 */
public record DispatchError(ResponseCode kind,
                            String message,
                            Integer upstreamStatus,
                            List<Map<String, Object>> partialResults) {

    public static DispatchError of(ResponseCode kind, String message) {
        return new DispatchError(kind, message, null, null);
    }

    public DispatchError withPartialResults(List<Map<String, Object>> results) {
        return new DispatchError(kind, message, upstreamStatus, results);
    }

    /**
     * 写入 last_error 的单行描述。
     */
    public String summary() {
        StringBuilder builder = new StringBuilder(kind.name()).append(": ").append(message);
        if (upstreamStatus != null) {
            builder.append(" (upstream status ").append(upstreamStatus).append(")");
        }
        return builder.toString();
    }

    /**
     * 终态失败时写入 output 的结构。
     */
    public Map<String, Object> toOutput() {
        Map<String, Object> error = new LinkedHashMap<>();
        error.put("type", kind.name());
        error.put("code", kind.getCode());
        error.put("message", message);
        if (upstreamStatus != null) {
            error.put("upstream_status", upstreamStatus);
        }
        Map<String, Object> output = new LinkedHashMap<>();
        output.put("error", error);
        if (partialResults != null) {
            output.put("partial_results", partialResults);
        }
        return output;
    }
}
