package com.agentcores.domain.task.model.valobj;

import java.util.Map;

/**
 * 分派结果：(output, null) 或 (null, error)。
 */
public record DispatchOutcome(Map<String, Object> output, DispatchError error) {

    public static DispatchOutcome success(Map<String, Object> output) {
        return new DispatchOutcome(output, null);
    }

    public static DispatchOutcome failure(DispatchError error) {
        return new DispatchOutcome(null, error);
    }

    public boolean isSuccess() {
        return error == null;
    }
}
