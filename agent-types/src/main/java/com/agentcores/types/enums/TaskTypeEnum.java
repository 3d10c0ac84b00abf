package com.agentcores.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 任务类型枚举
 *
 * @author agentcores
 * @since 2026-03-02
 */
public enum TaskTypeEnum {

    /**
     * 文本处理
     */
    TEXT_PROCESSING("text_processing"),

    /**
     * 外部 HTTP 调用
     */
    API_CALL("api_call"),

    /**
     * 顺序步骤编排
     */
    WORKFLOW("workflow");

    private final String code;

    TaskTypeEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static TaskTypeEnum fromCode(String code) {
        return fromText(code);
    }

    public static TaskTypeEnum fromText(String text) {
        if (text == null) {
            return null;
        }
        String normalized = text.trim();
        if (normalized.isEmpty()) {
            return null;
        }
        for (TaskTypeEnum type : TaskTypeEnum.values()) {
            if (type.code.equalsIgnoreCase(normalized) || type.name().equalsIgnoreCase(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown task type: " + text);
    }
}
