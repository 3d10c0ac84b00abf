package com.agentcores.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Agent 状态枚举
 *
 * @author agentcores
 * @since 2026-03-02
 */
public enum AgentStatusEnum {

    IDLE("idle"),

    RUNNING("running"),

    PAUSED("paused"),

    ERROR("error"),

    /**
     * 软删除后的状态，不再接受新任务
     */
    TERMINATED("terminated");

    private final String code;

    AgentStatusEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * 是否允许为该 Agent 创建任务。
     */
    public boolean acceptsTasks() {
        return this != PAUSED && this != TERMINATED;
    }

    public static AgentStatusEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (AgentStatusEnum status : values()) {
            if (status.code.equalsIgnoreCase(code.trim())) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown agent status code: " + code);
    }
}
