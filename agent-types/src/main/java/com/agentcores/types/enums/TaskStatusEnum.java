package com.agentcores.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 任务状态枚举
 *
 * @author agentcores
 * @since 2026-03-02
 */
public enum TaskStatusEnum {

    /**
     * 待执行 - 新建或等待重试
     */
    PENDING("pending"),

    /**
     * 运行中 - 已被某个 worker 持有租约
     */
    RUNNING("running"),

    /**
     * 已完成
     */
    COMPLETED("completed"),

    /**
     * 失败 - 重试预算耗尽后为终态
     */
    FAILED("failed"),

    /**
     * 已取消
     */
    CANCELLED("cancelled");

    private final String code;

    TaskStatusEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * COMPLETED / CANCELLED 恒为终态；FAILED 是否终态取决于重试预算，由实体判断。
     */
    public boolean isFinal() {
        return this == COMPLETED || this == CANCELLED;
    }

    public static TaskStatusEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (TaskStatusEnum status : TaskStatusEnum.values()) {
            if (status.code.equalsIgnoreCase(code.trim())) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown task status code: " + code);
    }
}
