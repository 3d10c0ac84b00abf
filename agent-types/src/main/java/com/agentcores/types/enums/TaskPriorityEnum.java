package com.agentcores.types.enums;

import com.agentcores.types.common.Constants;

/**
 * 任务优先级别名。数值越大越先被调度。
 *
 * @author agentcores
 * @since 2026-03-04
 */
public enum TaskPriorityEnum {

    LOW(2),

    NORMAL(5),

    HIGH(8),

    URGENT(10);

    private final int value;

    TaskPriorityEnum(int value) {
        this.value = value;
    }

    public int getValue() {
        return value;
    }

    /**
     * 解析优先级：支持 0..10 的整数或别名（low/normal/high/urgent），空值取 NORMAL。
     */
    public static int resolve(Object raw) {
        if (raw == null) {
            return NORMAL.value;
        }
        if (raw instanceof Number number) {
            return checkRange(number.intValue());
        }
        String text = String.valueOf(raw).trim();
        if (text.isEmpty()) {
            return NORMAL.value;
        }
        for (TaskPriorityEnum alias : values()) {
            if (alias.name().equalsIgnoreCase(text)) {
                return alias.value;
            }
        }
        try {
            return checkRange(Integer.parseInt(text));
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Unknown task priority: " + raw);
        }
    }

    private static int checkRange(int value) {
        if (value < Constants.MIN_PRIORITY || value > Constants.MAX_PRIORITY) {
            throw new IllegalArgumentException("Task priority out of range: " + value);
        }
        return value;
    }
}
