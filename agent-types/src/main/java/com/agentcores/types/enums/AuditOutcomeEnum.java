package com.agentcores.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 审计结果
 *
 * @author agentcores
 * @since 2026-03-02
 */
public enum AuditOutcomeEnum {

    ALLOWED("allowed"),

    DENIED("denied"),

    TRANSITION("transition");

    private final String code;

    AuditOutcomeEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static AuditOutcomeEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (AuditOutcomeEnum outcome : values()) {
            if (outcome.code.equalsIgnoreCase(code.trim())) {
                return outcome;
            }
        }
        throw new IllegalArgumentException("Unknown audit outcome: " + code);
    }
}
