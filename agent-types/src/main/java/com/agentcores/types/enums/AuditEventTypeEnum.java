package com.agentcores.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 审计事件类型
 *
 * @author agentcores
 * @since 2026-03-02
 */
public enum AuditEventTypeEnum {

    /** 授权判定（允许/拒绝） */
    AUTHORIZATION("authorization"),

    /** 任务状态流转 */
    TASK_TRANSITION("task_transition"),

    /** 被拒绝的任务状态流转 */
    TASK_TRANSITION_REJECTED("task_transition_rejected"),

    LOGIN("login"),

    LOGIN_FAILED("login_failed"),

    TOKEN_REFRESHED("token_refreshed"),

    /** 刷新令牌重放，整族吊销 */
    TOKEN_REUSE_DETECTED("token_reuse_detected"),

    LOGOUT("logout"),

    TENANT_REGISTERED("tenant_registered"),

    TENANT_UPDATED("tenant_updated"),

    INVITATION_CREATED("invitation_created"),

    INVITATION_ACCEPTED("invitation_accepted"),

    USER_ROLE_CHANGED("user_role_changed"),

    USER_DEACTIVATED("user_deactivated"),

    AGENT_CREATED("agent_created"),

    AGENT_UPDATED("agent_updated"),

    AGENT_TERMINATED("agent_terminated");

    private final String code;

    AuditEventTypeEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static AuditEventTypeEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (AuditEventTypeEnum type : values()) {
            if (type.code.equalsIgnoreCase(code.trim())) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown audit event type: " + code);
    }
}
