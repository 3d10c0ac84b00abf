package com.agentcores.types.enums;

/**
 * 原子能力（权限点）
 *
 * @author agentcores
 * @since 2026-03-02
 */
public enum CapabilityEnum {

    VIEW_AGENTS,
    CREATE_AGENTS,
    EDIT_AGENTS,
    DELETE_AGENTS,

    VIEW_TASKS,
    CREATE_TASKS,
    EXECUTE_TASKS,
    CANCEL_TASKS,

    VIEW_USERS,
    MANAGE_USERS,
    INVITE_USERS,

    VIEW_AUDIT_LOGS,

    VIEW_ORG_SETTINGS,
    MANAGE_ORG_SETTINGS
}
