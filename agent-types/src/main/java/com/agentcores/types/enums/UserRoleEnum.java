package com.agentcores.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 用户角色枚举。角色到能力的映射见 domain 层的权限表。
 *
 * @author agentcores
 * @since 2026-03-02
 */
public enum UserRoleEnum {

    OWNER("owner"),

    ADMIN("admin"),

    MANAGER("manager"),

    DEVELOPER("developer"),

    ANALYST("analyst"),

    OPERATOR("operator"),

    VIEWER("viewer"),

    GUEST("guest");

    private final String code;

    UserRoleEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static UserRoleEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        String normalized = code.trim();
        for (UserRoleEnum role : values()) {
            if (role.code.equalsIgnoreCase(normalized) || role.name().equalsIgnoreCase(normalized)) {
                return role;
            }
        }
        throw new IllegalArgumentException("Unknown user role: " + code);
    }
}
