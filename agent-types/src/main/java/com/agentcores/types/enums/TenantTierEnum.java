package com.agentcores.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 租户订阅等级
 *
 * @author agentcores
 * @since 2026-03-02
 */
public enum TenantTierEnum {

    FREE("free"),

    BASIC("basic"),

    PROFESSIONAL("professional"),

    ENTERPRISE("enterprise");

    private final String code;

    TenantTierEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static TenantTierEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (TenantTierEnum tier : values()) {
            if (tier.code.equalsIgnoreCase(code.trim())) {
                return tier;
            }
        }
        throw new IllegalArgumentException("Unknown tenant tier: " + code);
    }
}
