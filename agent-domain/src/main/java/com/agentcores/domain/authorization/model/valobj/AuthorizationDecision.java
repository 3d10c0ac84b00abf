package com.agentcores.domain.authorization.model.valobj;

import com.agentcores.types.enums.CapabilityEnum;
import com.agentcores.types.enums.ResponseCode;
import com.agentcores.types.exception.AppException;

/**
 * 授权判定结果：Allow 或 Deny(reason)。
 *
 * @param allowed 是否允许
 * @param capability 判定的能力
 * @param denialCode 拒绝原因码（PERMISSION_DENIED / TENANT_MISMATCH），允许时为 null
 */
public record AuthorizationDecision(boolean allowed, CapabilityEnum capability, ResponseCode denialCode) {

    public static AuthorizationDecision allow(CapabilityEnum capability) {
        return new AuthorizationDecision(true, capability, null);
    }

    public static AuthorizationDecision deny(CapabilityEnum capability, ResponseCode denialCode) {
        return new AuthorizationDecision(false, capability, denialCode);
    }

    public String reason() {
        if (allowed) {
            return null;
        }
        return denialCode == ResponseCode.TENANT_MISMATCH ? "tenant_mismatch" : "missing_capability";
    }

    public AppException toException() {
        return new AppException(denialCode, denialCode.getInfo());
    }
}
