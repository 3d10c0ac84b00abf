package com.agentcores.types.enums;

import lombok.Getter;

/**
 * 统一响应码枚举。
 * <p>
 * 每个响应码同时声明对外 HTTP 状态。认证类错误对外统一暴露为
 * {@link #AUTHENTICATION_FAILED}，跨租户访问对外暴露为 {@link #RESOURCE_NOT_FOUND}，
 * 调用方无法区分具体失败原因。
 * </p>
 *
 * @author agentcores
 * @since 2026-03-02
 */
@Getter
public enum ResponseCode {

    /** 成功 */
    SUCCESS("0000", "成功", 200),

    /** 未知错误 */
    UN_ERROR("0001", "未知失败", 500),

    /** 非法参数 */
    ILLEGAL_PARAMETER("0002", "非法参数", 400),

    /** 认证失败（对外统一） */
    AUTHENTICATION_FAILED("A0100", "认证失败", 401),

    /** 账号或密码错误 */
    INVALID_CREDENTIALS("A0101", "账号或密码错误", 401),

    /** 令牌无效 */
    INVALID_TOKEN("A0102", "令牌无效", 401),

    /** 令牌过期 */
    EXPIRED_TOKEN("A0103", "令牌已过期", 401),

    /** 刷新令牌被重放 */
    TOKEN_REUSED("A0104", "刷新令牌已被使用", 401),

    /** 租户不存在或已停用 */
    TENANT_NOT_FOUND("A0105", "租户不存在", 401),

    /** 权限不足 */
    PERMISSION_DENIED("A0301", "权限不足", 403),

    /** 租户不匹配 */
    TENANT_MISMATCH("A0302", "租户不匹配", 404),

    /** 资源不存在 */
    RESOURCE_NOT_FOUND("A0404", "资源不存在", 404),

    /** 租户重名 */
    DUPLICATE_TENANT("B0101", "租户已存在", 409),

    /** 邮箱重复 */
    DUPLICATE_EMAIL("B0102", "邮箱已被注册", 409),

    /** Agent 重名 */
    DUPLICATE_AGENT_NAME("B0103", "Agent 名称已存在", 409),

    /** 已存在待接受的邀请 */
    INVITATION_EXISTS("B0104", "邀请已存在", 409),

    /** 邀请过期 */
    INVITATION_EXPIRED("B0105", "邀请已过期", 410),

    /** 邀请已被使用 */
    INVITATION_CONSUMED("B0106", "邀请已被使用", 410),

    /** 非法状态流转 */
    INVALID_TRANSITION("B0201", "当前状态不允许该操作", 409),

    /** 配额超限 */
    QUOTA_EXCEEDED("B0202", "配额已用尽", 429),

    /** 租约过期 */
    LEASE_EXPIRED("B0203", "执行租约已过期", 409),

    /** 资源仍被占用 */
    RESOURCE_BUSY("B0204", "资源仍有未结束的任务", 409),

    /** 不支持的操作 */
    UNSUPPORTED_OPERATION("C0101", "不支持的操作", 400),

    /** 执行失败 */
    EXECUTION_ERROR("C0102", "执行失败", 502),

    /** 执行超时 */
    TIMEOUT("C0103", "执行超时", 504);

    private final String code;
    private final String info;
    private final int httpStatus;

    ResponseCode(String code, String info, int httpStatus) {
        this.code = code;
        this.info = info;
        this.httpStatus = httpStatus;
    }

    /**
     * 对外暴露的响应码。
     */
    public ResponseCode exposed() {
        switch (this) {
            case INVALID_CREDENTIALS:
            case INVALID_TOKEN:
            case EXPIRED_TOKEN:
            case TOKEN_REUSED:
            case TENANT_NOT_FOUND:
                return AUTHENTICATION_FAILED;
            case TENANT_MISMATCH:
                return RESOURCE_NOT_FOUND;
            default:
                return this;
        }
    }

    public static ResponseCode fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (ResponseCode value : values()) {
            if (value.code.equals(code)) {
                return value;
            }
        }
        return null;
    }

}
