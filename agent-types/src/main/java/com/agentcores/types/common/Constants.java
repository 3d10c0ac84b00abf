package com.agentcores.types.common;

/**
 * 全局常量定义类。
 *
 * @author agentcores
 * @since 2026-03-02
 */
public class Constants {

    /** Bearer 认证前缀 */
    public final static String BEARER_PREFIX = "Bearer ";

    /** 请求属性：已解析的租户上下文 */
    public final static String TENANT_CONTEXT_ATTRIBUTE = "agentcores.tenantContext";

    /** 任务优先级下界 */
    public final static int MIN_PRIORITY = 0;

    /** 任务优先级上界 */
    public final static int MAX_PRIORITY = 10;

    /** 默认任务超时秒数 */
    public final static int DEFAULT_TIMEOUT_SECONDS = 300;

    /** 默认最大重试次数 */
    public final static int DEFAULT_MAX_RETRIES = 3;

    /** 列表查询默认条数 */
    public final static int DEFAULT_LIST_LIMIT = 50;

    /** 列表查询最大条数 */
    public final static int MAX_LIST_LIMIT = 500;

}
