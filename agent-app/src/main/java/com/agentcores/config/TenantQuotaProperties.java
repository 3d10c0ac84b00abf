package com.agentcores.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 订阅等级默认配额覆盖，前缀 app.tenant。
 * <p>
 * 例如 {@code app.tenant.quota.free.max-agents=5}；未配置的等级或字段沿用内置默认值。
 * </p>
 */
@Data
@ConfigurationProperties(prefix = "app.tenant", ignoreInvalidFields = true)
public class TenantQuotaProperties {

    /** 等级代码 -> 配额 */
    private Map<String, Tier> quota = new LinkedHashMap<>();

    @Data
    public static class Tier {

        /** Agent 数量上限 */
        private Integer maxAgents;

        /** 每小时进入 RUNNING 的任务数上限 */
        private Integer maxTasksPerHour;
    }
}
