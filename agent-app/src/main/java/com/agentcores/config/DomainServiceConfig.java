package com.agentcores.config;

import com.agentcores.domain.task.model.valobj.RetryBackoffPolicy;
import com.agentcores.domain.task.service.TaskLifecycleDomainService;
import com.agentcores.domain.tenant.model.valobj.TenantQuota;
import com.agentcores.domain.tenant.service.TenantQuotaDomainService;
import com.agentcores.types.enums.TenantTierEnum;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * 需要外部配置的领域服务装配。
 *
 * @author agentcores
 * @since 2026-03-06
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(TenantQuotaProperties.class)
public class DomainServiceConfig {

    @Bean
    public TenantQuotaDomainService tenantQuotaDomainService(TenantQuotaProperties properties) {
        Map<TenantTierEnum, TenantQuota> overrides = new EnumMap<>(TenantTierEnum.class);
        for (Map.Entry<String, TenantQuotaProperties.Tier> entry : properties.getQuota().entrySet()) {
            TenantTierEnum tier = TenantTierEnum.fromCode(entry.getKey());
            TenantQuota defaults = TenantQuotaDomainService.defaultQuotaOf(tier);
            TenantQuotaProperties.Tier configured = entry.getValue();
            int maxAgents = configured.getMaxAgents() == null ? defaults.maxAgents() : configured.getMaxAgents();
            int maxTasksPerHour = configured.getMaxTasksPerHour() == null
                    ? defaults.maxTasksPerHour() : configured.getMaxTasksPerHour();
            overrides.put(tier, new TenantQuota(maxAgents, maxTasksPerHour));
            log.info("TENANT_QUOTA_OVERRIDE tier={}, maxAgents={}, maxTasksPerHour={}",
                    tier.getCode(), maxAgents, maxTasksPerHour);
        }
        return new TenantQuotaDomainService(overrides);
    }

    @Bean
    public TaskLifecycleDomainService taskLifecycleDomainService(
            @Value("${executor.retry.base-delay-seconds:2}") long baseDelaySeconds,
            @Value("${executor.retry.max-delay-seconds:300}") long maxDelaySeconds) {
        if (baseDelaySeconds < 0 || maxDelaySeconds < baseDelaySeconds) {
            throw new IllegalStateException("Invalid retry backoff: base=" + baseDelaySeconds
                    + "s, max=" + maxDelaySeconds + "s");
        }
        return new TaskLifecycleDomainService(new RetryBackoffPolicy(
                Duration.ofSeconds(baseDelaySeconds), Duration.ofSeconds(maxDelaySeconds)));
    }
}
