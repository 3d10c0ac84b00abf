package com.agentcores.domain.tenant.service;

import com.agentcores.domain.tenant.model.valobj.TenantQuota;
import com.agentcores.types.enums.TenantTierEnum;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * 租户配额领域服务：订阅等级到默认资源上限的映射。
 * <p>
 * 内置默认值可被配置覆盖；未覆盖的等级沿用默认值。
 * </p>
 */
public class TenantQuotaDomainService {

    private static final Map<TenantTierEnum, TenantQuota> DEFAULTS;

    static {
        Map<TenantTierEnum, TenantQuota> defaults = new EnumMap<>(TenantTierEnum.class);
        defaults.put(TenantTierEnum.FREE, new TenantQuota(3, 50));
        defaults.put(TenantTierEnum.BASIC, new TenantQuota(10, 500));
        defaults.put(TenantTierEnum.PROFESSIONAL, new TenantQuota(50, 5000));
        defaults.put(TenantTierEnum.ENTERPRISE, new TenantQuota(500, 50000));
        DEFAULTS = Collections.unmodifiableMap(defaults);
    }

    private final Map<TenantTierEnum, TenantQuota> quotas;

    public TenantQuotaDomainService() {
        this(Collections.emptyMap());
    }

    public TenantQuotaDomainService(Map<TenantTierEnum, TenantQuota> overrides) {
        Map<TenantTierEnum, TenantQuota> merged = new EnumMap<>(DEFAULTS);
        if (overrides != null) {
            merged.putAll(overrides);
        }
        this.quotas = Collections.unmodifiableMap(merged);
    }

    public TenantQuota quotaOf(TenantTierEnum tier) {
        return quotas.get(tier == null ? TenantTierEnum.FREE : tier);
    }

    public static TenantQuota defaultQuotaOf(TenantTierEnum tier) {
        return DEFAULTS.get(tier);
    }
}
