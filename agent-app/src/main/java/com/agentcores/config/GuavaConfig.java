package com.agentcores.config;

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Guava 缓存配置类。
 * <p>
 * familyRevocationCache 缓存令牌族吊销状态，减少每个请求对 auth_token_families 的查询。
 * 过期时间即吊销在其它实例上生效的最大延迟，本实例内吊销时会主动失效。
 * </p>
 *
 * @author agentcores
 * @since 2026-03-06
 */
@Configuration
public class GuavaConfig {

    @Bean(name = "familyRevocationCache")
    public Cache<String, Boolean> familyRevocationCache(
            @Value("${app.auth.token.revocation-cache-seconds:30}") long expireSeconds,
            @Value("${app.auth.token.revocation-cache-size:100000}") long maximumSize) {
        return CacheBuilder.newBuilder()
                .expireAfterWrite(Math.max(expireSeconds, 1L), TimeUnit.SECONDS)
                .maximumSize(Math.max(maximumSize, 1L))
                .build();
    }

}
