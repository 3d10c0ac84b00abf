package com.agentcores.domain.auth.adapter.gateway;

/**
 * 密码哈希端口。
 */
public interface IPasswordHasher {

    String hash(String rawPassword);

    boolean matches(String rawPassword, String passwordHash);
}
