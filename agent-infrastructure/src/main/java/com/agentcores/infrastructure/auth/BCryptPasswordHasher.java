package com.agentcores.infrastructure.auth;

import com.agentcores.domain.auth.adapter.gateway.IPasswordHasher;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.stereotype.Component;

/**
 * BCrypt 口令哈希。
 */
@Component
public class BCryptPasswordHasher implements IPasswordHasher {

    private final BCryptPasswordEncoder encoder;

    public BCryptPasswordHasher(@Value("${app.auth.password.bcrypt-strength:10}") int strength) {
        this.encoder = new BCryptPasswordEncoder(strength);
    }

    @Override
    public String hash(String rawPassword) {
        return encoder.encode(rawPassword);
    }

    @Override
    public boolean matches(String rawPassword, String passwordHash) {
        if (rawPassword == null || StringUtils.isBlank(passwordHash)) {
            return false;
        }
        return encoder.matches(rawPassword, passwordHash);
    }
}
