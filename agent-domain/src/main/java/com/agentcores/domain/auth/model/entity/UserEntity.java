package com.agentcores.domain.auth.model.entity;

import com.agentcores.types.enums.UserRoleEnum;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 用户领域实体。一个用户只属于一个租户。
 *
 * @author agentcores
 * @since 2026-03-03
 */
@Data
public class UserEntity {

    private Long id;

    /**
     * 所属租户 ID
     */
    private Long tenantId;

    /**
     * 邮箱（租户内唯一，统一小写存储）
     */
    private String email;

    /**
     * 密码哈希（BCrypt）
     */
    private String passwordHash;

    private String fullName;

    private UserRoleEnum role;

    private Boolean active;

    private LocalDateTime lastLoginAt;

    private Integer version;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    public void validate() {
        if (tenantId == null) {
            throw new IllegalStateException("Tenant ID cannot be null");
        }
        if (email == null || email.isBlank()) {
            throw new IllegalStateException("Email cannot be empty");
        }
        if (passwordHash == null || passwordHash.isBlank()) {
            throw new IllegalStateException("Password hash cannot be empty");
        }
        if (role == null) {
            throw new IllegalStateException("Role cannot be null");
        }
    }

    public boolean isActive() {
        return Boolean.TRUE.equals(active);
    }

    public void markLogin(LocalDateTime now) {
        this.lastLoginAt = now;
        this.updatedAt = now;
    }

    public void changeRole(UserRoleEnum newRole) {
        this.role = newRole;
        this.updatedAt = LocalDateTime.now();
    }

    public void deactivate() {
        this.active = false;
        this.updatedAt = LocalDateTime.now();
    }
}
