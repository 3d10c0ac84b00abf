package com.agentcores.test.support;

import com.agentcores.domain.auth.adapter.repository.IUserRepository;
import com.agentcores.domain.auth.model.entity.UserEntity;
import com.agentcores.domain.auth.model.valobj.TenantContext;
import com.agentcores.types.enums.UserRoleEnum;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 内存用户仓储，邮箱在租户内唯一。
 */
public class InMemoryUserRepository implements IUserRepository {

    private final Map<Long, UserEntity> store = new LinkedHashMap<>();
    private long nextId = 1;

    @Override
    public synchronized UserEntity save(UserEntity entity) {
        if (findByTenantAndEmail(entity.getTenantId(), entity.getEmail()) != null) {
            throw new IllegalStateException("duplicate email in tenant");
        }
        if (entity.getId() == null) {
            entity.setId(nextId++);
        }
        entity.setVersion(0);
        entity.setCreatedAt(LocalDateTime.now());
        store.put(entity.getId(), entity);
        return entity;
    }

    @Override
    public synchronized UserEntity update(TenantContext context, UserEntity entity) {
        UserEntity stored = store.get(entity.getId());
        if (stored == null || !context.ownsTenant(stored.getTenantId())) {
            return null;
        }
        store.put(entity.getId(), entity);
        return entity;
    }

    @Override
    public synchronized void touchLastLogin(TenantContext context, LocalDateTime loginAt) {
        UserEntity stored = findById(context, context.userId());
        if (stored != null) {
            stored.setLastLoginAt(loginAt);
        }
    }

    @Override
    public synchronized UserEntity findById(TenantContext context, Long id) {
        UserEntity stored = store.get(id);
        return stored != null && context.ownsTenant(stored.getTenantId()) ? stored : null;
    }

    @Override
    public synchronized List<UserEntity> findByTenant(TenantContext context) {
        return store.values().stream()
                .filter(user -> context.ownsTenant(user.getTenantId()))
                .toList();
    }

    @Override
    public synchronized UserEntity findByTenantAndEmail(Long tenantId, String email) {
        return store.values().stream()
                .filter(user -> user.getTenantId().equals(tenantId) && user.getEmail().equalsIgnoreCase(email))
                .findFirst()
                .orElse(null);
    }

    @Override
    public synchronized long countActiveOwners(TenantContext context) {
        return findByTenant(context).stream()
                .filter(user -> user.isActive() && user.getRole() == UserRoleEnum.OWNER)
                .count();
    }
}
