package com.agentcores.infrastructure.repository.auth;

import com.agentcores.domain.auth.adapter.repository.IUserRepository;
import com.agentcores.domain.auth.model.entity.UserEntity;
import com.agentcores.domain.auth.model.valobj.TenantContext;
import com.agentcores.infrastructure.dao.UserDao;
import com.agentcores.infrastructure.dao.po.UserPO;
import com.agentcores.types.enums.ResponseCode;
import com.agentcores.types.enums.UserRoleEnum;
import com.agentcores.types.exception.AppException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 用户仓储实现类。
 *
 * @author agentcores
 * @since 2026-03-05
 */
@Repository
public class UserRepositoryImpl implements IUserRepository {

    private final UserDao userDao;

    public UserRepositoryImpl(UserDao userDao) {
        this.userDao = userDao;
    }

    @Override
    public UserEntity save(UserEntity entity) {
        entity.validate();
        UserPO po = toPO(entity);
        try {
            userDao.insert(po);
        } catch (DuplicateKeyException ex) {
            throw new AppException(ResponseCode.DUPLICATE_EMAIL);
        }
        return toEntity(userDao.selectByIdAndTenant(po.getId(), po.getTenantId()));
    }

    @Override
    public UserEntity update(TenantContext context, UserEntity entity) {
        if (!context.ownsTenant(entity.getTenantId())) {
            throw new AppException(ResponseCode.TENANT_MISMATCH);
        }
        entity.validate();
        if (userDao.updateWithVersion(toPO(entity)) == 0) {
            throw new AppException(ResponseCode.RESOURCE_BUSY, "User was modified concurrently");
        }
        return toEntity(userDao.selectByIdAndTenant(entity.getId(), context.tenantId()));
    }

    @Override
    public void touchLastLogin(TenantContext context, LocalDateTime loginAt) {
        userDao.updateLastLoginAt(context.userId(), context.tenantId(), loginAt);
    }

    @Override
    public UserEntity findById(TenantContext context, Long id) {
        return toEntity(userDao.selectByIdAndTenant(id, context.tenantId()));
    }

    @Override
    public List<UserEntity> findByTenant(TenantContext context) {
        return userDao.selectByTenant(context.tenantId()).stream()
                .map(this::toEntity)
                .toList();
    }

    @Override
    public UserEntity findByTenantAndEmail(Long tenantId, String email) {
        return toEntity(userDao.selectByTenantAndEmail(tenantId, email));
    }

    @Override
    public long countActiveOwners(TenantContext context) {
        return userDao.countActiveByRole(context.tenantId(), UserRoleEnum.OWNER.getCode());
    }

    private UserEntity toEntity(UserPO po) {
        if (po == null) {
            return null;
        }
        UserEntity entity = new UserEntity();
        entity.setId(po.getId());
        entity.setTenantId(po.getTenantId());
        entity.setEmail(po.getEmail());
        entity.setPasswordHash(po.getPasswordHash());
        entity.setFullName(po.getFullName());
        entity.setRole(UserRoleEnum.fromCode(po.getRole()));
        entity.setActive(po.getActive());
        entity.setLastLoginAt(po.getLastLoginAt());
        entity.setVersion(po.getVersion());
        entity.setCreatedAt(po.getCreatedAt());
        entity.setUpdatedAt(po.getUpdatedAt());
        return entity;
    }

    private UserPO toPO(UserEntity entity) {
        return UserPO.builder()
                .id(entity.getId())
                .tenantId(entity.getTenantId())
                .email(entity.getEmail())
                .passwordHash(entity.getPasswordHash())
                .fullName(entity.getFullName())
                .role(entity.getRole() == null ? null : entity.getRole().getCode())
                .active(entity.getActive())
                .lastLoginAt(entity.getLastLoginAt())
                .version(entity.getVersion())
                .createdAt(entity.getCreatedAt())
                .updatedAt(entity.getUpdatedAt())
                .build();
    }
}
