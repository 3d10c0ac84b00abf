package com.agentcores.infrastructure.repository.auth;

import com.agentcores.domain.auth.adapter.repository.IInvitationRepository;
import com.agentcores.domain.auth.model.entity.InvitationEntity;
import com.agentcores.domain.auth.model.valobj.TenantContext;
import com.agentcores.infrastructure.dao.InvitationDao;
import com.agentcores.infrastructure.dao.po.InvitationPO;
import com.agentcores.types.enums.UserRoleEnum;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 邀请仓储实现类。
 */
@Repository
public class InvitationRepositoryImpl implements IInvitationRepository {

    private final InvitationDao invitationDao;

    public InvitationRepositoryImpl(InvitationDao invitationDao) {
        this.invitationDao = invitationDao;
    }

    @Override
    public InvitationEntity save(InvitationEntity entity) {
        InvitationPO po = toPO(entity);
        invitationDao.insert(po);
        entity.setId(po.getId());
        return entity;
    }

    @Override
    public InvitationEntity findByToken(String token) {
        return toEntity(invitationDao.selectByToken(token));
    }

    @Override
    public InvitationEntity findPendingByEmail(TenantContext context, String email, LocalDateTime now) {
        return toEntity(invitationDao.selectPendingByEmail(context.tenantId(), email, now));
    }

    @Override
    public List<InvitationEntity> findPending(TenantContext context, LocalDateTime now) {
        return invitationDao.selectPending(context.tenantId(), now).stream()
                .map(this::toEntity)
                .toList();
    }

    @Override
    public boolean markConsumed(Long id, LocalDateTime consumedAt) {
        return invitationDao.markConsumed(id, consumedAt) > 0;
    }

    private InvitationEntity toEntity(InvitationPO po) {
        if (po == null) {
            return null;
        }
        InvitationEntity entity = new InvitationEntity();
        entity.setId(po.getId());
        entity.setTenantId(po.getTenantId());
        entity.setEmail(po.getEmail());
        entity.setRole(UserRoleEnum.fromCode(po.getRole()));
        entity.setToken(po.getToken());
        entity.setInvitedBy(po.getInvitedBy());
        entity.setExpiresAt(po.getExpiresAt());
        entity.setConsumed(po.getConsumed());
        entity.setConsumedAt(po.getConsumedAt());
        entity.setCreatedAt(po.getCreatedAt());
        return entity;
    }

    private InvitationPO toPO(InvitationEntity entity) {
        return InvitationPO.builder()
                .id(entity.getId())
                .tenantId(entity.getTenantId())
                .email(entity.getEmail())
                .role(entity.getRole() == null ? null : entity.getRole().getCode())
                .token(entity.getToken())
                .invitedBy(entity.getInvitedBy())
                .expiresAt(entity.getExpiresAt())
                .consumed(entity.getConsumed())
                .consumedAt(entity.getConsumedAt())
                .createdAt(entity.getCreatedAt())
                .build();
    }
}
