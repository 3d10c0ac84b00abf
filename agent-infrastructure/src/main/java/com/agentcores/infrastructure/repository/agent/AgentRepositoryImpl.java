package com.agentcores.infrastructure.repository.agent;

import com.agentcores.domain.agent.adapter.repository.IAgentRepository;
import com.agentcores.domain.agent.model.entity.AgentEntity;
import com.agentcores.domain.auth.model.valobj.TenantContext;
import com.agentcores.infrastructure.dao.AgentDao;
import com.agentcores.infrastructure.dao.po.AgentPO;
import com.agentcores.infrastructure.util.JsonCodec;
import com.agentcores.types.enums.AgentStatusEnum;
import com.agentcores.types.enums.ResponseCode;
import com.agentcores.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Agent 仓储实现类。
 * <p>
 * 所有读写均以 {@link TenantContext#tenantId()} 作为过滤条件；
 * 名称唯一性由部分唯一索引保证，冲突映射为 DUPLICATE_AGENT_NAME。
 * </p>
 *
 * @author agentcores
 * @since 2026-03-05
 */
@Slf4j
@Repository
public class AgentRepositoryImpl implements IAgentRepository {

    private final AgentDao agentDao;
    private final JsonCodec jsonCodec;

    public AgentRepositoryImpl(AgentDao agentDao, JsonCodec jsonCodec) {
        this.agentDao = agentDao;
        this.jsonCodec = jsonCodec;
    }

    @Override
    public AgentEntity save(AgentEntity entity) {
        entity.validate();
        AgentPO po = toPO(entity);
        try {
            agentDao.insert(po);
        } catch (DuplicateKeyException ex) {
            throw new AppException(ResponseCode.DUPLICATE_AGENT_NAME);
        }
        return toEntity(agentDao.selectByIdAndTenant(po.getId(), po.getTenantId()));
    }

    @Override
    public AgentEntity update(TenantContext context, AgentEntity entity) {
        if (!context.ownsTenant(entity.getTenantId())) {
            throw new AppException(ResponseCode.TENANT_MISMATCH);
        }
        entity.validate();
        int affected;
        try {
            affected = agentDao.updateWithVersion(toPO(entity));
        } catch (DuplicateKeyException ex) {
            throw new AppException(ResponseCode.DUPLICATE_AGENT_NAME);
        }
        if (affected == 0) {
            log.warn("AGENT_UPDATE_CONFLICT tenantId={}, agentId={}, version={}",
                    context.tenantId(), entity.getId(), entity.getVersion());
            throw new AppException(ResponseCode.RESOURCE_BUSY, "Agent was modified concurrently");
        }
        return toEntity(agentDao.selectByIdAndTenant(entity.getId(), context.tenantId()));
    }

    @Override
    public AgentEntity findById(TenantContext context, Long id) {
        return toEntity(agentDao.selectByIdAndTenant(id, context.tenantId()));
    }

    @Override
    public List<AgentEntity> findByTenant(TenantContext context) {
        return agentDao.selectActiveByTenant(context.tenantId()).stream()
                .map(this::toEntity)
                .toList();
    }

    @Override
    public AgentEntity findByName(TenantContext context, String name) {
        return toEntity(agentDao.selectActiveByName(context.tenantId(), name));
    }

    @Override
    public long countActive(TenantContext context) {
        return agentDao.countActiveByTenant(context.tenantId());
    }

    @Override
    public boolean transitionStatus(TenantContext context,
                                    Long agentId,
                                    AgentStatusEnum expected,
                                    AgentStatusEnum target) {
        return agentDao.updateStatusIfMatch(agentId, context.tenantId(),
                expected.getCode(), target.getCode()) > 0;
    }

    private AgentEntity toEntity(AgentPO po) {
        if (po == null) {
            return null;
        }
        AgentEntity entity = new AgentEntity();
        entity.setId(po.getId());
        entity.setTenantId(po.getTenantId());
        entity.setName(po.getName());
        entity.setAgentType(po.getAgentType());
        entity.setDescription(po.getDescription());
        entity.setStatus(AgentStatusEnum.fromCode(po.getStatus()));
        if (po.getConfiguration() != null) {
            entity.setConfiguration(jsonCodec.readMap(po.getConfiguration()));
        }
        entity.setCreatedBy(po.getCreatedBy());
        entity.setVersion(po.getVersion());
        entity.setCreatedAt(po.getCreatedAt());
        entity.setUpdatedAt(po.getUpdatedAt());
        return entity;
    }

    private AgentPO toPO(AgentEntity entity) {
        return AgentPO.builder()
                .id(entity.getId())
                .tenantId(entity.getTenantId())
                .name(entity.getName())
                .agentType(entity.getAgentType())
                .description(entity.getDescription())
                .status(entity.getStatus() == null ? null : entity.getStatus().getCode())
                .configuration(jsonCodec.writeValue(entity.getConfiguration()))
                .createdBy(entity.getCreatedBy())
                .version(entity.getVersion())
                .createdAt(entity.getCreatedAt())
                .updatedAt(entity.getUpdatedAt())
                .build();
    }
}
