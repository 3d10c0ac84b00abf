package com.agentcores.trigger.application.command;

import com.agentcores.api.dto.AgentDTO;
import com.agentcores.api.dto.AgentUpsertRequestDTO;
import com.agentcores.domain.agent.adapter.repository.IAgentRepository;
import com.agentcores.domain.agent.model.entity.AgentEntity;
import com.agentcores.domain.audit.adapter.repository.IAuditLogRepository;
import com.agentcores.domain.audit.model.entity.AuditLogEntity;
import com.agentcores.domain.auth.model.valobj.TenantContext;
import com.agentcores.domain.authorization.service.AuthorizationGuardDomainService;
import com.agentcores.domain.task.adapter.repository.IAgentTaskRepository;
import com.agentcores.domain.tenant.adapter.repository.ITenantRepository;
import com.agentcores.domain.tenant.model.entity.TenantEntity;
import com.agentcores.trigger.application.common.AccountViewAssembler;
import com.agentcores.types.enums.AgentStatusEnum;
import com.agentcores.types.enums.AuditEventTypeEnum;
import com.agentcores.types.enums.AuditOutcomeEnum;
import com.agentcores.types.enums.CapabilityEnum;
import com.agentcores.types.enums.ResponseCode;
import com.agentcores.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.LinkedHashMap;

/**
 * Agent 写用例：创建、更新、软删除。
 * <p>
 * 已终止的 Agent 对外视同不存在；用户只能在 idle 与 paused 之间切换状态，
 * running / error 由执行器维护。
 * </p>
 *
 * @author agentcores
 * @since 2026-03-06
 */
@Slf4j
@Service
public class AgentCommandService {

    private static final String DEFAULT_AGENT_TYPE = "general";

    private final IAgentRepository agentRepository;
    private final IAgentTaskRepository agentTaskRepository;
    private final ITenantRepository tenantRepository;
    private final IAuditLogRepository auditLogRepository;
    private final AuthorizationGuardDomainService authorizationGuard;
    private final AccountViewAssembler accountViewAssembler;

    public AgentCommandService(IAgentRepository agentRepository,
                               IAgentTaskRepository agentTaskRepository,
                               ITenantRepository tenantRepository,
                               IAuditLogRepository auditLogRepository,
                               AuthorizationGuardDomainService authorizationGuard,
                               AccountViewAssembler accountViewAssembler) {
        this.agentRepository = agentRepository;
        this.agentTaskRepository = agentTaskRepository;
        this.tenantRepository = tenantRepository;
        this.auditLogRepository = auditLogRepository;
        this.authorizationGuard = authorizationGuard;
        this.accountViewAssembler = accountViewAssembler;
    }

    public AgentDTO create(TenantContext context, AgentUpsertRequestDTO request) {
        authorizationGuard.requireInTenant(context, CapabilityEnum.CREATE_AGENTS, "agent");
        if (request == null) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "请求体不能为空");
        }
        String name = StringUtils.trimToNull(request.getName());
        if (name == null) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "name is required");
        }
        AgentStatusEnum status = resolveRequestedStatus(request.getStatus(), AgentStatusEnum.IDLE);

        TenantEntity tenant = tenantRepository.findCurrent(context);
        long activeAgents = agentRepository.countActive(context);
        if (tenant == null || activeAgents >= tenant.getMaxAgents()) {
            log.info("AGENT_QUOTA_EXCEEDED tenantId={}, activeAgents={}, limit={}",
                    context.tenantId(), activeAgents, tenant == null ? null : tenant.getMaxAgents());
            throw new AppException(ResponseCode.QUOTA_EXCEEDED, "Agent limit of the tenant reached");
        }
        if (agentRepository.findByName(context, name) != null) {
            throw new AppException(ResponseCode.DUPLICATE_AGENT_NAME);
        }

        AgentEntity agent = new AgentEntity();
        agent.setTenantId(context.tenantId());
        agent.setName(name);
        agent.setAgentType(StringUtils.defaultIfBlank(StringUtils.trimToNull(request.getAgentType()), DEFAULT_AGENT_TYPE));
        agent.setDescription(StringUtils.trimToNull(request.getDescription()));
        agent.setStatus(status);
        agent.setConfiguration(request.getConfiguration() == null
                ? new HashMap<>() : new LinkedHashMap<>(request.getConfiguration()));
        agent.setCreatedBy(context.userId());
        AgentEntity saved = agentRepository.save(agent);

        auditLogRepository.append(AuditLogEntity.event(context.tenantId(), context.userId(),
                        AuditEventTypeEnum.AGENT_CREATED, AuditOutcomeEnum.ALLOWED, "agent", saved.getId())
                .with("name", name));
        log.info("AGENT_CREATED tenantId={}, agentId={}, name={}, createdBy={}",
                context.tenantId(), saved.getId(), name, context.userId());
        return accountViewAssembler.toAgent(saved);
    }

    public AgentDTO update(TenantContext context, Long agentId, AgentUpsertRequestDTO request) {
        AgentEntity agent = findVisible(context, agentId);
        authorizationGuard.require(context, CapabilityEnum.EDIT_AGENTS,
                agent == null ? null : agent.getTenantId(), "agent", agentId);
        if (request == null) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "请求体不能为空");
        }

        String name = StringUtils.trimToNull(request.getName());
        if (name != null && !name.equals(agent.getName())) {
            if (agentRepository.findByName(context, name) != null) {
                throw new AppException(ResponseCode.DUPLICATE_AGENT_NAME);
            }
            agent.setName(name);
        }
        if (StringUtils.isNotBlank(request.getAgentType())) {
            agent.setAgentType(request.getAgentType().trim());
        }
        if (request.getDescription() != null) {
            agent.setDescription(StringUtils.trimToNull(request.getDescription()));
        }
        if (request.getConfiguration() != null) {
            agent.setConfiguration(new LinkedHashMap<>(request.getConfiguration()));
        }
        if (StringUtils.isNotBlank(request.getStatus())) {
            AgentStatusEnum requested = resolveRequestedStatus(request.getStatus(), agent.getStatus());
            if (requested == AgentStatusEnum.PAUSED) {
                agent.setStatus(AgentStatusEnum.PAUSED);
            } else if (agent.getStatus() == AgentStatusEnum.PAUSED || agent.getStatus() == AgentStatusEnum.ERROR) {
                // 恢复为 idle；running 由执行器在任务结束时复位
                agent.setStatus(AgentStatusEnum.IDLE);
            }
        }

        AgentEntity updated = agentRepository.update(context, agent);
        auditLogRepository.append(AuditLogEntity.event(context.tenantId(), context.userId(),
                        AuditEventTypeEnum.AGENT_UPDATED, AuditOutcomeEnum.ALLOWED, "agent", agentId)
                .with("status", updated.getStatus().getCode()));
        log.info("AGENT_UPDATED tenantId={}, agentId={}, status={}", context.tenantId(), agentId, updated.getStatus());
        return accountViewAssembler.toAgent(updated);
    }

    /**
     * 软删除：置为 terminated。仍有 pending / running 任务时拒绝。
     */
    public AgentDTO delete(TenantContext context, Long agentId) {
        AgentEntity agent = findVisible(context, agentId);
        authorizationGuard.require(context, CapabilityEnum.DELETE_AGENTS,
                agent == null ? null : agent.getTenantId(), "agent", agentId);
        long activeTasks = agentTaskRepository.countActiveByAgent(context, agentId);
        if (activeTasks > 0) {
            throw new AppException(ResponseCode.RESOURCE_BUSY,
                    "Agent still has " + activeTasks + " pending or running tasks");
        }
        agent.terminate();
        AgentEntity updated = agentRepository.update(context, agent);
        auditLogRepository.append(AuditLogEntity.event(context.tenantId(), context.userId(),
                AuditEventTypeEnum.AGENT_TERMINATED, AuditOutcomeEnum.ALLOWED, "agent", agentId));
        log.info("AGENT_TERMINATED tenantId={}, agentId={}, operator={}", context.tenantId(), agentId, context.userId());
        return accountViewAssembler.toAgent(updated);
    }

    private AgentEntity findVisible(TenantContext context, Long agentId) {
        AgentEntity agent = agentRepository.findById(context, agentId);
        return agent == null || agent.isTerminated() ? null : agent;
    }

    private AgentStatusEnum resolveRequestedStatus(String raw, AgentStatusEnum fallback) {
        AgentStatusEnum status = StringUtils.isBlank(raw) ? fallback : AgentStatusEnum.fromCode(raw);
        if (status != AgentStatusEnum.IDLE && status != AgentStatusEnum.PAUSED) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "status must be idle or paused");
        }
        return status;
    }
}
