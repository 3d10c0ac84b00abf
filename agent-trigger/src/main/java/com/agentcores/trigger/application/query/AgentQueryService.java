package com.agentcores.trigger.application.query;

import com.agentcores.api.dto.AgentDTO;
import com.agentcores.domain.agent.adapter.repository.IAgentRepository;
import com.agentcores.domain.agent.model.entity.AgentEntity;
import com.agentcores.domain.auth.model.valobj.TenantContext;
import com.agentcores.domain.authorization.service.AuthorizationGuardDomainService;
import com.agentcores.trigger.application.common.AccountViewAssembler;
import com.agentcores.types.enums.CapabilityEnum;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Agent 查询用例。
 */
@Service
public class AgentQueryService {

    private final IAgentRepository agentRepository;
    private final AuthorizationGuardDomainService authorizationGuard;
    private final AccountViewAssembler accountViewAssembler;

    public AgentQueryService(IAgentRepository agentRepository,
                             AuthorizationGuardDomainService authorizationGuard,
                             AccountViewAssembler accountViewAssembler) {
        this.agentRepository = agentRepository;
        this.authorizationGuard = authorizationGuard;
        this.accountViewAssembler = accountViewAssembler;
    }

    public List<AgentDTO> list(TenantContext context) {
        authorizationGuard.requireInTenant(context, CapabilityEnum.VIEW_AGENTS, "agent");
        return agentRepository.findByTenant(context).stream()
                .map(accountViewAssembler::toAgent)
                .toList();
    }

    public AgentDTO get(TenantContext context, Long agentId) {
        AgentEntity agent = agentRepository.findById(context, agentId);
        if (agent != null && agent.isTerminated()) {
            agent = null;
        }
        authorizationGuard.require(context, CapabilityEnum.VIEW_AGENTS,
                agent == null ? null : agent.getTenantId(), "agent", agentId);
        return accountViewAssembler.toAgent(agent);
    }
}
