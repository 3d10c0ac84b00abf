package com.agentcores.test.support;

import com.agentcores.domain.agent.model.entity.AgentEntity;
import com.agentcores.domain.auth.adapter.gateway.ITokenCodec;
import com.agentcores.domain.auth.model.entity.UserEntity;
import com.agentcores.domain.auth.model.valobj.TenantContext;
import com.agentcores.domain.authorization.service.AuthorizationGuardDomainService;
import com.agentcores.domain.task.adapter.gateway.IHttpCallGateway;
import com.agentcores.domain.task.model.entity.AgentTaskEntity;
import com.agentcores.domain.task.model.valobj.HttpCallResult;
import com.agentcores.domain.task.model.valobj.RetryBackoffPolicy;
import com.agentcores.domain.task.service.TaskDispatchDomainService;
import com.agentcores.domain.task.service.TaskInputDomainService;
import com.agentcores.domain.task.service.TaskLifecycleDomainService;
import com.agentcores.domain.tenant.model.entity.TenantEntity;
import com.agentcores.domain.tenant.service.TenantQuotaDomainService;
import com.agentcores.infrastructure.auth.BCryptPasswordHasher;
import com.agentcores.infrastructure.auth.HmacTokenCodec;
import com.agentcores.infrastructure.util.JsonCodec;
import com.agentcores.trigger.application.command.AuthSessionCommandService;
import com.agentcores.trigger.application.command.TaskExecutionApplicationService;
import com.agentcores.trigger.application.command.TaskLifecycleCommandService;
import com.agentcores.trigger.application.common.AccountViewAssembler;
import com.agentcores.trigger.application.common.TaskDetailViewAssembler;
import com.agentcores.types.enums.AgentStatusEnum;
import com.agentcores.types.enums.TaskStatusEnum;
import com.agentcores.types.enums.TaskTypeEnum;
import com.agentcores.types.enums.TenantTierEnum;
import com.agentcores.types.enums.UserRoleEnum;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.cache.CacheBuilder;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

/**
 * 测试用多租户现场：内存仓储 + 真实领域服务。
 */
public class TenantWorld {

    public final InMemoryTenantRepository tenantRepository = new InMemoryTenantRepository();
    public final InMemoryUserRepository userRepository = new InMemoryUserRepository();
    public final InMemoryAgentRepository agentRepository = new InMemoryAgentRepository();
    public final InMemoryAgentTaskRepository taskRepository = new InMemoryAgentTaskRepository(tenantRepository::findById);
    public final InMemoryAuditLogRepository auditLogRepository = new InMemoryAuditLogRepository();
    public final InMemoryAuthTokenRepository authTokenRepository = new InMemoryAuthTokenRepository();
    public final InMemoryInvitationRepository invitationRepository = new InMemoryInvitationRepository();

    public final AuthorizationGuardDomainService guard = new AuthorizationGuardDomainService(auditLogRepository);
    public final TenantQuotaDomainService quotaDomainService = new TenantQuotaDomainService();
    public final TaskInputDomainService taskInputDomainService = new TaskInputDomainService();
    public final AccountViewAssembler accountViewAssembler = new AccountViewAssembler();
    public final TaskDetailViewAssembler taskDetailViewAssembler = new TaskDetailViewAssembler();

    public static final String SIGNING_KEY = "test-signing-key-0123456789-abcdefghijklmnop";

    private long userSeq = 1;

    public TenantEntity createTenant(String slug, TenantTierEnum tier) {
        TenantEntity tenant = new TenantEntity();
        tenant.setName(slug);
        tenant.setSlug(slug);
        tenant.setTier(tier);
        tenant.applyQuota(quotaDomainService.quotaOf(tier));
        tenant.setActive(true);
        return tenantRepository.save(tenant);
    }

    /**
     * 在租户内创建一个用户并返回其请求上下文。
     */
    public TenantContext member(TenantEntity tenant, UserRoleEnum role) {
        UserEntity user = new UserEntity();
        user.setTenantId(tenant.getId());
        user.setEmail(role.getCode() + "-" + (userSeq++) + "@" + tenant.getSlug() + ".test");
        user.setPasswordHash("unused");
        user.setRole(role);
        user.setActive(true);
        UserEntity saved = userRepository.save(user);
        return new TenantContext(tenant.getId(), saved.getId(), role, null);
    }

    public AgentEntity createAgent(TenantEntity tenant, String name) {
        AgentEntity agent = new AgentEntity();
        agent.setTenantId(tenant.getId());
        agent.setName(name);
        agent.setAgentType("general");
        agent.setStatus(AgentStatusEnum.IDLE);
        agent.setConfiguration(new LinkedHashMap<>());
        return agentRepository.save(agent);
    }

    public AgentTaskEntity createTextTask(AgentEntity agent, String operation, String text, int maxRetries, int timeoutSeconds) {
        Map<String, Object> input = new LinkedHashMap<>();
        input.put("operation", operation);
        input.put("text", text);
        return createTask(agent, TaskTypeEnum.TEXT_PROCESSING, input, maxRetries, timeoutSeconds);
    }

    public AgentTaskEntity createTask(AgentEntity agent,
                                      TaskTypeEnum taskType,
                                      Map<String, Object> input,
                                      int maxRetries,
                                      int timeoutSeconds) {
        AgentTaskEntity task = new AgentTaskEntity();
        task.setTenantId(agent.getTenantId());
        task.setAgentId(agent.getId());
        task.setTaskType(taskType);
        task.setPriority(5);
        task.setStatus(TaskStatusEnum.PENDING);
        task.setInputData(input);
        task.setRetryCount(0);
        task.setMaxRetries(maxRetries);
        task.setTimeoutSeconds(timeoutSeconds);
        return taskRepository.save(task);
    }

    public TaskLifecycleDomainService lifecycle() {
        return new TaskLifecycleDomainService(new RetryBackoffPolicy(Duration.ZERO, Duration.ZERO));
    }

    public TaskDispatchDomainService dispatcher(IHttpCallGateway gateway) {
        return new TaskDispatchDomainService(taskInputDomainService, gateway);
    }

    public static IHttpCallGateway unreachableGateway() {
        return (input, timeout) -> new HttpCallResult(503, "unavailable", null, false);
    }

    public static ThreadPoolExecutor newWorker(int size) {
        return new ThreadPoolExecutor(size, size, 60, TimeUnit.SECONDS, new LinkedBlockingQueue<>());
    }

    public static ThreadPoolTaskScheduler newWatchdogScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("test-watchdog-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.initialize();
        return scheduler;
    }

    public TaskExecutionApplicationService executionService(IHttpCallGateway gateway,
                                                            ThreadPoolExecutor worker,
                                                            ThreadPoolTaskScheduler scheduler,
                                                            String instanceId) {
        return new TaskExecutionApplicationService(taskRepository, agentRepository, auditLogRepository,
                dispatcher(gateway), lifecycle(), worker, scheduler, instanceId);
    }

    public TaskLifecycleCommandService taskCommands(TaskExecutionApplicationService executionService) {
        return new TaskLifecycleCommandService(taskRepository, agentRepository, tenantRepository, auditLogRepository,
                guard, taskInputDomainService, executionService, taskDetailViewAssembler);
    }

    public static HmacTokenCodec tokenCodec() {
        return new HmacTokenCodec(SIGNING_KEY, "agentcores", new JsonCodec(new ObjectMapper()));
    }

    /**
     * 真实令牌编解码 + 低强度 BCrypt，access 15 分钟 / refresh 7 天。
     */
    public AuthSessionCommandService authSessions(ITokenCodec tokenCodec) {
        return new AuthSessionCommandService(tenantRepository, userRepository, invitationRepository,
                authTokenRepository, auditLogRepository, tokenCodec, new BCryptPasswordHasher(4),
                quotaDomainService, accountViewAssembler, CacheBuilder.newBuilder().build(), 15, 7);
    }

    /**
     * 轮询等待条件成立。
     */
    public static boolean await(BooleanSupplier condition, Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (System.nanoTime() < deadline) {
            if (condition.getAsBoolean()) {
                return true;
            }
            Thread.sleep(20);
        }
        return condition.getAsBoolean();
    }
}
