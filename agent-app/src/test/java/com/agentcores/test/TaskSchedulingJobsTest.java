package com.agentcores.test;

import com.agentcores.domain.agent.model.entity.AgentEntity;
import com.agentcores.domain.auth.model.valobj.TenantContext;
import com.agentcores.domain.task.model.entity.AgentTaskEntity;
import com.agentcores.domain.tenant.model.entity.TenantEntity;
import com.agentcores.test.support.TenantWorld;
import com.agentcores.trigger.application.command.TaskExecutionApplicationService;
import com.agentcores.trigger.job.TaskExecutor;
import com.agentcores.trigger.job.TaskLeaseReaper;
import com.agentcores.types.enums.TaskStatusEnum;
import com.agentcores.types.enums.TenantTierEnum;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ThreadPoolExecutor;

public class TaskSchedulingJobsTest {

    private static final Duration WAIT = Duration.ofSeconds(10);

    private TenantWorld world;
    private ThreadPoolExecutor worker;
    private ThreadPoolTaskScheduler scheduler;
    private TaskExecutionApplicationService executionService;

    @BeforeEach
    public void setUp() {
        this.world = new TenantWorld();
        this.worker = TenantWorld.newWorker(4);
        this.scheduler = TenantWorld.newWatchdogScheduler();
        this.executionService = world.executionService(TenantWorld.unreachableGateway(), worker, scheduler, "instance-a");
    }

    @AfterEach
    public void tearDown() {
        worker.shutdownNow();
        scheduler.shutdown();
    }

    @Test
    public void shouldDispatchPendingTasksOfActiveTenantsOnly() throws Exception {
        TenantEntity acme = world.createTenant("acme", TenantTierEnum.PROFESSIONAL);
        TenantEntity dormant = world.createTenant("dormant", TenantTierEnum.PROFESSIONAL);
        dormant.setActive(false);
        AgentEntity acmeAgent = world.createAgent(acme, "runner");
        AgentEntity dormantAgent = world.createAgent(dormant, "runner");
        AgentTaskEntity first = world.createTextTask(acmeAgent, "uppercase", "a", 3, 30);
        AgentTaskEntity second = world.createTextTask(acmeAgent, "lowercase", "B", 3, 30);
        AgentTaskEntity skipped = world.createTextTask(dormantAgent, "echo", "z", 3, 30);

        new TaskExecutor(world.taskRepository, world.tenantRepository, executionService, 16).executePendingTasks();

        Assertions.assertTrue(TenantWorld.await(() -> statusOf(first) == TaskStatusEnum.COMPLETED
                && statusOf(second) == TaskStatusEnum.COMPLETED, WAIT));
        Assertions.assertEquals("A", world.taskRepository.peek(first.getId()).getOutputData().get("result"));
        Assertions.assertEquals(TaskStatusEnum.PENDING, statusOf(skipped));
    }

    @Test
    public void shouldLeaveTasksPendingOnceHourlyQuotaIsUsed() throws Exception {
        TenantEntity tenant = world.createTenant("acme", TenantTierEnum.FREE);
        tenant.setMaxTasksPerHour(1);
        AgentEntity agent = world.createAgent(tenant, "runner");
        AgentTaskEntity urgent = world.createTextTask(agent, "echo", "first", 3, 30);
        world.taskRepository.mutate(urgent.getId(), stored -> stored.setPriority(10));
        AgentTaskEntity normal = world.createTextTask(agent, "echo", "second", 3, 30);

        TaskExecutor executor = new TaskExecutor(world.taskRepository, world.tenantRepository, executionService, 16);
        executor.executePendingTasks();
        Assertions.assertTrue(TenantWorld.await(() -> statusOf(urgent) == TaskStatusEnum.COMPLETED, WAIT));
        executor.executePendingTasks();

        Assertions.assertEquals(TaskStatusEnum.PENDING, statusOf(normal));
        Assertions.assertEquals(0, world.taskRepository.peek(normal.getId()).getExecutionAttempt());
    }

    @Test
    public void shouldNotLetQuotaExhaustedTenantStarveOthers() throws Exception {
        TenantEntity noisy = world.createTenant("noisy", TenantTierEnum.FREE);
        noisy.setMaxTasksPerHour(1);
        TenantEntity quiet = world.createTenant("quiet", TenantTierEnum.FREE);
        AgentEntity noisyAgent = world.createAgent(noisy, "runner");
        AgentEntity quietAgent = world.createAgent(quiet, "runner");
        List<AgentTaskEntity> flood = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            AgentTaskEntity task = world.createTextTask(noisyAgent, "echo", "flood-" + i, 3, 30);
            world.taskRepository.mutate(task.getId(), stored -> stored.setPriority(10));
            flood.add(task);
        }
        AgentTaskEntity victim = world.createTextTask(quietAgent, "echo", "quiet", 3, 30);

        TaskExecutor executor = new TaskExecutor(world.taskRepository, world.tenantRepository, executionService, 4);
        executor.executePendingTasks();
        Assertions.assertTrue(TenantWorld.await(() -> executionService.inFlightCount() == 0, WAIT));
        executor.executePendingTasks();

        Assertions.assertTrue(TenantWorld.await(() -> statusOf(victim) == TaskStatusEnum.COMPLETED, WAIT));
        long noisyAdmitted = flood.stream().filter(task -> statusOf(task) != TaskStatusEnum.PENDING).count();
        Assertions.assertEquals(1, noisyAdmitted);
    }

    @Test
    public void shouldSkipTasksOfInactiveTenantsWhenSelectingCandidates() {
        TenantEntity dormant = world.createTenant("dormant", TenantTierEnum.ENTERPRISE);
        dormant.setActive(false);
        TenantEntity exhausted = world.createTenant("exhausted", TenantTierEnum.FREE);
        exhausted.setMaxTasksPerHour(0);
        TenantEntity acme = world.createTenant("acme", TenantTierEnum.FREE);
        AgentTaskEntity dormantTask = world.createTextTask(world.createAgent(dormant, "runner"), "echo", "d", 3, 30);
        world.taskRepository.mutate(dormantTask.getId(), stored -> stored.setPriority(10));
        AgentTaskEntity exhaustedTask = world.createTextTask(world.createAgent(exhausted, "runner"), "echo", "e", 3, 30);
        world.taskRepository.mutate(exhaustedTask.getId(), stored -> stored.setPriority(10));
        AgentTaskEntity eligible = world.createTextTask(world.createAgent(acme, "runner"), "echo", "a", 3, 30);

        List<AgentTaskEntity> candidates = world.taskRepository.findDispatchCandidates(1);

        Assertions.assertEquals(1, candidates.size());
        Assertions.assertEquals(eligible.getId(), candidates.get(0).getId());
    }

    @Test
    public void shouldReclaimLeaseOfCrashedInstance() {
        TenantEntity tenant = world.createTenant("acme", TenantTierEnum.BASIC);
        AgentEntity agent = world.createAgent(tenant, "runner");
        AgentTaskEntity retriable = world.createTextTask(agent, "echo", "x", 2, 30);
        AgentTaskEntity exhausted = world.createTextTask(agent, "echo", "y", 0, 30);
        TenantContext workerContext = TenantContext.worker(tenant.getId());
        for (AgentTaskEntity task : new AgentTaskEntity[]{retriable, exhausted}) {
            world.taskRepository.claimWithAdmission(workerContext, task.getId(), "instance-crashed", 1000);
            world.taskRepository.mutate(task.getId(), stored -> stored.setLeaseUntil(LocalDateTime.now().minusSeconds(5)));
        }

        new TaskLeaseReaper(world.taskRepository, executionService, 100).reclaimExpiredLeases();

        AgentTaskEntity retried = world.taskRepository.peek(retriable.getId());
        Assertions.assertEquals(TaskStatusEnum.PENDING, retried.getStatus());
        Assertions.assertEquals(1, retried.getRetryCount());
        AgentTaskEntity failed = world.taskRepository.peek(exhausted.getId());
        Assertions.assertEquals(TaskStatusEnum.FAILED, failed.getStatus());
        Assertions.assertTrue(failed.getLastError().startsWith("LEASE_EXPIRED"));
        Assertions.assertTrue(world.taskRepository.findExpiredRunning(10).isEmpty());
    }

    private TaskStatusEnum statusOf(AgentTaskEntity task) {
        return world.taskRepository.peek(task.getId()).getStatus();
    }
}
