package com.agentcores.test;

import com.agentcores.domain.agent.model.entity.AgentEntity;
import com.agentcores.domain.auth.model.valobj.TenantContext;
import com.agentcores.domain.task.adapter.gateway.IHttpCallGateway;
import com.agentcores.domain.task.model.entity.AgentTaskEntity;
import com.agentcores.domain.task.model.valobj.ClaimStatus;
import com.agentcores.domain.task.model.valobj.HttpCallResult;
import com.agentcores.domain.task.model.valobj.TaskClaimResult;
import com.agentcores.domain.tenant.model.entity.TenantEntity;
import com.agentcores.test.support.TenantWorld;
import com.agentcores.trigger.application.command.TaskExecutionApplicationService;
import com.agentcores.types.enums.AgentStatusEnum;
import com.agentcores.types.enums.ResponseCode;
import com.agentcores.types.enums.TaskStatusEnum;
import com.agentcores.types.enums.TaskTypeEnum;
import com.agentcores.types.enums.TenantTierEnum;
import com.agentcores.types.exception.AppException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

public class TaskExecutionApplicationServiceTest {

    private static final Duration WAIT = Duration.ofSeconds(10);

    private TenantWorld world;
    private TenantEntity tenant;
    private AgentEntity agent;
    private TenantContext workerContext;
    private ThreadPoolExecutor worker;
    private ThreadPoolTaskScheduler scheduler;

    @BeforeEach
    public void setUp() {
        this.world = new TenantWorld();
        this.tenant = world.createTenant("acme", TenantTierEnum.ENTERPRISE);
        this.agent = world.createAgent(tenant, "runner");
        this.workerContext = TenantContext.worker(tenant.getId());
        this.worker = TenantWorld.newWorker(4);
        this.scheduler = TenantWorld.newWatchdogScheduler();
    }

    @AfterEach
    public void tearDown() {
        worker.shutdownNow();
        scheduler.shutdown();
    }

    @Test
    public void shouldCompleteClaimedTaskAndReleaseAgent() throws Exception {
        TaskExecutionApplicationService service = world.executionService(
                TenantWorld.unreachableGateway(), worker, scheduler, "instance-a");
        AgentTaskEntity task = world.createTextTask(agent, "uppercase", "hello", 3, 30);

        TaskClaimResult result = service.claim(workerContext, task.getId(), 1000, "scheduler");
        Assertions.assertEquals(ClaimStatus.CLAIMED, result.status());
        Assertions.assertEquals(AgentStatusEnum.RUNNING, world.agentRepository.findById(workerContext, agent.getId()).getStatus());
        service.launch(result.task());

        Assertions.assertTrue(TenantWorld.await(() -> settled(service, task, TaskStatusEnum.COMPLETED), WAIT));
        AgentTaskEntity done = world.taskRepository.peek(task.getId());
        Assertions.assertEquals("HELLO", done.getOutputData().get("result"));
        Assertions.assertEquals(1, done.getExecutionAttempt());
        Assertions.assertEquals(List.of("pending->running", "running->completed"),
                world.auditLogRepository.transitionsOf(task.getId()));
        Assertions.assertEquals(AgentStatusEnum.IDLE, world.agentRepository.findById(workerContext, agent.getId()).getStatus());
    }

    @Test
    public void shouldRetryFailingTaskUntilMaxRetries() throws Exception {
        TaskExecutionApplicationService service = world.executionService(
                TenantWorld.unreachableGateway(), worker, scheduler, "instance-a");
        AgentTaskEntity task = world.createTask(agent, TaskTypeEnum.API_CALL,
                Map.of("url", "https://upstream.example/api"), 3, 30);

        for (int attempt = 1; attempt <= 3; attempt++) {
            TaskClaimResult result = service.claim(workerContext, task.getId(), 1000, "scheduler");
            Assertions.assertEquals(ClaimStatus.CLAIMED, result.status(), "attempt " + attempt);
            service.launch(result.task());
            Assertions.assertTrue(TenantWorld.await(
                    () -> statusOf(task) != TaskStatusEnum.RUNNING && service.inFlightCount() == 0, WAIT));
        }

        AgentTaskEntity failed = world.taskRepository.peek(task.getId());
        Assertions.assertEquals(TaskStatusEnum.FAILED, failed.getStatus());
        Assertions.assertEquals(3, failed.getRetryCount());
        Assertions.assertTrue(failed.getLastError().contains("returned 503"));
        Assertions.assertNotNull(failed.getOutputData().get("error"));
        Assertions.assertEquals(List.of(
                "pending->running", "running->failed", "failed->pending",
                "pending->running", "running->failed", "failed->pending",
                "pending->running", "running->failed"), world.auditLogRepository.transitionsOf(task.getId()));
        Assertions.assertEquals(ClaimStatus.NOT_ELIGIBLE,
                service.claim(workerContext, task.getId(), 1000, "scheduler").status());
    }

    @Test
    public void shouldLetExactlyOneConcurrentClaimWin() throws Exception {
        TaskExecutionApplicationService service = world.executionService(
                TenantWorld.unreachableGateway(), worker, scheduler, "instance-a");
        AgentTaskEntity task = world.createTextTask(agent, "echo", "x", 3, 30);

        int contenders = 8;
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(contenders);
        try {
            List<Future<ClaimStatus>> futures = new ArrayList<>();
            for (int i = 0; i < contenders; i++) {
                Callable<ClaimStatus> claim = () -> {
                    start.await(2, TimeUnit.SECONDS);
                    return service.claim(workerContext, task.getId(), 1000, "manual").status();
                };
                futures.add(pool.submit(claim));
            }
            start.countDown();

            int claimed = 0;
            for (Future<ClaimStatus> future : futures) {
                ClaimStatus status = future.get(5, TimeUnit.SECONDS);
                if (status == ClaimStatus.CLAIMED) {
                    claimed++;
                } else {
                    Assertions.assertEquals(ClaimStatus.NOT_ELIGIBLE, status);
                }
            }
            Assertions.assertEquals(1, claimed);
            Assertions.assertEquals(1, world.taskRepository.peek(task.getId()).getExecutionAttempt());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    public void shouldTimeOutHungExecutionThroughWatchdog() throws Exception {
        CountDownLatch interrupted = new CountDownLatch(1);
        IHttpCallGateway hangingGateway = (input, timeout) -> {
            try {
                Thread.sleep(60_000);
            } catch (InterruptedException ex) {
                interrupted.countDown();
                Thread.currentThread().interrupt();
                throw new AppException(ResponseCode.EXECUTION_ERROR, "interrupted");
            }
            return new HttpCallResult(200, "", null, false);
        };
        TaskExecutionApplicationService service = world.executionService(hangingGateway, worker, scheduler, "instance-a");
        AgentTaskEntity task = world.createTask(agent, TaskTypeEnum.API_CALL,
                Map.of("url", "https://slow.example/api"), 0, 1);

        service.launch(service.claim(workerContext, task.getId(), 1000, "manual").task());

        Assertions.assertTrue(TenantWorld.await(() -> settled(service, task, TaskStatusEnum.FAILED), WAIT));
        Assertions.assertTrue(interrupted.await(5, TimeUnit.SECONDS));
        AgentTaskEntity failed = world.taskRepository.peek(task.getId());
        Assertions.assertTrue(failed.getLastError().startsWith("TIMEOUT"));
        Assertions.assertEquals(List.of("pending->running", "running->failed"),
                world.auditLogRepository.transitionsOf(task.getId()));
    }

    @Test
    public void shouldCancelWatchdogOnceExecutionSettles() throws Exception {
        TaskExecutionApplicationService service = world.executionService(
                TenantWorld.unreachableGateway(), worker, scheduler, "instance-a");
        for (int i = 0; i < 5; i++) {
            AgentTaskEntity task = world.createTextTask(agent, "echo", "fast-" + i, 0, 300);
            service.launch(service.claim(workerContext, task.getId(), 1000, "manual").task());
            Assertions.assertTrue(TenantWorld.await(() -> settled(service, task, TaskStatusEnum.COMPLETED), WAIT));
        }

        Assertions.assertTrue(TenantWorld.await(
                () -> scheduler.getScheduledThreadPoolExecutor().getQueue().isEmpty(), Duration.ofSeconds(2)));
    }

    @Test
    public void shouldReclaimExpiredLeaseOfCrashedInstance() {
        TaskExecutionApplicationService service = world.executionService(
                TenantWorld.unreachableGateway(), worker, scheduler, "instance-b");
        AgentTaskEntity task = world.createTextTask(agent, "echo", "x", 3, 5);
        world.taskRepository.claimWithAdmission(workerContext, task.getId(), "instance-crashed", 1000);
        world.taskRepository.mutate(task.getId(), stored -> stored.setLeaseUntil(LocalDateTime.now().minusSeconds(1)));

        List<AgentTaskEntity> expired = world.taskRepository.findExpiredRunning(10);
        Assertions.assertEquals(1, expired.size());
        Assertions.assertTrue(service.reclaimExpired(expired.get(0)));

        AgentTaskEntity reclaimed = world.taskRepository.peek(task.getId());
        Assertions.assertEquals(TaskStatusEnum.PENDING, reclaimed.getStatus());
        Assertions.assertEquals(1, reclaimed.getRetryCount());
        Assertions.assertTrue(reclaimed.getLastError().startsWith("LEASE_EXPIRED"));
        Assertions.assertEquals(ClaimStatus.CLAIMED,
                service.claim(workerContext, task.getId(), 1000, "scheduler").status());
        Assertions.assertEquals(2, world.taskRepository.peek(task.getId()).getExecutionAttempt());
    }

    @Test
    public void shouldDiscardResultOfSupersededAttempt() throws Exception {
        TaskExecutionApplicationService service = world.executionService(
                TenantWorld.unreachableGateway(), worker, scheduler, "instance-a");
        AgentTaskEntity task = world.createTextTask(agent, "echo", "late", 3, 30);
        AgentTaskEntity firstAttempt = service.claim(workerContext, task.getId(), 1000, "manual").task();

        // 租约被回收后另一个实例重新 claim
        world.taskRepository.mutate(task.getId(), stored -> stored.setStatus(TaskStatusEnum.PENDING));
        world.taskRepository.claimWithAdmission(workerContext, task.getId(), "instance-b", 1000);

        service.launch(firstAttempt);

        Assertions.assertTrue(TenantWorld.await(() -> service.inFlightCount() == 0, WAIT));
        AgentTaskEntity current = world.taskRepository.peek(task.getId());
        Assertions.assertEquals(TaskStatusEnum.RUNNING, current.getStatus());
        Assertions.assertEquals("instance-b", current.getClaimOwner());
        Assertions.assertEquals(2, current.getExecutionAttempt());
        Assertions.assertNull(current.getOutputData());
    }

    @Test
    public void shouldFailTaskWhenWorkerPoolRejects() throws Exception {
        ThreadPoolExecutor saturated = new ThreadPoolExecutor(1, 1, 60, TimeUnit.SECONDS, new SynchronousQueue<>());
        CountDownLatch release = new CountDownLatch(1);
        try {
            saturated.submit(() -> {
                release.await();
                return null;
            });
            Assertions.assertTrue(TenantWorld.await(() -> saturated.getActiveCount() == 1, WAIT));
            TaskExecutionApplicationService service = world.executionService(
                    TenantWorld.unreachableGateway(), saturated, scheduler, "instance-a");
            AgentTaskEntity task = world.createTextTask(agent, "echo", "x", 0, 30);
            Assertions.assertEquals(0, service.availableSlots());

            service.launch(service.claim(workerContext, task.getId(), 1000, "manual").task());

            AgentTaskEntity failed = world.taskRepository.peek(task.getId());
            Assertions.assertEquals(TaskStatusEnum.FAILED, failed.getStatus());
            Assertions.assertTrue(failed.getLastError().contains("Worker pool saturated"));
            Assertions.assertEquals(0, service.inFlightCount());
        } finally {
            release.countDown();
            saturated.shutdownNow();
        }
    }

    @Test
    public void shouldDeferClaimsBeyondHourlyQuota() {
        TaskExecutionApplicationService service = world.executionService(
                TenantWorld.unreachableGateway(), worker, scheduler, "instance-a");
        AgentTaskEntity first = world.createTextTask(agent, "echo", "1", 3, 30);
        AgentTaskEntity second = world.createTextTask(agent, "echo", "2", 3, 30);

        Assertions.assertEquals(ClaimStatus.CLAIMED, service.claim(workerContext, first.getId(), 1, "scheduler").status());
        TaskClaimResult blocked = service.claim(workerContext, second.getId(), 1, "scheduler");

        Assertions.assertEquals(ClaimStatus.QUOTA_EXCEEDED, blocked.status());
        Assertions.assertEquals(TaskStatusEnum.PENDING, statusOf(second));
    }

    private boolean settled(TaskExecutionApplicationService service, AgentTaskEntity task, TaskStatusEnum expected) {
        return statusOf(task) == expected && service.inFlightCount() == 0;
    }

    private TaskStatusEnum statusOf(AgentTaskEntity task) {
        return world.taskRepository.peek(task.getId()).getStatus();
    }
}
