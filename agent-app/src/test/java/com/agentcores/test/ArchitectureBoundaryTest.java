package com.agentcores.test;

import com.agentcores.domain.authorization.service.AuthorizationGuardDomainService;
import com.agentcores.domain.task.service.TaskDispatchDomainService;
import com.agentcores.domain.task.service.TaskLifecycleDomainService;
import com.agentcores.trigger.application.command.TaskExecutionApplicationService;
import com.agentcores.trigger.application.command.TaskLifecycleCommandService;
import com.agentcores.trigger.http.AgentController;
import com.agentcores.trigger.http.AuditLogController;
import com.agentcores.trigger.http.AuthController;
import com.agentcores.trigger.http.TaskController;
import com.agentcores.trigger.http.TenantController;
import com.agentcores.trigger.http.UserController;
import com.agentcores.trigger.job.TaskExecutor;
import com.agentcores.trigger.job.TaskLeaseReaper;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.lang.reflect.Field;
import java.util.Arrays;
import java.util.List;

public class ArchitectureBoundaryTest {

    private static final List<Class<?>> CONTROLLERS = List.of(
            AgentController.class,
            TaskController.class,
            AuthController.class,
            AuditLogController.class,
            TenantController.class,
            UserController.class
    );

    @Test
    public void controllersShouldNotDependOnDomainRepositoryPorts() {
        for (Class<?> controller : CONTROLLERS) {
            for (Field field : controller.getDeclaredFields()) {
                String typeName = field.getType().getName();
                Assertions.assertFalse(
                        typeName.contains(".domain") && typeName.contains(".adapter.repository."),
                        () -> "Controller should not inject repository port directly: " + controller.getSimpleName() + " -> " + typeName
                );
            }
        }
    }

    @Test
    public void applicationServicesShouldDependOnDomainServices() {
        Assertions.assertTrue(hasFieldType(TaskExecutionApplicationService.class, TaskDispatchDomainService.class));
        Assertions.assertTrue(hasFieldType(TaskExecutionApplicationService.class, TaskLifecycleDomainService.class));
        Assertions.assertTrue(hasFieldType(TaskLifecycleCommandService.class, AuthorizationGuardDomainService.class));
        Assertions.assertTrue(hasFieldType(TaskExecutor.class, TaskExecutionApplicationService.class));
        Assertions.assertTrue(hasFieldType(TaskLeaseReaper.class, TaskExecutionApplicationService.class));
    }

    @Test
    public void jobsShouldNotTouchDispatchDirectly() {
        Assertions.assertFalse(hasFieldType(TaskExecutor.class, TaskDispatchDomainService.class));
        Assertions.assertFalse(hasFieldType(TaskLeaseReaper.class, TaskDispatchDomainService.class));
    }

    private boolean hasFieldType(Class<?> owner, Class<?> expectedType) {
        return Arrays.stream(owner.getDeclaredFields())
                .map(Field::getType)
                .anyMatch(type -> type.equals(expectedType));
    }
}
