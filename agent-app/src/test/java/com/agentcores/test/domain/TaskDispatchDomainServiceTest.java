package com.agentcores.test.domain;

import com.agentcores.domain.task.adapter.gateway.IHttpCallGateway;
import com.agentcores.domain.task.model.valobj.DispatchOutcome;
import com.agentcores.domain.task.model.valobj.HttpCallResult;
import com.agentcores.domain.task.service.TaskDispatchDomainService;
import com.agentcores.domain.task.service.TaskInputDomainService;
import com.agentcores.types.enums.ResponseCode;
import com.agentcores.types.enums.TaskTypeEnum;
import com.agentcores.types.exception.AppException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

public class TaskDispatchDomainServiceTest {

    private static final Duration BUDGET = Duration.ofSeconds(5);

    @Test
    public void shouldApplyTextOperations() {
        TaskDispatchDomainService service = newService((input, timeout) -> new HttpCallResult(200, "", null, false));

        Assertions.assertEquals("HELLO WORLD", result(service, "uppercase", "hello world"));
        Assertions.assertEquals("hello", result(service, "LOWERCASE", "HeLLo"));
        Assertions.assertEquals(3, result(service, "word_count", "  one two   three "));
        Assertions.assertEquals(0, result(service, "word_count", "   "));
        Assertions.assertEquals(5, result(service, "char_count", "héllo"));
        Assertions.assertEquals("cba", result(service, "reverse", "abc"));
    }

    @Test
    public void shouldReportUnsupportedTextOperation() {
        TaskDispatchDomainService service = newService((input, timeout) -> new HttpCallResult(200, "", null, false));

        DispatchOutcome outcome = service.dispatch(TaskTypeEnum.TEXT_PROCESSING,
                Map.of("operation", "summarize", "text", "abc"), BUDGET);

        Assertions.assertFalse(outcome.isSuccess());
        Assertions.assertEquals(ResponseCode.UNSUPPORTED_OPERATION, outcome.error().kind());
    }

    @Test
    public void shouldCallUpstreamAndKeepStatusAndBody() {
        AtomicReference<String> calledUrl = new AtomicReference<>();
        TaskDispatchDomainService service = newService((input, timeout) -> {
            calledUrl.set(input.method() + " " + input.url());
            return new HttpCallResult(200, "{\"ok\":true}", Map.of("ok", true), false);
        });

        DispatchOutcome outcome = service.dispatch(TaskTypeEnum.API_CALL,
                Map.of("url", "https://example.com/hook", "method", "post", "data", Map.of("a", 1)), BUDGET);

        Assertions.assertTrue(outcome.isSuccess());
        Assertions.assertEquals("POST https://example.com/hook", calledUrl.get());
        Assertions.assertEquals(200, outcome.output().get("status_code"));
        Assertions.assertEquals(Map.of("ok", true), outcome.output().get("body"));
    }

    @Test
    public void shouldMapUpstreamErrorStatusToExecutionError() {
        TaskDispatchDomainService service = newService((input, timeout) -> new HttpCallResult(503, "down", null, false));

        DispatchOutcome outcome = service.dispatch(TaskTypeEnum.API_CALL, Map.of("url", "http://example.com"), BUDGET);

        Assertions.assertEquals(ResponseCode.EXECUTION_ERROR, outcome.error().kind());
        Assertions.assertEquals(503, outcome.error().upstreamStatus());
        Map<?, ?> error = (Map<?, ?>) outcome.error().toOutput().get("error");
        Assertions.assertEquals(503, error.get("upstream_status"));
    }

    @Test
    public void shouldMapGatewayTimeout() {
        TaskDispatchDomainService service = newService((input, timeout) -> {
            throw new AppException(ResponseCode.TIMEOUT, "read timed out");
        });

        DispatchOutcome outcome = service.dispatch(TaskTypeEnum.API_CALL, Map.of("url", "http://example.com"), BUDGET);

        Assertions.assertEquals(ResponseCode.TIMEOUT, outcome.error().kind());
    }

    @Test
    public void shouldRunWorkflowStepsInOrder() {
        TaskDispatchDomainService service = newService((input, timeout) -> new HttpCallResult(204, "", null, false));

        DispatchOutcome outcome = service.dispatch(TaskTypeEnum.WORKFLOW, Map.of("steps", List.of(
                step("log", Map.of("message", "starting")),
                step("delay", Map.of("seconds", 0.01)),
                step("text_processing", Map.of("operation", "uppercase", "text", "done")),
                step("api_call", Map.of("url", "https://example.com/notify"))
        )), BUDGET);

        Assertions.assertTrue(outcome.isSuccess());
        Assertions.assertEquals(4, outcome.output().get("steps_completed"));
        List<?> results = (List<?>) outcome.output().get("results");
        Map<?, ?> third = (Map<?, ?>) results.get(2);
        Assertions.assertEquals("text_processing", third.get("type"));
        Assertions.assertEquals("DONE", ((Map<?, ?>) third.get("output")).get("result"));
    }

    @Test
    public void shouldShortCircuitWorkflowAndKeepPartialResults() {
        TaskDispatchDomainService service = newService((input, timeout) -> new HttpCallResult(200, "", null, false));

        DispatchOutcome outcome = service.dispatch(TaskTypeEnum.WORKFLOW, Map.of("steps", List.of(
                step("log", Map.of("message", "one")),
                step("text_processing", Map.of("operation", "uppercase", "text", "two")),
                step("text_processing", Map.of("operation", "translate", "text", "three")),
                step("log", Map.of("message", "never"))
        )), BUDGET);

        Assertions.assertFalse(outcome.isSuccess());
        Assertions.assertEquals(ResponseCode.UNSUPPORTED_OPERATION, outcome.error().kind());
        Assertions.assertEquals(2, outcome.error().partialResults().size());
        Assertions.assertTrue(outcome.error().toOutput().containsKey("partial_results"));
    }

    @Test
    public void shouldStopWorkflowWhenExecutionThreadIsInterrupted() {
        AtomicInteger calls = new AtomicInteger();
        TaskDispatchDomainService service = newService((input, timeout) -> {
            calls.incrementAndGet();
            return new HttpCallResult(200, "", null, false);
        });

        Thread.currentThread().interrupt();
        DispatchOutcome outcome;
        try {
            outcome = service.dispatch(TaskTypeEnum.WORKFLOW, Map.of("steps", List.of(
                    step("log", Map.of("message", "one")),
                    step("api_call", Map.of("url", "https://example.com/notify", "method", "POST"))
            )), BUDGET);
        } finally {
            Thread.interrupted();
        }

        Assertions.assertFalse(outcome.isSuccess());
        Assertions.assertEquals(ResponseCode.EXECUTION_ERROR, outcome.error().kind());
        Assertions.assertTrue(outcome.error().message().contains("interrupted"));
        Assertions.assertEquals(0, outcome.error().partialResults().size());
        Assertions.assertEquals(0, calls.get());
    }

    @Test
    public void shouldTimeOutDelayBeyondBudget() {
        TaskDispatchDomainService service = newService((input, timeout) -> new HttpCallResult(200, "", null, false));

        long startedAt = System.nanoTime();
        DispatchOutcome outcome = service.dispatch(TaskTypeEnum.WORKFLOW,
                Map.of("steps", List.of(step("delay", Map.of("seconds", 30)))), Duration.ofMillis(100));
        long elapsedMs = (System.nanoTime() - startedAt) / 1_000_000L;

        Assertions.assertEquals(ResponseCode.TIMEOUT, outcome.error().kind());
        Assertions.assertTrue(elapsedMs < 5_000, "delay must stop at the task budget");
    }

    @Test
    public void shouldReportInvalidStoredInputAsExecutionError() {
        TaskDispatchDomainService service = newService((input, timeout) -> new HttpCallResult(200, "", null, false));

        DispatchOutcome outcome = service.dispatch(TaskTypeEnum.API_CALL, Map.of(), BUDGET);

        Assertions.assertEquals(ResponseCode.EXECUTION_ERROR, outcome.error().kind());
    }

    private Object result(TaskDispatchDomainService service, String operation, String text) {
        DispatchOutcome outcome = service.dispatch(TaskTypeEnum.TEXT_PROCESSING,
                Map.of("operation", operation, "text", text), BUDGET);
        Assertions.assertTrue(outcome.isSuccess(), () -> String.valueOf(outcome.error()));
        return outcome.output().get("result");
    }

    private Map<String, Object> step(String type, Map<String, Object> params) {
        Map<String, Object> step = new LinkedHashMap<>();
        step.put("type", type);
        step.put("params", params);
        return step;
    }

    private TaskDispatchDomainService newService(IHttpCallGateway gateway) {
        return new TaskDispatchDomainService(new TaskInputDomainService(), gateway);
    }
}
