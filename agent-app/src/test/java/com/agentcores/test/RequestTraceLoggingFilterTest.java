package com.agentcores.test;

import com.agentcores.api.response.Response;
import com.agentcores.config.ObservabilityHttpLogProperties;
import com.agentcores.config.RequestTraceLoggingFilter;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.hamcrest.Matchers;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

public class RequestTraceLoggingFilterTest {

    private MockMvc mockMvc;
    private RequestTraceLoggingFilter filter;

    @BeforeEach
    public void setUp() {
        ObservabilityHttpLogProperties properties = new ObservabilityHttpLogProperties();
        properties.setEnabled(true);
        properties.setSampleRate(1.0D);

        this.filter = new RequestTraceLoggingFilter(new ObjectMapper(), properties);
        this.mockMvc = MockMvcBuilders.standaloneSetup(new TestController())
                .addFilters(filter)
                .build();
    }

    @Test
    public void shouldInjectTraceHeadersForApiRequests() throws Exception {
        mockMvc.perform(post("/api/test/echo")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"password\":\"Secret123\"}"))
                .andExpect(status().isOk())
                .andExpect(header().exists("X-Trace-Id"))
                .andExpect(header().exists("X-Request-Id"))
                .andExpect(jsonPath("$.code").value("0000"));
    }

    @Test
    public void shouldEchoCallerSuppliedTraceId() throws Exception {
        mockMvc.perform(get("/api/test/ping")
                        .header("X-Trace-Id", "trace-abc")
                        .header("X-Request-Id", "req-1"))
                .andExpect(status().isOk())
                .andExpect(header().string("X-Trace-Id", "trace-abc"))
                .andExpect(header().string("X-Request-Id", "req-1"));

        mockMvc.perform(get("/api/test/ping")
                        .header("X-Trace-Id", "x".repeat(65)))
                .andExpect(status().isOk())
                .andExpect(header().string("X-Trace-Id", Matchers.matchesPattern("[0-9a-f]{32}")));
    }

    @Test
    public void shouldSkipExcludedActuatorPath() throws Exception {
        mockMvc.perform(get("/actuator/health"))
                .andExpect(status().isOk())
                .andExpect(header().doesNotExist("X-Trace-Id"))
                .andExpect(header().doesNotExist("X-Request-Id"));
    }

    @Test
    public void shouldMaskSecretsInQueryString() {
        Assertions.assertEquals("-", filter.sanitizeQuery(null));
        Assertions.assertEquals("status=pending&access_token=***&limit=10",
                filter.sanitizeQuery("status=pending&access_token=abc.def.ghi&limit=10"));
        Assertions.assertEquals("refresh_token=***&flag=", filter.sanitizeQuery("refresh_token=xyz&flag"));
        Assertions.assertEquals("q=" + "a".repeat(80), filter.sanitizeQuery("q=" + "a".repeat(200)));
    }

    @RestController
    private static class TestController {

        @PostMapping("/api/test/echo")
        public Response<Integer> echo(@RequestBody(required = false) Map<String, Object> request) {
            return Response.<Integer>builder()
                    .code("0000")
                    .info("成功")
                    .data(request == null ? 0 : request.size())
                    .build();
        }

        @GetMapping("/api/test/ping")
        public Response<String> ping() {
            return Response.<String>builder()
                    .code("0000")
                    .info("成功")
                    .data("pong")
                    .build();
        }

        @GetMapping("/actuator/health")
        public Response<String> health() {
            return Response.<String>builder()
                    .code("0000")
                    .info("成功")
                    .data("UP")
                    .build();
        }
    }
}
