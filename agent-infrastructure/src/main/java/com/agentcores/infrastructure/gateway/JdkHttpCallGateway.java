package com.agentcores.infrastructure.gateway;

import com.agentcores.domain.task.adapter.gateway.IHttpCallGateway;
import com.agentcores.domain.task.model.valobj.ApiCallInput;
import com.agentcores.domain.task.model.valobj.HttpCallResult;
import com.agentcores.infrastructure.util.JsonCodec;
import com.agentcores.types.enums.ResponseCode;
import com.agentcores.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;

/**
 * 基于 JDK HttpClient 的出站调用网关。
 * <p>
 * 请求体为 Map/List 时以 JSON 发送并补齐 Content-Type；响应体超过上限时截断。
 * </p>
 *
 * @author agentcores
 * @since 2026-03-05
 */
@Slf4j
@Component
public class JdkHttpCallGateway implements IHttpCallGateway {

    private final HttpClient httpClient;
    private final JsonCodec jsonCodec;
    private final int maxResponseChars;

    public JdkHttpCallGateway(JsonCodec jsonCodec,
                              @Value("${executor.api-call.connect-timeout-ms:5000}") long connectTimeoutMs,
                              @Value("${executor.api-call.max-response-chars:4000}") int maxResponseChars) {
        this.jsonCodec = jsonCodec;
        this.maxResponseChars = maxResponseChars;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(connectTimeoutMs))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    @Override
    public HttpCallResult call(ApiCallInput input, Duration timeout) {
        HttpRequest request;
        try {
            request = buildRequest(input, timeout);
        } catch (IllegalArgumentException ex) {
            throw new AppException(ResponseCode.EXECUTION_ERROR.getCode(),
                    "Invalid request: " + ex.getMessage(), ex);
        }
        long startedAt = System.currentTimeMillis();
        try {
            HttpResponse<String> response = httpClient.send(request,
                    HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            String body = StringUtils.defaultString(response.body());
            boolean truncated = body.length() > maxResponseChars;
            String kept = truncated ? body.substring(0, maxResponseChars) : body;
            log.info("API_CALL_DONE method={}, url={}, status={}, costMs={}, truncated={}",
                    input.method(), input.url(), response.statusCode(),
                    System.currentTimeMillis() - startedAt, truncated);
            return new HttpCallResult(response.statusCode(), kept,
                    truncated ? null : jsonCodec.readLenient(kept), truncated);
        } catch (HttpTimeoutException ex) {
            log.warn("API_CALL_TIMEOUT method={}, url={}, timeoutMs={}", input.method(), input.url(), timeout.toMillis());
            throw new AppException(ResponseCode.TIMEOUT, "Upstream call timed out after " + timeout.toSeconds() + "s");
        } catch (IOException ex) {
            log.warn("API_CALL_FAILED method={}, url={}, error={}", input.method(), input.url(), ex.getMessage());
            throw new AppException(ResponseCode.EXECUTION_ERROR.getCode(),
                    "Upstream call failed: " + ex.getClass().getSimpleName(), ex);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new AppException(ResponseCode.EXECUTION_ERROR.getCode(), "Upstream call interrupted", ex);
        }
    }

    private HttpRequest buildRequest(ApiCallInput input, Duration timeout) {
        HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create(input.url()))
                .timeout(timeout);
        boolean hasContentType = false;
        if (input.headers() != null) {
            for (Map.Entry<String, String> header : input.headers().entrySet()) {
                builder.header(header.getKey(), header.getValue());
                hasContentType |= "content-type".equalsIgnoreCase(header.getKey());
            }
        }
        Object body = input.body();
        if (body == null) {
            return builder.method(input.method(), HttpRequest.BodyPublishers.noBody()).build();
        }
        String payload;
        if (body instanceof String text) {
            payload = text;
        } else {
            payload = jsonCodec.writeValue(body);
            if (!hasContentType) {
                builder.header("Content-Type", "application/json");
            }
        }
        return builder.method(input.method(), HttpRequest.BodyPublishers.ofString(payload, StandardCharsets.UTF_8)).build();
    }
}
