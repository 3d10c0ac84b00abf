package com.agentcores.config;

import com.agentcores.api.response.Response;
import com.agentcores.domain.auth.model.valobj.TenantContext;
import com.agentcores.trigger.application.command.AuthSessionCommandService;
import com.agentcores.types.common.Constants;
import com.agentcores.types.enums.ResponseCode;
import com.agentcores.types.exception.AppException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.AntPathMatcher;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * `/api/**` 统一鉴权过滤器（白名单接口除外）。
 * <p>
 * 校验 Bearer 访问令牌并把 {@link TenantContext} 写入请求属性。任何认证失败都以同一个
 * 401 AUTHENTICATION_FAILED 响应返回，具体原因只记录在 debug 日志中。
 * </p>
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 20)
public class ApiAuthFilter extends OncePerRequestFilter {

    private static final String API_PREFIX = "/api/";
    private static final String MDC_TENANT_ID = "tenantId";
    private static final List<String> WHITELIST_PATTERNS = List.of(
            "/api/auth/login",
            "/api/auth/refresh",
            "/api/auth/register"
    );

    private final ObjectMapper objectMapper;
    private final AuthSessionCommandService authSessionCommandService;
    private final AntPathMatcher antPathMatcher;

    public ApiAuthFilter(ObjectMapper objectMapper,
                         AuthSessionCommandService authSessionCommandService) {
        this.objectMapper = objectMapper;
        this.authSessionCommandService = authSessionCommandService;
        this.antPathMatcher = new AntPathMatcher();
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        if (request == null) {
            return true;
        }
        if ("OPTIONS".equalsIgnoreCase(request.getMethod())) {
            return true;
        }
        String path = normalizePath(request.getRequestURI());
        if (!path.startsWith(API_PREFIX)) {
            return true;
        }
        for (String pattern : WHITELIST_PATTERNS) {
            if (antPathMatcher.match(pattern, path)) {
                return true;
            }
        }
        return false;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        String path = normalizePath(request.getRequestURI());
        TenantContext context;
        try {
            String token = AuthSessionCommandService.parseBearer(request.getHeader(HttpHeaders.AUTHORIZATION));
            context = authSessionCommandService.resolveAccessToken(token);
        } catch (AppException ex) {
            if (log.isDebugEnabled()) {
                log.debug("AUTH_REJECTED method={}, path={}, reasonCode={}, reason={}",
                        request.getMethod(), path, ex.getCode(), ex.getInfo());
            }
            writeUnauthorized(response);
            return;
        }
        request.setAttribute(Constants.TENANT_CONTEXT_ATTRIBUTE, context);
        MDC.put(MDC_TENANT_ID, String.valueOf(context.tenantId()));
        try {
            filterChain.doFilter(request, response);
        } finally {
            MDC.remove(MDC_TENANT_ID);
        }
    }

    private void writeUnauthorized(HttpServletResponse response) throws IOException {
        Response<Void> body = Response.<Void>builder()
                .code(ResponseCode.AUTHENTICATION_FAILED.getCode())
                .info(ResponseCode.AUTHENTICATION_FAILED.getInfo())
                .build();
        response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.getWriter().write(objectMapper.writeValueAsString(body));
        response.getWriter().flush();
    }

    private String normalizePath(String path) {
        if (StringUtils.isBlank(path)) {
            return "/";
        }
        return path.trim();
    }
}
