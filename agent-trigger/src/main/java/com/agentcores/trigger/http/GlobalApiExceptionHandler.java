package com.agentcores.trigger.http;

import com.agentcores.api.response.Response;
import com.agentcores.types.enums.ResponseCode;
import com.agentcores.types.exception.AppException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.BindException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * 统一 API 异常处理。
 * <p>
 * 响应码先经过 {@link ResponseCode#exposed()} 收敛：认证类失败统一为 AUTHENTICATION_FAILED，
 * 跨租户访问统一为 RESOURCE_NOT_FOUND，且这两类只返回默认描述，调用方无法区分具体原因。
 * 日志中保留原始响应码。
 * </p>
 */
@Slf4j
@RestControllerAdvice
public class GlobalApiExceptionHandler {

    private static final int MAX_MESSAGE_LENGTH = 300;

    @ExceptionHandler(AppException.class)
    public ResponseEntity<Response<Object>> handleAppException(AppException ex, HttpServletRequest request) {
        ResponseCode original = ex.responseCode();
        ResponseCode exposed = original.exposed();
        String info = StringUtils.defaultIfBlank(ex.getInfo(), original.getInfo());
        if (exposed == ResponseCode.AUTHENTICATION_FAILED || exposed == ResponseCode.RESOURCE_NOT_FOUND) {
            info = exposed.getInfo();
        }
        if (exposed.getHttpStatus() >= 500) {
            log.error("HTTP_ERROR path={}, method={}, traceId={}, requestId={}, errorType={}, errorCode={}, errorMessage={}",
                    resolvePath(request),
                    resolveMethod(request),
                    resolveTraceId(),
                    resolveRequestId(),
                    ex.getClass().getSimpleName(),
                    original.getCode(),
                    truncate(ex.getInfo(), MAX_MESSAGE_LENGTH),
                    ex);
        } else {
            log.warn("HTTP_ERROR path={}, method={}, traceId={}, requestId={}, errorType={}, errorCode={}, errorMessage={}",
                    resolvePath(request),
                    resolveMethod(request),
                    resolveTraceId(),
                    resolveRequestId(),
                    ex.getClass().getSimpleName(),
                    original.getCode(),
                    truncate(ex.getInfo(), MAX_MESSAGE_LENGTH));
        }
        return build(exposed, truncate(info, MAX_MESSAGE_LENGTH));
    }

    @ExceptionHandler({
            MethodArgumentNotValidException.class,
            BindException.class,
            MethodArgumentTypeMismatchException.class,
            MissingServletRequestParameterException.class,
            HttpMessageNotReadableException.class,
            IllegalArgumentException.class
    })
    public ResponseEntity<Response<Object>> handleBadRequestException(Exception ex, HttpServletRequest request) {
        String info = StringUtils.defaultIfBlank(ex.getMessage(), ResponseCode.ILLEGAL_PARAMETER.getInfo());
        if (ex instanceof HttpMessageNotReadableException) {
            // 反序列化细节里可能带有请求体片段
            info = "Malformed request body";
        }
        log.warn("HTTP_ERROR path={}, method={}, traceId={}, requestId={}, errorType={}, errorCode={}, errorMessage={}",
                resolvePath(request),
                resolveMethod(request),
                resolveTraceId(),
                resolveRequestId(),
                ex.getClass().getSimpleName(),
                ResponseCode.ILLEGAL_PARAMETER.getCode(),
                truncate(info, MAX_MESSAGE_LENGTH));
        return build(ResponseCode.ILLEGAL_PARAMETER, truncate(info, MAX_MESSAGE_LENGTH));
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<Response<Object>> handleMethodNotSupported(HttpRequestMethodNotSupportedException ex,
                                                                    HttpServletRequest request) {
        log.warn("HTTP_ERROR path={}, method={}, traceId={}, requestId={}, errorType={}, errorCode={}, errorMessage={}",
                resolvePath(request),
                resolveMethod(request),
                resolveTraceId(),
                resolveRequestId(),
                ex.getClass().getSimpleName(),
                ResponseCode.UNSUPPORTED_OPERATION.getCode(),
                ex.getMessage());
        Response<Object> body = Response.<Object>builder()
                .code(ResponseCode.UNSUPPORTED_OPERATION.getCode())
                .info(ex.getMessage())
                .build();
        return ResponseEntity.status(HttpStatus.METHOD_NOT_ALLOWED).body(body);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Response<Object>> handleUnknownException(Exception ex, HttpServletRequest request) {
        log.error("HTTP_ERROR path={}, method={}, traceId={}, requestId={}, errorType={}, errorCode={}, errorMessage={}",
                resolvePath(request),
                resolveMethod(request),
                resolveTraceId(),
                resolveRequestId(),
                ex.getClass().getSimpleName(),
                ResponseCode.UN_ERROR.getCode(),
                truncate(ex.getMessage(), MAX_MESSAGE_LENGTH),
                ex);
        return build(ResponseCode.UN_ERROR, ResponseCode.UN_ERROR.getInfo());
    }

    private ResponseEntity<Response<Object>> build(ResponseCode code, String info) {
        Response<Object> body = Response.<Object>builder()
                .code(code.getCode())
                .info(info)
                .build();
        return ResponseEntity.status(code.getHttpStatus()).body(body);
    }

    private String resolvePath(HttpServletRequest request) {
        return request == null ? "-" : StringUtils.defaultIfBlank(request.getRequestURI(), "-");
    }

    private String resolveMethod(HttpServletRequest request) {
        return request == null ? "-" : StringUtils.defaultIfBlank(request.getMethod(), "-");
    }

    private String resolveTraceId() {
        return StringUtils.defaultIfBlank(MDC.get("traceId"), "-");
    }

    private String resolveRequestId() {
        return StringUtils.defaultIfBlank(MDC.get("requestId"), "-");
    }

    private String truncate(String text, int maxLength) {
        if (StringUtils.isBlank(text) || maxLength <= 0 || text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength);
    }
}
