package com.agentcores.config;

import com.agentcores.domain.auth.model.valobj.TenantContext;
import com.agentcores.types.common.Constants;
import com.agentcores.types.enums.ResponseCode;
import com.agentcores.types.exception.AppException;
import org.springframework.core.MethodParameter;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.context.request.RequestAttributes;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;

/**
 * 把鉴权过滤器写入请求属性的 {@link TenantContext} 注入到控制器参数。
 * 控制器因此拿不到客户端传入的 tenant_id。
 */
public class TenantContextArgumentResolver implements HandlerMethodArgumentResolver {

    @Override
    public boolean supportsParameter(MethodParameter parameter) {
        return TenantContext.class.equals(parameter.getParameterType());
    }

    @Override
    public Object resolveArgument(MethodParameter parameter,
                                  ModelAndViewContainer mavContainer,
                                  NativeWebRequest webRequest,
                                  WebDataBinderFactory binderFactory) {
        Object context = webRequest.getAttribute(Constants.TENANT_CONTEXT_ATTRIBUTE, RequestAttributes.SCOPE_REQUEST);
        if (context instanceof TenantContext tenantContext) {
            return tenantContext;
        }
        throw new AppException(ResponseCode.AUTHENTICATION_FAILED);
    }
}
