package com.lumen.gateway.infrastructure.web;

import com.lumen.gateway.context.PrincipalResolver;
import com.lumen.gateway.context.RequestContext;
import com.lumen.observability.CorrelationContextHolder;
import org.springframework.core.MethodParameter;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;

/**
 * Supplies a {@link RequestContext} to any controller parameter of that type and tags the
 * request's correlation context with the caller.
 */
@Component
public class RequestContextArgumentResolver implements HandlerMethodArgumentResolver {

    private final PrincipalResolver principalResolver;

    public RequestContextArgumentResolver(PrincipalResolver principalResolver) {
        this.principalResolver = principalResolver;
    }

    @Override
    public boolean supportsParameter(MethodParameter parameter) {
        return RequestContext.class.equals(parameter.getParameterType());
    }

    @Override
    public RequestContext resolveArgument(
            MethodParameter parameter,
            ModelAndViewContainer mavContainer,
            NativeWebRequest webRequest,
            WebDataBinderFactory binderFactory) {
        RequestContext ctx = principalResolver.resolve(webRequest.getHeader(HttpHeaders.AUTHORIZATION));
        ctx.principal().ifPresent(principal -> CorrelationContextHolder.get()
                .ifPresent(correlation -> CorrelationContextHolder.set(correlation.withUser(principal.subject()))));
        return ctx;
    }
}
