package com.aerojob.survey.security;

import lombok.RequiredArgsConstructor;
import org.springframework.core.MethodParameter;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;

import javax.servlet.http.HttpServletRequest;

@RequiredArgsConstructor
public class CallerArgumentResolver implements HandlerMethodArgumentResolver {

    private final PrincipalResolver principalResolver;

    @Override
    public boolean supportsParameter(MethodParameter parameter) {
        return parameter.hasParameterAnnotation(CurrentCaller.class)
                && Caller.class.isAssignableFrom(parameter.getParameterType());
    }

    @Override
    public Object resolveArgument(MethodParameter parameter, ModelAndViewContainer mavContainer,
                                  NativeWebRequest webRequest, WebDataBinderFactory binderFactory) {
        HttpServletRequest request = webRequest.getNativeRequest(HttpServletRequest.class);
        Caller caller = request == null
                ? Caller.anonymous()
                : principalResolver.resolve(request).orElse(Caller.anonymous());

        CurrentCaller annotation = parameter.getParameterAnnotation(CurrentCaller.class);
        if (annotation != null && annotation.required()) {
            caller.requireAuthenticated();
        }
        return caller;
    }
}
