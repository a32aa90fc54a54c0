package com.facility.snapshot.security;

import com.facility.common.auth.AuthScheme;
import com.facility.common.auth.Authenticator;
import com.facility.common.auth.Credentials;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.AnnotatedElementUtils;
import org.springframework.stereotype.Component;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.HandlerInterceptor;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;

/**
 * Enforces {@link RequiresAuth} before the handler runs. Rejections surface as
 * {@link com.facility.common.auth.AuthenticationException} and are rendered as 401.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AuthenticationInterceptor implements HandlerInterceptor {

    private final Authenticator authenticator;

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        if (!(handler instanceof HandlerMethod method)) {
            return true;
        }
        RequiresAuth requirement = AnnotatedElementUtils.findMergedAnnotation(method.getMethod(), RequiresAuth.class);
        if (requirement == null) {
            requirement = AnnotatedElementUtils.findMergedAnnotation(method.getBeanType(), RequiresAuth.class);
        }
        if (requirement == null) {
            return true;
        }

        Set<AuthScheme> allowed = EnumSet.noneOf(AuthScheme.class);
        allowed.addAll(Arrays.asList(requirement.value()));

        Credentials credentials = Credentials.of(
                request.getHeader(Credentials.AUTHORIZATION_HEADER),
                request.getHeader(Credentials.API_KEY_HEADER));

        log.debug("Authenticating {} {} with {} against {}", request.getMethod(), request.getRequestURI(),
                credentials, allowed);
        authenticator.authenticate(credentials, allowed);
        return true;
    }
}
