package com.baykanat.cardflow.api.context;

import com.baykanat.cardflow.domain.exception.AuthorizationException;
import com.baykanat.cardflow.domain.model.AccessContext;
import com.baykanat.cardflow.domain.model.Role;
import org.springframework.core.MethodParameter;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;

import java.util.Locale;

/**
 * Gateway'in doğruladığı kimliği header'lardan AccessContext'e çevirir.
 *
 * <p>Burada kimlik doğrulama yapılmaz; header yoksa istek reddedilir. SYSTEM rolü dışarıdan verilemez.
 */
public class AccessContextArgumentResolver implements HandlerMethodArgumentResolver {

    public static final String TENANT_HEADER = "X-Tenant-Id";
    public static final String ACTOR_HEADER = "X-Actor-Id";
    public static final String ROLE_HEADER = "X-Actor-Role";

    @Override
    public boolean supportsParameter(MethodParameter parameter) {
        return AccessContext.class.equals(parameter.getParameterType());
    }

    @Override
    public AccessContext resolveArgument(MethodParameter parameter, ModelAndViewContainer mavContainer,
                                         NativeWebRequest webRequest, WebDataBinderFactory binderFactory) {
        String tenantId = webRequest.getHeader(TENANT_HEADER);
        String actorId = webRequest.getHeader(ACTOR_HEADER);
        if (tenantId == null || tenantId.isBlank() || actorId == null || actorId.isBlank()) {
            throw new AuthorizationException("Missing access context headers " + TENANT_HEADER + "/" + ACTOR_HEADER);
        }
        return new AccessContext(tenantId, actorId, parseRole(webRequest.getHeader(ROLE_HEADER)));
    }

    private Role parseRole(String header) {
        if (header == null || header.isBlank()) {
            return Role.MEMBER;
        }
        String normalized = header.trim().toUpperCase(Locale.ROOT);
        if ("ADMIN".equals(normalized)) {
            return Role.ADMIN;
        }
        if ("MEMBER".equals(normalized)) {
            return Role.MEMBER;
        }
        throw new AuthorizationException("Unsupported role: " + header);
    }
}
