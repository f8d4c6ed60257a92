package com.shop.stockkeeper.security;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpSession;
import org.springframework.core.MethodParameter;
import org.springframework.security.authentication.AuthenticationCredentialsNotFoundException;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;

/**
 * Lets controller methods declare a {@link SessionContext} parameter.
 */
@Component
public class SessionContextArgumentResolver implements HandlerMethodArgumentResolver {

    public static final String SHOP_ATTRIBUTE = "shop_id";

    @Override
    public boolean supportsParameter(MethodParameter parameter) {
        return SessionContext.class.equals(parameter.getParameterType());
    }

    @Override
    public Object resolveArgument(MethodParameter parameter, ModelAndViewContainer mavContainer,
            NativeWebRequest webRequest, WebDataBinderFactory binderFactory) {
        Authentication auth = SecurityContextHolder.getContext().getAuthentication();
        if (auth == null || !(auth.getPrincipal() instanceof ShopUserPrincipal principal)) {
            throw new AuthenticationCredentialsNotFoundException("No authenticated session");
        }

        HttpServletRequest request = webRequest.getNativeRequest(HttpServletRequest.class);
        HttpSession session = request == null ? null : request.getSession(false);
        return new SessionContext(principal.userId(), selectedShop(session));
    }

    static Long selectedShop(HttpSession session) {
        if (session == null) {
            return null;
        }
        Object value = session.getAttribute(SHOP_ATTRIBUTE);
        return value instanceof Long shopId ? shopId : null;
    }
}
