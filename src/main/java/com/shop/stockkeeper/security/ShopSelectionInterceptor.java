package com.shop.stockkeeper.security;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Sends callers without a selected shop to the shop-selection flow instead of
 * letting shop-scoped endpoints run shop-less.
 */
@Component
public class ShopSelectionInterceptor implements HandlerInterceptor {

    public static final String SHOP_SELECTION_PATH = "/api/shops";

    private static final Logger logger = LoggerFactory.getLogger(ShopSelectionInterceptor.class);

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        if (SessionContextArgumentResolver.selectedShop(request.getSession(false)) != null) {
            return true;
        }

        logger.debug("No shop selected for {} {}, redirecting to {}", request.getMethod(), request.getRequestURI(),
                SHOP_SELECTION_PATH);
        response.setStatus(HttpServletResponse.SC_SEE_OTHER);
        response.setHeader(HttpHeaders.LOCATION, SHOP_SELECTION_PATH);
        return false;
    }
}
