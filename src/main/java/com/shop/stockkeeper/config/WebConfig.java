package com.shop.stockkeeper.config;

import com.shop.stockkeeper.security.SessionContextArgumentResolver;
import com.shop.stockkeeper.security.ShopSelectionInterceptor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.util.List;

@Configuration
public class WebConfig implements WebMvcConfigurer {

    private final SessionContextArgumentResolver sessionContextArgumentResolver;
    private final ShopSelectionInterceptor shopSelectionInterceptor;

    public WebConfig(SessionContextArgumentResolver sessionContextArgumentResolver,
            ShopSelectionInterceptor shopSelectionInterceptor) {
        this.sessionContextArgumentResolver = sessionContextArgumentResolver;
        this.shopSelectionInterceptor = shopSelectionInterceptor;
    }

    @Override
    public void addArgumentResolvers(List<HandlerMethodArgumentResolver> resolvers) {
        resolvers.add(sessionContextArgumentResolver);
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        // Shop-scoped endpoints only; shop listing and selection must stay reachable.
        registry.addInterceptor(shopSelectionInterceptor)
                .addPathPatterns("/api/items/**", "/api/sales/**");
    }
}
