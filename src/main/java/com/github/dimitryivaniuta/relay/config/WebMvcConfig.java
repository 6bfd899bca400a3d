package com.github.dimitryivaniuta.relay.config;

import com.github.dimitryivaniuta.relay.ratelimit.RateLimitInterceptor;
import com.github.dimitryivaniuta.relay.tenant.ApiKeyAuthInterceptor;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Tenant authentication runs first so the rate limiter can key on the tenant.
 */
@Configuration
@RequiredArgsConstructor
public class WebMvcConfig implements WebMvcConfigurer {

    private final ApiKeyAuthInterceptor apiKeyAuth;
    private final RateLimitInterceptor rateLimit;

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(apiKeyAuth).addPathPatterns("/api/webhooks/**", "/api/webhooks");
        registry.addInterceptor(rateLimit).addPathPatterns("/api/**");
    }
}
