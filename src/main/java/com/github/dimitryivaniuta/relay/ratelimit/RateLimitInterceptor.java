package com.github.dimitryivaniuta.relay.ratelimit;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.core.annotation.AnnotatedElementUtils;
import org.springframework.stereotype.Component;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.HandlerInterceptor;
import org.springframework.web.servlet.HandlerMapping;

import java.time.Duration;

import static com.github.dimitryivaniuta.relay.web.RequestContextKeys.*;

/**
 * Gates {@link RateLimited} handlers. Key is {@code <subject>:<METHOD> <route pattern>}; every gated
 * response carries the X-RateLimit-* headers, rejections raise {@link RateLimitExceededException}.
 */
@Slf4j
@Component
public class RateLimitInterceptor implements HandlerInterceptor {

    // one rate_limit.exceeded webhook per tenant+route per minute
    private static final Duration NOTIFY_COOLDOWN = Duration.ofMinutes(1);

    private final RateLimiterService limiter;
    private final RateLimitKeyResolver keyResolver;
    private final RateLimitProperties properties;
    private final ApplicationEventPublisher events;

    private final Cache<String, Boolean> recentlyNotified = Caffeine.newBuilder()
            .expireAfterWrite(NOTIFY_COOLDOWN)
            .maximumSize(10_000)
            .build();

    public RateLimitInterceptor(RateLimiterService limiter,
                                RateLimitKeyResolver keyResolver,
                                RateLimitProperties properties,
                                ApplicationEventPublisher events) {
        this.limiter = limiter;
        this.keyResolver = keyResolver;
        this.properties = properties;
        this.events = events;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        if (!(handler instanceof HandlerMethod hm)) return true;
        RateLimited cfg = find(hm);
        if (cfg == null) return true;

        int limit = cfg.limit() > 0 ? cfg.limit() : properties.getDefaultLimit();
        long windowMs = cfg.windowMs() > 0 ? cfg.windowMs() : properties.getDefaultWindow().toMillis();

        RateLimitKeyResolver.ResolvedSubject subject = keyResolver.resolve(request);
        String route = request.getMethod() + " " + routeOf(request);
        String key = subject.subjectKey() + ":" + route;

        RateLimitResult result = limiter.checkRateLimit(key, limit, windowMs);

        response.setHeader(RATE_LIMIT_LIMIT_HEADER, Integer.toString(limit));
        response.setHeader(RATE_LIMIT_REMAINING_HEADER, Long.toString(result.remaining()));
        response.setHeader(RATE_LIMIT_RESET_HEADER, result.resetTime().toString());

        if (result.allowed()) return true;

        long retryAfter = result.retryAfter() == null ? 1 : result.retryAfter();
        log.warn("Rate limit exceeded: subject={}, route={}, limit={}, windowMs={}",
                subject.subjectKey(), route, limit, windowMs);

        if (subject.tenantId() != null && recentlyNotified.asMap().putIfAbsent(key, Boolean.TRUE) == null) {
            events.publishEvent(new RateLimitRejectedEvent(
                    subject.tenantId(), route, limit, windowMs, retryAfter, result.resetTime()));
        }

        throw new RateLimitExceededException(
                "Rate limit exceeded. Try again in " + retryAfter + " seconds.", retryAfter, result.resetTime());
    }

    private static String routeOf(HttpServletRequest request) {
        Object pattern = request.getAttribute(HandlerMapping.BEST_MATCHING_PATTERN_ATTRIBUTE);
        return pattern != null ? pattern.toString() : request.getRequestURI();
    }

    private static RateLimited find(HandlerMethod hm) {
        RateLimited onMethod = AnnotatedElementUtils.findMergedAnnotation(hm.getMethod(), RateLimited.class);
        return onMethod != null ? onMethod : AnnotatedElementUtils.findMergedAnnotation(hm.getBeanType(), RateLimited.class);
    }
}
