package com.github.dimitryivaniuta.relay.ratelimit;

import java.lang.annotation.*;

/**
 * Admission-controls a handler (or every handler of a controller) per caller and route.
 * Non-positive values fall back to {@code relay.rate-limit.default-limit} / {@code default-window}.
 */
@Target({ElementType.TYPE, ElementType.METHOD})
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface RateLimited {

    int limit() default 0;

    long windowMs() default 0;
}
