package com.github.dimitryivaniuta.relay.ratelimit;

import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/admin/rate-limits")
public class RateLimitAdminController {

    private final RateLimiterService limiter;

    @GetMapping("/status")
    public RateLimiterStatus serviceStatus() {
        return limiter.getServiceStatus();
    }

    @GetMapping("/{key}")
    public RateLimitStatus keyStatus(@PathVariable String key) {
        return limiter.getStatus(key);
    }

    @DeleteMapping("/{key}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void reset(@PathVariable String key) {
        limiter.reset(key);
    }

    @DeleteMapping
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void clearAll() {
        limiter.clearAll();
    }
}
