package com.github.dimitryivaniuta.relay.webhook.api;

import com.github.dimitryivaniuta.relay.ratelimit.RateLimitKeyResolver;
import com.github.dimitryivaniuta.relay.ratelimit.RateLimitProperties;
import com.github.dimitryivaniuta.relay.ratelimit.RateLimitResult;
import com.github.dimitryivaniuta.relay.ratelimit.RateLimiterService;
import com.github.dimitryivaniuta.relay.signature.SignatureAlgorithm;
import com.github.dimitryivaniuta.relay.signature.SignatureVerification;
import com.github.dimitryivaniuta.relay.signature.WebhookSignatureService;
import com.github.dimitryivaniuta.relay.tenant.ApiKeyHashService;
import com.github.dimitryivaniuta.relay.tenant.TenantKeyLookupService;
import com.github.dimitryivaniuta.relay.webhook.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasSize;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(controllers = WebhookController.class)
@Import({RateLimitKeyResolver.class, WebhookControllerTest.Props.class})
class WebhookControllerTest {

    @TestConfiguration
    @EnableConfigurationProperties(RateLimitProperties.class)
    static class Props {}

    private static final String KEY = "rk_test";
    private static final long TENANT = 7L;
    private static final Instant CREATED = Instant.parse("2026-01-10T08:00:00Z");

    @Autowired MockMvc mvc;

    @MockBean WebhookRegistry registry;
    @MockBean WebhookDeliveryEngine engine;
    @MockBean WebhookSignatureService signatures;
    @MockBean ApiKeyHashService hashService;
    @MockBean TenantKeyLookupService keyLookup;
    @MockBean RateLimiterService limiter;

    @BeforeEach
    void setUp() {
        when(hashService.hash(KEY)).thenReturn("hash-of-key");
        when(keyLookup.findTenantIdByHash("hash-of-key")).thenReturn(Optional.of(TENANT));
        when(limiter.checkRateLimit(anyString(), anyInt(), anyLong()))
                .thenReturn(new RateLimitResult(true, 999, CREATED.plusSeconds(3600), null));
    }

    private static WebhookEndpoint endpoint(String id, long owner) {
        return new WebhookEndpoint(id, owner, "https://hooks.example.com/" + id,
                Set.of("api_key.created"), null, 3, CREATED);
    }

    @Test
    void missingApiKeyIsUnauthorized() throws Exception {
        mvc.perform(get("/api/webhooks"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.message").value("API key required"));

        mvc.perform(get("/api/webhooks").header("X-Api-Key", "nope"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.message").value("Invalid API key"));
    }

    @Test
    void createRegistersWebhookForCallingTenant() throws Exception {
        when(registry.register(eq(TENANT), eq("https://hooks.example.com/in"), any(), isNull(), eq(5)))
                .thenReturn(endpoint("wh_1", TENANT));

        mvc.perform(post("/api/webhooks")
                        .header("X-Api-Key", KEY)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"url":"https://hooks.example.com/in","events":["api_key.created"],"maxRetries":5}
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value("wh_1"))
                .andExpect(jsonPath("$.isActive").value(true))
                .andExpect(jsonPath("$.events", contains("api_key.created")))
                .andExpect(jsonPath("$.createdAt").value("2026-01-10T08:00:00Z"))
                .andExpect(header().string("X-RateLimit-Limit", "1000"))
                .andExpect(header().string("X-RateLimit-Remaining", "999"));

        verify(registry).register(TENANT, "https://hooks.example.com/in",
                new TreeSet<>(Set.of("api_key.created")), null, 5);
    }

    @Test
    void createValidatesUrlAndEvents() throws Exception {
        mvc.perform(post("/api/webhooks").header("X-Api-Key", KEY)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"url":"ftp://files.example.com","events":["api_key.created"]}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Invalid webhook URL format"));

        mvc.perform(post("/api/webhooks").header("X-Api-Key", KEY)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"url":"https://hooks.example.com","events":["order.shipped"]}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message", containsString("order.shipped")));

        mvc.perform(post("/api/webhooks").header("X-Api-Key", KEY)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"url":"https://hooks.example.com","events":[]}
                                """))
                .andExpect(status().isBadRequest());

        verify(registry, never()).register(anyLong(), anyString(), any(), any(), any());
    }

    @Test
    void otherTenantsWebhooksAreNotVisible() throws Exception {
        when(registry.get("wh_foreign")).thenReturn(Optional.of(endpoint("wh_foreign", 99L)));

        mvc.perform(get("/api/webhooks/wh_foreign").header("X-Api-Key", KEY))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("Webhook not found"));

        mvc.perform(delete("/api/webhooks/wh_foreign").header("X-Api-Key", KEY))
                .andExpect(status().isNotFound());

        verify(registry, never()).delete(anyString());
    }

    @Test
    void listUpdateAndDelete() throws Exception {
        WebhookEndpoint mine = endpoint("wh_mine", TENANT);
        when(registry.listByOwner(TENANT)).thenReturn(List.of(mine));
        when(registry.get("wh_mine")).thenReturn(Optional.of(mine));
        when(registry.update(eq("wh_mine"), any())).thenReturn(Optional.of(mine));
        when(registry.delete("wh_mine")).thenReturn(true);

        mvc.perform(get("/api/webhooks").header("X-Api-Key", KEY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].id").value("wh_mine"));

        mvc.perform(patch("/api/webhooks/wh_mine").header("X-Api-Key", KEY)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"isActive":false}
                                """))
                .andExpect(status().isOk());
        verify(registry).update("wh_mine", new WebhookUpdate(null, null, false));

        mvc.perform(delete("/api/webhooks/wh_mine").header("X-Api-Key", KEY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.deleted").value(true));
    }

    @Test
    void deliveriesAndStats() throws Exception {
        when(registry.get("wh_mine")).thenReturn(Optional.of(endpoint("wh_mine", TENANT)));
        when(engine.getDeliveryHistory("wh_mine", 1000)).thenReturn(List.of(new WebhookDelivery(
                "del_1", "wh_mine", "evt_1", "api_key.created", Map.of(), 1, 200, "ok", null, CREATED, null, null)));
        when(engine.getWebhookStats("wh_mine")).thenReturn(new WebhookStats(4, 3, 1, 75.0));

        mvc.perform(get("/api/webhooks/wh_mine/deliveries").param("limit", "5000").header("X-Api-Key", KEY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value("del_1"))
                .andExpect(jsonPath("$[0].statusCode").value(200));

        mvc.perform(get("/api/webhooks/wh_mine/stats").header("X-Api-Key", KEY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.successRate").value(75.0))
                .andExpect(jsonPath("$.failedDeliveries").value(1));
    }

    @Test
    void testDeliveryIsRateLimitedPerTenantAndRoute() throws Exception {
        when(registry.get("wh_mine")).thenReturn(Optional.of(endpoint("wh_mine", TENANT)));
        when(limiter.checkRateLimit(eq("tenant:7:POST /api/webhooks/{id}/test"), eq(10), eq(60_000L)))
                .thenReturn(new RateLimitResult(false, 0, CREATED.plusSeconds(42), 42L));

        mvc.perform(post("/api/webhooks/wh_mine/test").header("X-Api-Key", KEY))
                .andExpect(status().isTooManyRequests())
                .andExpect(header().string("Retry-After", "42"))
                .andExpect(header().string("X-RateLimit-Limit", "10"))
                .andExpect(header().string("X-RateLimit-Remaining", "0"))
                .andExpect(jsonPath("$.error").value("Too many requests"))
                .andExpect(jsonPath("$.retryAfter").value(42));

        verify(engine, never()).testWebhook(anyString());
    }

    @Test
    void testDeliveryReturnsResult() throws Exception {
        when(registry.get("wh_mine")).thenReturn(Optional.of(endpoint("wh_mine", TENANT)));
        when(engine.testWebhook("wh_mine")).thenReturn(new WebhookTestResult(false, 500, "HTTP 500"));

        mvc.perform(post("/api/webhooks/wh_mine/test").header("X-Api-Key", KEY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.statusCode").value(500));
    }

    @Test
    void rotateSecret() throws Exception {
        when(registry.get("wh_mine")).thenReturn(Optional.of(endpoint("wh_mine", TENANT)));
        when(registry.rotateSecret("wh_mine")).thenReturn(Optional.of("ab".repeat(32)));

        mvc.perform(post("/api/webhooks/wh_mine/secret").header("X-Api-Key", KEY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.secret").value("ab".repeat(32)));
    }

    @Test
    void verifySignatureUsesRawBodyWhenGiven() throws Exception {
        when(signatures.verifyRawFromHeaders(eq("{\"a\":1}"), anyMap(), eq("s3cret"),
                eq(SignatureAlgorithm.SHA512), eq(60L)))
                .thenReturn(SignatureVerification.failed("Signature mismatch"));

        mvc.perform(post("/api/webhooks/signatures/verify").header("X-Api-Key", KEY)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"body":"{\\"a\\":1}","headers":{"X-Webhook-Signature":"signature=00"},
                                 "secret":"s3cret","algorithm":"sha512","toleranceSeconds":60}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.valid").value(false))
                .andExpect(jsonPath("$.error").value("Signature mismatch"));

        verify(signatures, never()).verifyFromHeaders(any(), anyMap(), anyString(), any(), anyLong());
    }

    @Test
    void correlationIdIsEchoed() throws Exception {
        when(registry.listByOwner(TENANT)).thenReturn(List.of());

        mvc.perform(get("/api/webhooks").header("X-Api-Key", KEY).header("X-Correlation-Id", "corr-123"))
                .andExpect(status().isOk())
                .andExpect(header().string("X-Correlation-Id", "corr-123"));
    }

    @Test
    void unknownWebhookIs404() throws Exception {
        when(registry.get(anyString())).thenReturn(Optional.empty());

        mvc.perform(get("/api/webhooks/wh_nope/stats").header("X-Api-Key", KEY))
                .andExpect(status().isNotFound());
        verify(engine, never()).getWebhookStats(anyString());
    }

    @Test
    void unknownAlgorithmIsBadRequest() throws Exception {
        mvc.perform(post("/api/webhooks/signatures/verify").header("X-Api-Key", KEY)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"payload":{"a":1},"headers":{"X-Webhook-Nonce":"n"},"secret":"s","algorithm":"md5"}
                                """))
                .andExpect(status().isBadRequest());
        verifyNoInteractions(signatures);
    }

    @Test
    void updateWithEmptyEventsIsRejected() throws Exception {
        when(registry.get("wh_mine")).thenReturn(Optional.of(endpoint("wh_mine", TENANT)));

        mvc.perform(patch("/api/webhooks/wh_mine").header("X-Api-Key", KEY)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"events":[]}
                                """))
                .andExpect(status().isBadRequest());
        verify(registry, never()).update(anyString(), any());
    }

    @Test
    void registryValidationErrorsBecome400() throws Exception {
        when(registry.register(anyLong(), anyString(), any(), any(), any()))
                .thenThrow(new IllegalArgumentException("Secret must be at least 64 hex characters"));

        mvc.perform(post("/api/webhooks").header("X-Api-Key", KEY)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"url":"https://hooks.example.com","events":["error.critical"],"secret":"abc"}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Secret must be at least 64 hex characters"));
    }

    @Test
    void replayQueuesRecordedDeliveryAgain() throws Exception {
        when(registry.get("wh_mine")).thenReturn(Optional.of(endpoint("wh_mine", TENANT)));
        when(engine.replayDelivery("wh_mine", "del_1", null)).thenReturn(Optional.of(new WebhookEvent(
                "evt_9", "api_key.created", TENANT, Map.of("keyId", 5), CREATED, "wh_mine", "del_1")));

        mvc.perform(post("/api/webhooks/wh_mine/deliveries/del_1/replay").header("X-Api-Key", KEY))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.eventId").value("evt_9"))
                .andExpect(jsonPath("$.replayOf").value("del_1"))
                .andExpect(jsonPath("$.eventType").value("api_key.created"));
    }

    @Test
    void replayWithEditedPayloadPassesItThrough() throws Exception {
        when(registry.get("wh_mine")).thenReturn(Optional.of(endpoint("wh_mine", TENANT)));
        when(engine.replayDelivery(eq("wh_mine"), eq("del_1"), eq(Map.of("keyId", 6)))).thenReturn(Optional.of(
                new WebhookEvent("evt_10", "api_key.created", TENANT, Map.of("keyId", 6), CREATED, "wh_mine", "del_1")));

        mvc.perform(post("/api/webhooks/wh_mine/deliveries/del_1/replay").header("X-Api-Key", KEY)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"payload\":{\"keyId\":6}}"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.eventId").value("evt_10"));

        mvc.perform(post("/api/webhooks/wh_mine/deliveries/del_1/replay").header("X-Api-Key", KEY)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"payload\":{}}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Payload cannot be empty"));
    }

    @Test
    void replayOfUnknownDeliveryOrInactiveWebhook() throws Exception {
        when(registry.get("wh_mine")).thenReturn(Optional.of(endpoint("wh_mine", TENANT)));
        when(engine.replayDelivery("wh_mine", "del_missing", null)).thenReturn(Optional.empty());
        when(engine.replayDelivery("wh_mine", "del_1", null)).thenThrow(new IllegalStateException("Webhook is inactive"));

        mvc.perform(post("/api/webhooks/wh_mine/deliveries/del_missing/replay").header("X-Api-Key", KEY))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("Delivery not found"));

        mvc.perform(post("/api/webhooks/wh_mine/deliveries/del_1/replay").header("X-Api-Key", KEY))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.message").value("Webhook is inactive"));
    }

    @Test
    void replayOfAnotherTenantsWebhookIsNotFound() throws Exception {
        when(registry.get("wh_other")).thenReturn(Optional.of(endpoint("wh_other", TENANT + 1)));

        mvc.perform(post("/api/webhooks/wh_other/deliveries/del_1/replay").header("X-Api-Key", KEY))
                .andExpect(status().isNotFound());

        verify(engine, never()).replayDelivery(anyString(), anyString(), any());
    }
}
