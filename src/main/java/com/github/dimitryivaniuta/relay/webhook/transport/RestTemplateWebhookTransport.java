package com.github.dimitryivaniuta.relay.webhook.transport;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.Map;

@Slf4j
public class RestTemplateWebhookTransport implements WebhookTransport {

    static final int MAX_RESPONSE_CHARS = 1_000;

    private final RestTemplate restTemplate;

    public RestTemplateWebhookTransport(RestTemplate restTemplate) {
        this.restTemplate = restTemplate;
    }

    @Override
    public DeliveryOutcome post(String url, String body, Map<String, String> headers) {
        HttpHeaders h = new HttpHeaders();
        h.setContentType(MediaType.APPLICATION_JSON);
        headers.forEach(h::set);

        try {
            ResponseEntity<String> res = restTemplate.postForEntity(url, new HttpEntity<>(body, h), String.class);
            return DeliveryOutcome.response(res.getStatusCode().value(), truncate(res.getBody()));
        } catch (HttpStatusCodeException ex) {
            return DeliveryOutcome.response(ex.getStatusCode().value(), truncate(ex.getResponseBodyAsString()));
        } catch (ResourceAccessException ex) {
            log.debug("Webhook POST to {} failed: {}", url, ex.getMessage());
            return DeliveryOutcome.failure(ex.getMostSpecificCause().getMessage() != null
                    ? ex.getMostSpecificCause().getMessage()
                    : ex.getMessage());
        } catch (RestClientException | IllegalArgumentException ex) {
            log.debug("Webhook POST to {} failed: {}", url, ex.getMessage());
            return DeliveryOutcome.failure(ex.getMessage());
        }
    }

    private static String truncate(String s) {
        if (s == null) return null;
        return s.length() <= MAX_RESPONSE_CHARS ? s : s.substring(0, MAX_RESPONSE_CHARS);
    }
}
