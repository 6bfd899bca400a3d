package com.github.dimitryivaniuta.relay.webhook;

import com.github.dimitryivaniuta.relay.signature.SignatureAlgorithm;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.List;

@Getter
@Setter
@ConfigurationProperties(prefix = "relay.webhooks")
public class WebhookProperties {

    private int defaultMaxRetries = 3;

    /** Delivery records kept per endpoint. */
    private int historyCapacity = 1000;

    private SignatureAlgorithm signatureAlgorithm = SignatureAlgorithm.SHA256;

    private Delivery delivery = new Delivery();

    @Getter
    @Setter
    public static class Delivery {
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration readTimeout = Duration.ofSeconds(10);

        private int workers = 4;
        private int queueCapacity = 10_000;
        private int schedulerThreads = 2;

        /** Delay after failed attempt n is retrySchedule[min(n-1, size-1)]. */
        private List<Duration> retrySchedule = List.of(
                Duration.ofSeconds(5),
                Duration.ofSeconds(30),
                Duration.ofMinutes(5),
                Duration.ofHours(1)
        );

        /** Disable at once on 4xx (except 408/429) instead of retrying. */
        private boolean failFastOnClientError = false;

        private String userAgent = "webhook-relay/1.0";
    }
}
