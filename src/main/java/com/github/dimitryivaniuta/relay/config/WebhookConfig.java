package com.github.dimitryivaniuta.relay.config;

import com.github.dimitryivaniuta.relay.metrics.RelayMetrics;
import com.github.dimitryivaniuta.relay.signature.CanonicalJson;
import com.github.dimitryivaniuta.relay.signature.WebhookSignatureService;
import com.github.dimitryivaniuta.relay.webhook.RetryScheduler;
import com.github.dimitryivaniuta.relay.webhook.WebhookDeliveryEngine;
import com.github.dimitryivaniuta.relay.webhook.WebhookProperties;
import com.github.dimitryivaniuta.relay.webhook.WebhookRegistry;
import com.github.dimitryivaniuta.relay.webhook.store.DeliveryHistoryStore;
import com.github.dimitryivaniuta.relay.webhook.store.InMemoryWebhookEndpointStore;
import com.github.dimitryivaniuta.relay.webhook.store.WebhookEndpointStore;
import com.github.dimitryivaniuta.relay.webhook.transport.RestTemplateWebhookTransport;
import com.github.dimitryivaniuta.relay.webhook.transport.WebhookTransport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;

/**
 * Delivery wiring: in-memory stores, a bounded executor for attempts, a scheduler for delayed retries
 * and a RestTemplate with the configured timeouts.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(WebhookProperties.class)
public class WebhookConfig {

    @Bean
    @ConditionalOnMissingBean
    public WebhookEndpointStore webhookEndpointStore() {
        return new InMemoryWebhookEndpointStore();
    }

    @Bean
    public DeliveryHistoryStore deliveryHistoryStore(WebhookProperties properties) {
        return new DeliveryHistoryStore(properties.getHistoryCapacity());
    }

    @Bean
    public ThreadPoolTaskExecutor webhookDeliveryExecutor(WebhookProperties properties) {
        WebhookProperties.Delivery d = properties.getDelivery();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setThreadNamePrefix("webhook-delivery-");
        executor.setCorePoolSize(d.getWorkers());
        executor.setMaxPoolSize(d.getWorkers());
        executor.setQueueCapacity(d.getQueueCapacity());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(15);
        return executor;
    }

    @Bean
    public ThreadPoolTaskScheduler webhookRetryScheduler(WebhookProperties properties) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setThreadNamePrefix("webhook-retry-");
        scheduler.setPoolSize(properties.getDelivery().getSchedulerThreads());
        scheduler.setRemoveOnCancelPolicy(true);
        return scheduler;
    }

    @Bean
    public RestTemplate webhookRestTemplate(RestTemplateBuilder builder, WebhookProperties properties) {
        WebhookProperties.Delivery d = properties.getDelivery();
        log.info("Webhook HTTP client: connectTimeout={}, readTimeout={}", d.getConnectTimeout(), d.getReadTimeout());
        return builder
                .setConnectTimeout(d.getConnectTimeout())
                .setReadTimeout(d.getReadTimeout())
                .build();
    }

    @Bean
    @ConditionalOnMissingBean
    public WebhookTransport webhookTransport(@Qualifier("webhookRestTemplate") RestTemplate restTemplate) {
        return new RestTemplateWebhookTransport(restTemplate);
    }

    @Bean
    public RetryScheduler retryScheduler(ThreadPoolTaskScheduler webhookRetryScheduler) {
        return new RetryScheduler(webhookRetryScheduler);
    }

    @Bean
    public WebhookRegistry webhookRegistry(WebhookEndpointStore endpointStore,
                                           DeliveryHistoryStore historyStore,
                                           RetryScheduler retryScheduler,
                                           WebhookSignatureService signatures,
                                           WebhookProperties properties,
                                           Clock clock) {
        return new WebhookRegistry(endpointStore, historyStore, retryScheduler, signatures, properties, clock);
    }

    @Bean(initMethod = "start", destroyMethod = "close")
    public WebhookDeliveryEngine webhookDeliveryEngine(WebhookRegistry registry,
                                                       DeliveryHistoryStore historyStore,
                                                       WebhookSignatureService signatures,
                                                       CanonicalJson canonicalJson,
                                                       WebhookTransport transport,
                                                       RetryScheduler retryScheduler,
                                                       ThreadPoolTaskExecutor webhookDeliveryExecutor,
                                                       WebhookProperties properties,
                                                       RelayMetrics metrics,
                                                       Clock clock) {
        return new WebhookDeliveryEngine(registry, historyStore, signatures, canonicalJson, transport,
                retryScheduler, webhookDeliveryExecutor, properties, metrics, clock);
    }
}
