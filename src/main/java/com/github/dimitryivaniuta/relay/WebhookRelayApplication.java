package com.github.dimitryivaniuta.relay;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
public class WebhookRelayApplication {

    public static void main(String[] args) {
        SpringApplication.run(WebhookRelayApplication.class, args);
    }
}
