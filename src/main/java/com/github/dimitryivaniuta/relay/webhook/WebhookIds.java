package com.github.dimitryivaniuta.relay.webhook;

import java.util.UUID;

final class WebhookIds {
    private WebhookIds() {}

    static String endpoint() { return next("wh_"); }

    static String event() { return next("evt_"); }

    static String delivery() { return next("del_"); }

    private static String next(String prefix) {
        return prefix + UUID.randomUUID().toString().replace("-", "");
    }
}
