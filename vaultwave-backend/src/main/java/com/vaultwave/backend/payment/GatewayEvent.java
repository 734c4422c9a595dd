package com.vaultwave.backend.payment;

/**
 * An inbound notification about a payment, before authenticity is checked.
 *
 * <p>Webhooks carry the raw body and its signature. A redirect-return carries only the intent id
 * the browser came back with; everything else is fetched from the provider.
 */
public record GatewayEvent(Source source, String intentId, String rawPayload, String signature) {

    public enum Source {
        WEBHOOK,
        REDIRECT
    }

    public static GatewayEvent webhook(String rawPayload, String signature) {
        return new GatewayEvent(Source.WEBHOOK, null, rawPayload, signature);
    }

    public static GatewayEvent redirect(String intentId) {
        return new GatewayEvent(Source.REDIRECT, intentId, null, null);
    }
}
