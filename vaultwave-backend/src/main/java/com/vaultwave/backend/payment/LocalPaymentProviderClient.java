package com.vaultwave.backend.payment;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process stand-in for a hosted checkout provider, used for local runs and tests.
 * Intents live in memory and are approved through {@link LocalPaymentController}.
 */
@Service
@Slf4j
@ConditionalOnProperty(name = "app.payments.provider", havingValue = "local", matchIfMissing = true)
public class LocalPaymentProviderClient implements PaymentProviderClient {

    private final Map<String, PaymentIntent> intents = new ConcurrentHashMap<>();
    private final String approvalBaseUrl;

    public LocalPaymentProviderClient(
            @Value("${app.payments.local.approval-base-url:http://localhost:8080/api/payments/local/approve}") String approvalBaseUrl
    ) {
        this.approvalBaseUrl = approvalBaseUrl;
    }

    @Override
    public String name() {
        return "local";
    }

    @Override
    public PaymentIntent createIntent(PaymentIntentRequest request) {
        String id = "local_" + UUID.randomUUID();
        PaymentIntent intent = new PaymentIntent(
                id,
                PaymentIntentStatus.CREATED,
                approvalBaseUrl + "?token=" + id,
                request.amount(),
                request.currency()
        );
        intents.put(id, intent);
        log.info("[local-pay] Created intent {} for order {} ({} {})", id, request.orderId(), request.amount(), request.currency());
        return intent;
    }

    @Override
    public Optional<PaymentIntent> findIntent(String intentId) {
        return Optional.ofNullable(intentId).map(intents::get);
    }

    public PaymentIntent capture(String intentId) {
        return move(intentId, PaymentIntentStatus.CAPTURED);
    }

    public PaymentIntent deny(String intentId) {
        return move(intentId, PaymentIntentStatus.DENIED);
    }

    private PaymentIntent move(String intentId, PaymentIntentStatus status) {
        PaymentIntent updated = intents.computeIfPresent(intentId, (id, current) -> {
            if (current.status() != PaymentIntentStatus.CREATED) {
                return current;
            }
            return new PaymentIntent(id, status, current.approvalUrl(), current.amount(), current.currency());
        });
        if (updated == null) {
            throw new IllegalArgumentException("Unknown payment intent: " + intentId);
        }
        log.info("[local-pay] Intent {} is now {}", intentId, updated.status());
        return updated;
    }
}
