package com.vaultwave.backend.payment;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vaultwave.backend.exception.GatewayUnavailableException;
import com.vaultwave.backend.exception.OrderStateException;
import com.vaultwave.backend.exception.UntrustedEventException;
import com.vaultwave.backend.order.Order;
import com.vaultwave.backend.order.OrderLedger;
import com.vaultwave.backend.order.OrderRepository;
import com.vaultwave.backend.order.OrderStatus;
import com.vaultwave.backend.order.OrderTransition;
import com.vaultwave.backend.payment.dto.PaymentSession;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.Optional;
import java.util.UUID;

/**
 * Bridges orders and the payment provider.
 *
 * <p>Webhooks and redirect-returns both end up in {@link #reconcile(GatewayEvent)}. Order state
 * only changes through {@link OrderLedger}, whose row lock makes a duplicate or racing
 * notification a harmless no-op.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PaymentGatewayAdapter {

    private final PaymentProviderClient provider;
    private final OrderLedger orderLedger;
    private final OrderRepository orderRepository;
    private final WebhookSignatureVerifier signatureVerifier;
    private final ObjectMapper objectMapper;

    @Value("${app.payments.return-url:http://localhost:8080/api/payments/return}")
    private String returnUrl;

    public PaymentSession initiate(Order order) {
        if (order.getStatus() != OrderStatus.PENDING) {
            throw new OrderStateException("Order " + order.getId() + " is " + order.getStatus() + " and cannot be paid");
        }

        if (order.getTotalAmount().signum() == 0) {
            OrderTransition transition = orderLedger.complete(order.getId(), "free_" + UUID.randomUUID());
            log.info("Order {} has a zero total, completed without payment", order.getId());
            return settledSession("none", transition);
        }

        String current = order.getPaymentReference();
        Optional<PaymentSession> resumed = resume(order.getId(), current);
        if (resumed.isPresent()) {
            return resumed.get();
        }

        PaymentIntent intent;
        try {
            intent = provider.createIntent(new PaymentIntentRequest(
                    order.getId(),
                    order.getTotalAmount(),
                    order.getCurrency(),
                    "Vaultwave order #" + order.getId(),
                    returnUrl
            ));
        } catch (RuntimeException e) {
            log.error("Payment provider failed to create intent for order {}", order.getId(), e);
            throw new GatewayUnavailableException("Payment provider is unavailable, please try again", e);
        }

        OrderTransition attached = orderLedger.attachPaymentReference(order.getId(), current, intent.id());
        if (attached.applied()) {
            return session(order.getId(), intent);
        }

        Order latest = attached.order();
        log.info("Order {} was given intent {} by a concurrent request, intent {} left unused",
                latest.getId(), latest.getPaymentReference(), intent.id());
        return resume(latest.getId(), latest.getPaymentReference())
                .orElseThrow(() -> new OrderStateException(
                        "Payment for order " + latest.getId() + " changed while starting, please retry"));
    }

    /**
     * Continues with the intent already on the order: an open intent is handed out again and a
     * captured one completes the order. Declined, voided or unknown intents yield nothing so the
     * caller can create a fresh one.
     */
    private Optional<PaymentSession> resume(Long orderId, String paymentReference) {
        if (paymentReference == null) {
            return Optional.empty();
        }
        Optional<PaymentIntent> existing = lookupIntent(paymentReference);
        if (existing.isEmpty()) {
            return Optional.empty();
        }

        PaymentIntent intent = existing.get();
        if (intent.status() == PaymentIntentStatus.CREATED) {
            log.info("Reusing open payment intent {} for order {}", intent.id(), orderId);
            return Optional.of(session(orderId, intent));
        }
        if (intent.status() == PaymentIntentStatus.CAPTURED) {
            OrderTransition transition = orderLedger.complete(orderId, intent.id());
            log.info("Payment intent {} for order {} was already captured, order completed", intent.id(), orderId);
            return Optional.of(settledSession(provider.name(), transition));
        }
        return Optional.empty();
    }

    public ReconcileResult handleWebhook(String rawBody, String signature) {
        return reconcile(GatewayEvent.webhook(rawBody, signature));
    }

    public ReconcileResult handleReturn(String intentId) {
        return reconcile(GatewayEvent.redirect(intentId));
    }

    public ReconcileResult reconcile(GatewayEvent event) {
        VerifiedEvent verified = verify(event);

        if (verified.type() == GatewayEventType.IGNORED) {
            log.debug("Ignoring {} event for intent {}", event.source(), verified.intentId());
            return orderRepository.findByPaymentReference(verified.intentId())
                    .map(o -> new ReconcileResult(ReconcileOutcome.IGNORED, o.getId(), o.getStatus()))
                    .orElse(ReconcileResult.withoutOrder(ReconcileOutcome.IGNORED));
        }

        Optional<Order> match = orderRepository.findByPaymentReference(verified.intentId());
        if (match.isEmpty()) {
            log.warn("{} event for unknown payment intent {}", event.source(), verified.intentId());
            return ReconcileResult.withoutOrder(ReconcileOutcome.UNKNOWN_ORDER);
        }
        Long orderId = match.get().getId();

        if (verified.type() == GatewayEventType.CAPTURED) {
            try {
                OrderTransition transition = orderLedger.complete(orderId, verified.intentId());
                ReconcileOutcome outcome = transition.applied() ? ReconcileOutcome.COMPLETED : ReconcileOutcome.ALREADY_COMPLETED;
                return new ReconcileResult(outcome, orderId, transition.order().getStatus());
            } catch (OrderStateException e) {
                log.error("Payment {} was captured but order {} cannot complete, refund required: {}",
                        verified.intentId(), orderId, e.getMessage());
                return new ReconcileResult(ReconcileOutcome.REJECTED, orderId, match.get().getStatus());
            }
        }

        OrderTransition transition = orderLedger.fail(orderId, "Payment was declined or voided by the provider");
        ReconcileOutcome outcome = transition.applied() ? ReconcileOutcome.FAILED : ReconcileOutcome.UNCHANGED;
        return new ReconcileResult(outcome, orderId, transition.order().getStatus());
    }

    private VerifiedEvent verify(GatewayEvent event) {
        if (event.source() == GatewayEvent.Source.WEBHOOK) {
            if (!signatureVerifier.verify(event.rawPayload(), event.signature())) {
                log.error("Rejected webhook with invalid signature, possible spoofing attempt");
                throw new UntrustedEventException("Invalid webhook signature");
            }
            return parseWebhook(event.rawPayload());
        }

        if (event.intentId() == null || event.intentId().isBlank()) {
            throw new UntrustedEventException("Missing payment token");
        }
        PaymentIntent intent = lookupIntent(event.intentId()).orElseThrow(() -> {
            log.error("Return for payment intent {} unknown to the provider, possible spoofing attempt", event.intentId());
            return new UntrustedEventException("Unknown payment token");
        });
        return new VerifiedEvent(intent.id(), GatewayEventType.fromIntentStatus(intent.status()));
    }

    private VerifiedEvent parseWebhook(String rawPayload) {
        try {
            JsonNode root = objectMapper.readTree(rawPayload);
            String type = root.path("event_type").asText(null);
            String intentId = root.path("resource").path("intent_id").asText(null);
            if (intentId == null || intentId.isBlank()) {
                throw new IllegalArgumentException("Webhook payload has no intent id");
            }
            return new VerifiedEvent(intentId, GatewayEventType.fromProviderEvent(type));
        } catch (IOException e) {
            throw new IllegalArgumentException("Malformed webhook payload", e);
        }
    }

    private Optional<PaymentIntent> lookupIntent(String intentId) {
        try {
            return provider.findIntent(intentId);
        } catch (RuntimeException e) {
            log.error("Payment provider lookup failed for intent {}", intentId, e);
            throw new GatewayUnavailableException("Payment provider is unavailable, please try again", e);
        }
    }

    private static PaymentSession settledSession(String providerName, OrderTransition transition) {
        return PaymentSession.builder()
                .provider(providerName)
                .sessionId(transition.order().getPaymentReference())
                .requiresRedirect(false)
                .orderId(transition.order().getId())
                .orderStatus(transition.order().getStatus().name())
                .build();
    }

    private PaymentSession session(Long orderId, PaymentIntent intent) {
        return PaymentSession.builder()
                .provider(provider.name())
                .sessionId(intent.id())
                .paymentUrl(intent.approvalUrl())
                .requiresRedirect(true)
                .orderId(orderId)
                .orderStatus(OrderStatus.PENDING.name())
                .build();
    }

    private record VerifiedEvent(String intentId, GatewayEventType type) {
    }
}
