package com.vaultwave.backend.payment;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vaultwave.backend.exception.GatewayUnavailableException;
import com.vaultwave.backend.exception.OrderStateException;
import com.vaultwave.backend.exception.UntrustedEventException;
import com.vaultwave.backend.order.*;
import com.vaultwave.backend.payment.dto.PaymentSession;
import com.vaultwave.backend.user.User;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class PaymentGatewayAdapterTest {

    private PaymentProviderClient provider;
    private OrderLedger ledger;
    private OrderRepository orderRepository;
    private WebhookSignatureVerifier verifier;
    private PaymentGatewayAdapter adapter;
    private Order order;

    @BeforeEach
    void setUp() {
        provider = mock(PaymentProviderClient.class);
        ledger = mock(OrderLedger.class);
        orderRepository = mock(OrderRepository.class);
        verifier = new WebhookSignatureVerifier("test-secret");
        adapter = new PaymentGatewayAdapter(provider, ledger, orderRepository, verifier, new ObjectMapper());
        when(provider.name()).thenReturn("local");

        User buyer = new User();
        buyer.setId(1L);
        order = Order.builder()
                .id(9L)
                .buyer(buyer)
                .totalAmount(new BigDecimal("12.00"))
                .currency("USD")
                .status(OrderStatus.PENDING)
                .build();
    }

    private static String captureEvent(String intentId) {
        return "{\"id\":\"evt_1\",\"event_type\":\"PAYMENT.CAPTURE.COMPLETED\",\"resource\":{\"intent_id\":\"" + intentId + "\"}}";
    }

    private Order completed() {
        Order done = Order.builder()
                .id(9L)
                .buyer(order.getBuyer())
                .totalAmount(order.getTotalAmount())
                .currency("USD")
                .status(OrderStatus.COMPLETED)
                .paymentReference("pi_1")
                .build();
        return done;
    }

    private PaymentIntent intent(String id, PaymentIntentStatus status) {
        return new PaymentIntent(id, status, "https://pay/approve?token=" + id, order.getTotalAmount(), "USD");
    }

    private Order pendingWith(String reference) {
        return Order.builder()
                .id(9L)
                .buyer(order.getBuyer())
                .totalAmount(order.getTotalAmount())
                .currency("USD")
                .status(OrderStatus.PENDING)
                .paymentReference(reference)
                .build();
    }

    @Test
    void initiateCreatesAnIntentAndAttachesIt() {
        when(provider.createIntent(any())).thenReturn(intent("pi_1", PaymentIntentStatus.CREATED));
        when(ledger.attachPaymentReference(9L, null, "pi_1")).thenReturn(new OrderTransition(pendingWith("pi_1"), true));

        PaymentSession session = adapter.initiate(order);

        assertTrue(session.isRequiresRedirect());
        assertEquals("pi_1", session.getSessionId());
        assertEquals("https://pay/approve?token=pi_1", session.getPaymentUrl());
        verify(ledger).attachPaymentReference(9L, null, "pi_1");
    }

    @Test
    void initiateCompletesTheOrderWhenTheAttachedIntentWasAlreadyCaptured() {
        order.setPaymentReference("pi_1");
        when(provider.findIntent("pi_1")).thenReturn(Optional.of(intent("pi_1", PaymentIntentStatus.CAPTURED)));
        when(ledger.complete(9L, "pi_1")).thenReturn(new OrderTransition(completed(), true));

        PaymentSession session = adapter.initiate(order);

        assertFalse(session.isRequiresRedirect());
        assertEquals("pi_1", session.getSessionId());
        assertEquals("COMPLETED", session.getOrderStatus());
        verify(provider, never()).createIntent(any());
        verify(ledger, never()).attachPaymentReference(anyLong(), any(), anyString());
    }

    @Test
    void initiateReplacesADeniedIntent() {
        order.setPaymentReference("pi_1");
        when(provider.findIntent("pi_1")).thenReturn(Optional.of(intent("pi_1", PaymentIntentStatus.DENIED)));
        when(provider.createIntent(any())).thenReturn(intent("pi_2", PaymentIntentStatus.CREATED));
        when(ledger.attachPaymentReference(9L, "pi_1", "pi_2")).thenReturn(new OrderTransition(pendingWith("pi_2"), true));

        PaymentSession session = adapter.initiate(order);

        assertEquals("pi_2", session.getSessionId());
        verify(ledger).attachPaymentReference(9L, "pi_1", "pi_2");
    }

    @Test
    void initiateFollowsTheIntentAttachedByAConcurrentRequest() {
        when(provider.createIntent(any())).thenReturn(intent("pi_mine", PaymentIntentStatus.CREATED));
        when(ledger.attachPaymentReference(9L, null, "pi_mine"))
                .thenReturn(new OrderTransition(pendingWith("pi_theirs"), false));
        when(provider.findIntent("pi_theirs")).thenReturn(Optional.of(intent("pi_theirs", PaymentIntentStatus.CREATED)));

        PaymentSession session = adapter.initiate(order);

        assertEquals("pi_theirs", session.getSessionId());
        assertTrue(session.isRequiresRedirect());
    }

    @Test
    void initiateReusesAnOpenIntent() {
        order.setPaymentReference("pi_1");
        when(provider.findIntent("pi_1")).thenReturn(Optional.of(intent("pi_1", PaymentIntentStatus.CREATED)));

        PaymentSession session = adapter.initiate(order);

        assertEquals("pi_1", session.getSessionId());
        verify(provider, never()).createIntent(any());
        verify(ledger, never()).attachPaymentReference(anyLong(), any(), anyString());
    }

    @Test
    void gatewayErrorLeavesTheOrderUntouched() {
        when(provider.createIntent(any())).thenThrow(new RuntimeException("connection reset"));

        assertThrows(GatewayUnavailableException.class, () -> adapter.initiate(order));
        verify(ledger, never()).attachPaymentReference(anyLong(), any(), anyString());
        verify(ledger, never()).fail(anyLong(), anyString());
        assertEquals(OrderStatus.PENDING, order.getStatus());
    }

    @Test
    void zeroTotalOrdersCompleteWithoutTheProvider() {
        order.setTotalAmount(new BigDecimal("0.00"));
        when(ledger.complete(eq(9L), startsWith("free_"))).thenReturn(new OrderTransition(completed(), true));

        PaymentSession session = adapter.initiate(order);

        assertFalse(session.isRequiresRedirect());
        assertEquals("none", session.getProvider());
        assertEquals("COMPLETED", session.getOrderStatus());
        verifyNoInteractions(orderRepository);
        verify(provider, never()).createIntent(any());
    }

    @Test
    void initiateRejectsOrdersThatAreNotPending() {
        order.setStatus(OrderStatus.CANCELLED);

        assertThrows(OrderStateException.class, () -> adapter.initiate(order));
        verify(provider, never()).createIntent(any());
    }

    @Test
    void capturedWebhookDeliveredTwiceCompletesOnce() {
        order.setPaymentReference("pi_1");
        when(orderRepository.findByPaymentReference("pi_1")).thenReturn(Optional.of(order));
        when(ledger.complete(9L, "pi_1"))
                .thenReturn(new OrderTransition(completed(), true))
                .thenReturn(new OrderTransition(completed(), false));
        String body = captureEvent("pi_1");

        ReconcileResult first = adapter.handleWebhook(body, verifier.sign(body));
        ReconcileResult second = adapter.handleWebhook(body, verifier.sign(body));

        assertEquals(ReconcileOutcome.COMPLETED, first.outcome());
        assertEquals(ReconcileOutcome.ALREADY_COMPLETED, second.outcome());
        assertEquals(OrderStatus.COMPLETED, second.orderStatus());
    }

    @Test
    void badSignatureIsRejectedWithoutTouchingOrders() {
        String body = captureEvent("pi_1");

        assertThrows(UntrustedEventException.class, () -> adapter.handleWebhook(body, "deadbeef"));
        assertThrows(UntrustedEventException.class, () -> adapter.handleWebhook(body, null));
        verifyNoInteractions(ledger, orderRepository);
    }

    @Test
    void redirectForAnIntentTheProviderDoesNotKnowIsRejected() {
        when(provider.findIntent("forged")).thenReturn(Optional.empty());

        assertThrows(UntrustedEventException.class, () -> adapter.handleReturn("forged"));
        verifyNoInteractions(ledger);
    }

    @Test
    void redirectTrustsTheProviderStatusOverTheBrowser() {
        order.setPaymentReference("pi_1");
        when(provider.findIntent("pi_1")).thenReturn(Optional.of(
                new PaymentIntent("pi_1", PaymentIntentStatus.CREATED, "u", order.getTotalAmount(), "USD")));
        when(orderRepository.findByPaymentReference("pi_1")).thenReturn(Optional.of(order));

        ReconcileResult result = adapter.handleReturn("pi_1");

        assertEquals(ReconcileOutcome.IGNORED, result.outcome());
        assertEquals(OrderStatus.PENDING, result.orderStatus());
        verifyNoInteractions(ledger);
    }

    @Test
    void deniedPaymentFailsTheOrder() {
        order.setPaymentReference("pi_1");
        when(provider.findIntent("pi_1")).thenReturn(Optional.of(
                new PaymentIntent("pi_1", PaymentIntentStatus.DENIED, "u", order.getTotalAmount(), "USD")));
        when(orderRepository.findByPaymentReference("pi_1")).thenReturn(Optional.of(order));
        Order failed = Order.builder().id(9L).status(OrderStatus.FAILED).totalAmount(BigDecimal.ONE).currency("USD").build();
        when(ledger.fail(eq(9L), anyString())).thenReturn(new OrderTransition(failed, true));

        ReconcileResult result = adapter.handleReturn("pi_1");

        assertEquals(ReconcileOutcome.FAILED, result.outcome());
        verify(ledger, never()).complete(anyLong(), anyString());
    }

    @Test
    void captureForACancelledOrderIsFlaggedNotApplied() {
        order.setPaymentReference("pi_1");
        order.setStatus(OrderStatus.CANCELLED);
        when(orderRepository.findByPaymentReference("pi_1")).thenReturn(Optional.of(order));
        when(ledger.complete(9L, "pi_1")).thenThrow(new OrderStateException("cancelled"));
        String body = captureEvent("pi_1");

        ReconcileResult result = adapter.handleWebhook(body, verifier.sign(body));

        assertEquals(ReconcileOutcome.REJECTED, result.outcome());
        assertEquals(OrderStatus.CANCELLED, result.orderStatus());
    }

    @Test
    void unknownIntentIsAcknowledged() {
        when(orderRepository.findByPaymentReference("pi_x")).thenReturn(Optional.empty());
        String body = captureEvent("pi_x");

        ReconcileResult result = adapter.handleWebhook(body, verifier.sign(body));

        assertEquals(ReconcileOutcome.UNKNOWN_ORDER, result.outcome());
        verifyNoInteractions(ledger);
    }

    @Test
    void unrelatedEventTypesAreIgnored() {
        String body = "{\"event_type\":\"PAYMENT.REFUND.COMPLETED\",\"resource\":{\"intent_id\":\"pi_1\"}}";

        ReconcileResult result = adapter.handleWebhook(body, verifier.sign(body));

        assertEquals(ReconcileOutcome.IGNORED, result.outcome());
        verifyNoInteractions(ledger);
    }

    @Test
    void signedButMalformedPayloadIsABadRequest() {
        String body = "{\"event_type\":\"PAYMENT.CAPTURE.COMPLETED\"}";

        assertThrows(IllegalArgumentException.class, () -> adapter.handleWebhook(body, verifier.sign(body)));
    }
}
