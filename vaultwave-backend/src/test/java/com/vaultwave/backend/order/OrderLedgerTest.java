package com.vaultwave.backend.order;

import com.vaultwave.backend.catalog.PricingModel;
import com.vaultwave.backend.catalog.Product;
import com.vaultwave.backend.catalog.ProductRepository;
import com.vaultwave.backend.exception.CurrencyMismatchException;
import com.vaultwave.backend.exception.EmptyOrderException;
import com.vaultwave.backend.exception.InvalidPriceException;
import com.vaultwave.backend.exception.OrderStateException;
import com.vaultwave.backend.library.EntitlementGrantor;
import com.vaultwave.backend.pricing.PricingResolver;
import com.vaultwave.backend.user.User;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.test.util.ReflectionTestUtils;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class OrderLedgerTest {

    @Mock
    private OrderRepository orderRepository;

    @Mock
    private ProductRepository productRepository;

    @Mock
    private EntitlementGrantor entitlementGrantor;

    private OrderLedger ledger;
    private User buyer;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        ledger = new OrderLedger(orderRepository, productRepository, new PricingResolver(), entitlementGrantor);
        ReflectionTestUtils.setField(ledger, "defaultCurrency", "USD");

        buyer = new User();
        buyer.setId(1L);
        buyer.setEmail("buyer@vaultwave.test");

        when(orderRepository.save(any(Order.class))).thenAnswer(inv -> {
            Order o = inv.getArgument(0);
            if (o.getId() == null) o.setId(100L);
            return o;
        });
    }

    private Product product(long id, PricingModel model, String base, String minimum, String currency) {
        Product p = new Product();
        p.setId(id);
        p.setName("Product " + id);
        p.setPricingModel(model);
        p.setBasePrice(base != null ? new BigDecimal(base) : null);
        p.setMinimumPrice(minimum != null ? new BigDecimal(minimum) : BigDecimal.ZERO);
        p.setCurrency(currency);
        when(productRepository.findById(id)).thenReturn(Optional.of(p));
        return p;
    }

    private Order pendingOrder(String reference) {
        Order order = Order.builder()
                .id(5L)
                .buyer(buyer)
                .totalAmount(new BigDecimal("10.00"))
                .currency("USD")
                .status(OrderStatus.PENDING)
                .paymentReference(reference)
                .build();
        when(orderRepository.findByIdForUpdate(5L)).thenReturn(Optional.of(order));
        return order;
    }

    @Test
    void emptyOrderIsRejectedAndNothingIsSaved() {
        assertThrows(EmptyOrderException.class, () -> ledger.create(buyer, List.of()));
        verify(orderRepository, never()).save(any());
    }

    @Test
    void nameYourPriceBelowMinimumRejectsTheWholeOrder() {
        product(1L, PricingModel.PAID, "4.00", null, "USD");
        product(2L, PricingModel.NAME_YOUR_PRICE, null, "2.00", "USD");

        assertThrows(InvalidPriceException.class, () -> ledger.create(buyer, List.of(
                OrderLine.of(1L, null),
                OrderLine.of(2L, "1.00"))));
        verify(orderRepository, never()).save(any());
    }

    @Test
    void createdOrderCarriesResolvedPricesAndTotal() {
        product(1L, PricingModel.PAID, "4.00", null, "USD");
        product(2L, PricingModel.NAME_YOUR_PRICE, null, "2.00", "USD");
        product(3L, PricingModel.FREE, null, null, null);

        Order order = ledger.create(buyer, List.of(
                OrderLine.of(1L, "999"),
                OrderLine.of(2L, "5.00"),
                OrderLine.of(3L, null)));

        assertEquals(OrderStatus.PENDING, order.getStatus());
        assertEquals(new BigDecimal("9.00"), order.getTotalAmount());
        assertEquals("USD", order.getCurrency());
        assertEquals(3, order.getItems().size());
        assertEquals(new BigDecimal("4.00"), order.getItems().get(0).getPriceAtPurchase());
        assertEquals(new BigDecimal("5.00"), order.getItems().get(1).getPriceAtPurchase());
    }

    @Test
    void mixedCurrenciesAreRejected() {
        product(1L, PricingModel.PAID, "4.00", null, "USD");
        product(2L, PricingModel.PAID, "4.00", null, "EUR");

        assertThrows(CurrencyMismatchException.class, () -> ledger.create(buyer, List.of(
                OrderLine.of(1L, null), OrderLine.of(2L, null))));
    }

    @Test
    void onlyFreeLinesUseTheDefaultCurrency() {
        product(3L, PricingModel.FREE, null, null, null);

        Order order = ledger.create(buyer, List.of(OrderLine.of(3L, null)));

        assertEquals("USD", order.getCurrency());
        assertEquals(0, order.getTotalAmount().signum());
    }

    @Test
    void duplicateProductsAndInactiveProductsAreRejected() {
        Product p = product(1L, PricingModel.PAID, "4.00", null, "USD");

        assertThrows(IllegalArgumentException.class, () -> ledger.create(buyer, List.of(
                OrderLine.of(1L, null), OrderLine.of(1L, null))));

        p.setActive(false);
        assertThrows(IllegalArgumentException.class, () -> ledger.create(buyer, List.of(OrderLine.of(1L, null))));
    }

    @Test
    void totalIsFrozenWhenTheCatalogPriceChangesLater() {
        Product p = product(1L, PricingModel.PAID, "4.00", null, "USD");
        Order order = ledger.create(buyer, List.of(OrderLine.of(1L, null)));

        p.setBasePrice(new BigDecimal("40.00"));

        assertEquals(new BigDecimal("4.00"), order.getTotalAmount());
        assertEquals(new BigDecimal("4.00"), order.getItems().get(0).getPriceAtPurchase());
    }

    @Test
    void completeGrantsOnceAndRepeatIsANoOp() {
        Order order = pendingOrder("pi_1");

        OrderTransition first = ledger.complete(5L, "pi_1");
        OrderTransition second = ledger.complete(5L, "pi_1");

        assertTrue(first.applied());
        assertFalse(second.applied());
        assertEquals(OrderStatus.COMPLETED, order.getStatus());
        assertNotNull(order.getCompletedAt());
        verify(entitlementGrantor, times(1)).grant(order);
    }

    @Test
    void completeRefusesAMismatchedReference() {
        pendingOrder("pi_1");

        assertThrows(OrderStateException.class, () -> ledger.complete(5L, "pi_other"));
        verify(entitlementGrantor, never()).grant(any());
    }

    @Test
    void cancelledOrderCannotComplete() {
        Order order = pendingOrder("pi_1");
        order.setStatus(OrderStatus.CANCELLED);

        assertThrows(OrderStateException.class, () -> ledger.complete(5L, "pi_1"));
        verify(entitlementGrantor, never()).grant(any());
    }

    @Test
    void failNeverDowngradesACompletedOrder() {
        Order order = pendingOrder("pi_1");
        order.setStatus(OrderStatus.COMPLETED);

        OrderTransition t = ledger.fail(5L, "declined");

        assertFalse(t.applied());
        assertEquals(OrderStatus.COMPLETED, order.getStatus());
    }

    @Test
    void failMovesAPendingOrder() {
        Order order = pendingOrder("pi_1");

        assertTrue(ledger.fail(5L, "declined").applied());
        assertEquals(OrderStatus.FAILED, order.getStatus());
        assertEquals("declined", order.getFailureReason());
    }

    @Test
    void cancelIsIdempotentButCompletedOrdersStay() {
        Order order = pendingOrder(null);

        assertTrue(ledger.cancel(buyer, 5L, null).applied());
        assertFalse(ledger.cancel(buyer, 5L, null).applied());
        assertEquals(OrderStatus.CANCELLED, order.getStatus());

        order.setStatus(OrderStatus.COMPLETED);
        assertThrows(OrderStateException.class, () -> ledger.cancel(buyer, 5L, null));
    }

    @Test
    void attachPaymentReferenceOnlyOnPendingOrders() {
        Order order = pendingOrder(null);

        assertTrue(ledger.attachPaymentReference(5L, null, "pi_9").applied());
        assertEquals("pi_9", order.getPaymentReference());

        order.setStatus(OrderStatus.FAILED);
        assertThrows(OrderStateException.class, () -> ledger.attachPaymentReference(5L, "pi_9", "pi_10"));
    }

    @Test
    void attachPaymentReferenceKeepsAReferenceSetByAnotherRequest() {
        Order order = pendingOrder("pi_theirs");

        OrderTransition transition = ledger.attachPaymentReference(5L, null, "pi_mine");

        assertFalse(transition.applied());
        assertEquals("pi_theirs", transition.order().getPaymentReference());
        assertEquals("pi_theirs", order.getPaymentReference());
        verify(orderRepository, never()).save(any(Order.class));
    }
}
