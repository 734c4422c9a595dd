package com.vaultwave.backend.order;

import com.vaultwave.backend.catalog.Product;
import com.vaultwave.backend.catalog.ProductRepository;
import com.vaultwave.backend.exception.CurrencyMismatchException;
import com.vaultwave.backend.exception.EmptyOrderException;
import com.vaultwave.backend.exception.OrderStateException;
import com.vaultwave.backend.library.EntitlementGrantor;
import com.vaultwave.backend.pricing.PricingResolver;
import com.vaultwave.backend.pricing.ResolvedPrice;
import com.vaultwave.backend.user.User;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.*;

/**
 * Authoritative order state machine.
 *
 * <p>All mutations load the order under a pessimistic row lock, so a redirect-return and a
 * webhook racing on the same order are serialised; the second caller sees the outcome of the
 * first.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OrderLedger {

    private final OrderRepository orderRepository;
    private final ProductRepository productRepository;
    private final PricingResolver pricingResolver;
    private final EntitlementGrantor entitlementGrantor;

    @Value("${app.payments.currency:USD}")
    private String defaultCurrency;

    /**
     * Create a PENDING order, re-pricing every line. Nothing is persisted unless every line
     * resolves.
     */
    @Transactional
    public Order create(User buyer, List<OrderLine> lines) {
        if (lines == null || lines.isEmpty()) {
            throw new EmptyOrderException("Cannot create an order without items");
        }

        Set<Long> seenProducts = new HashSet<>();
        Set<String> currencies = new LinkedHashSet<>();
        List<OrderItem> items = new ArrayList<>();
        BigDecimal total = BigDecimal.ZERO;

        for (OrderLine line : lines) {
            if (line.productId() == null) {
                throw new IllegalArgumentException("Order line is missing a product");
            }
            if (line.quantity() < 1) {
                throw new IllegalArgumentException("Quantity must be at least 1");
            }
            if (!seenProducts.add(line.productId())) {
                throw new IllegalArgumentException("Product " + line.productId() + " appears more than once");
            }

            Product product = productRepository.findById(line.productId())
                    .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Product not found: " + line.productId()));
            if (!product.isActive()) {
                throw new IllegalArgumentException("Product '" + product.getName() + "' is not for sale");
            }

            ResolvedPrice price = pricingResolver.resolve(product, line.priceOverride());
            if (price.currency() != null) {
                currencies.add(price.currency().toUpperCase(Locale.ROOT));
            }

            OrderItem item = OrderItem.builder()
                    .product(product)
                    .quantity(line.quantity())
                    .priceAtPurchase(price.amount())
                    .build();
            items.add(item);
            total = total.add(item.lineTotal());
        }

        if (currencies.size() > 1) {
            throw new CurrencyMismatchException("Items are priced in " + String.join(", ", currencies)
                    + "; please check out each currency separately");
        }
        String currency = currencies.isEmpty() ? defaultCurrency : currencies.iterator().next();

        Order order = Order.builder()
                .buyer(buyer)
                .totalAmount(total)
                .currency(currency)
                .status(OrderStatus.PENDING)
                .build();
        items.forEach(order::addItem);

        Order saved = orderRepository.save(order);
        log.info("Created order {} for user {}: {} item(s), total {} {}",
                saved.getId(), buyer.getId(), items.size(), total, currency);
        return saved;
    }

    /**
     * Mark an order COMPLETED and grant its entitlements in the same transaction.
     * Invoking this again for a completed order returns it untouched.
     *
     * @throws OrderStateException if the order already FAILED or was CANCELLED
     */
    @Transactional
    public OrderTransition complete(Long orderId, String paymentReference) {
        Order order = orderRepository.findByIdForUpdate(orderId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Order not found"));

        if (order.getStatus() == OrderStatus.COMPLETED) {
            log.info("Order {} already completed, ignoring repeated completion", orderId);
            return new OrderTransition(order, false);
        }
        if (!order.getStatus().canTransitionTo(OrderStatus.COMPLETED)) {
            throw new OrderStateException("Order " + orderId + " is " + order.getStatus() + " and cannot be completed");
        }
        if (order.getPaymentReference() != null && paymentReference != null
                && !order.getPaymentReference().equals(paymentReference)) {
            throw new OrderStateException("Payment reference does not match order " + orderId);
        }

        order.setStatus(OrderStatus.COMPLETED);
        if (paymentReference != null) {
            order.setPaymentReference(paymentReference);
        }
        order.setCompletedAt(Instant.now());
        orderRepository.save(order);

        entitlementGrantor.grant(order);
        log.info("Order {} completed (payment {})", orderId, order.getPaymentReference());
        return new OrderTransition(order, true);
    }

    /**
     * Record a declined or voided payment. Only PENDING orders move; a completed order is never
     * downgraded.
     */
    @Transactional
    public OrderTransition fail(Long orderId, String reason) {
        Order order = orderRepository.findByIdForUpdate(orderId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Order not found"));

        if (!order.getStatus().canTransitionTo(OrderStatus.FAILED)) {
            log.info("Order {} is {}, not marking as failed", orderId, order.getStatus());
            return new OrderTransition(order, false);
        }

        order.setStatus(OrderStatus.FAILED);
        order.setFailureReason(reason);
        orderRepository.save(order);
        log.info("Order {} failed: {}", orderId, reason);
        return new OrderTransition(order, true);
    }

    @Transactional
    public OrderTransition cancel(User buyer, Long orderId, String reason) {
        Order order = orderRepository.findByIdForUpdate(orderId)
                .filter(o -> o.getBuyer().getId().equals(buyer.getId()))
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Order not found"));

        if (order.getStatus() == OrderStatus.CANCELLED) {
            return new OrderTransition(order, false);
        }
        if (!order.getStatus().canTransitionTo(OrderStatus.CANCELLED)) {
            throw new OrderStateException("Order " + orderId + " is " + order.getStatus() + " and cannot be cancelled");
        }

        order.setStatus(OrderStatus.CANCELLED);
        order.setFailureReason(reason != null && !reason.isBlank() ? reason : "Cancelled by buyer");
        orderRepository.save(order);
        log.info("Order {} cancelled by user {}", orderId, buyer.getId());
        return new OrderTransition(order, true);
    }

    /**
     * Store the provider's intent id on a PENDING order, replacing {@code expectedReference}.
     *
     * <p>If the order no longer carries {@code expectedReference} another request attached an
     * intent first; the order is returned unchanged with {@code applied == false} and the caller
     * should continue with the reference it now holds.
     */
    @Transactional
    public OrderTransition attachPaymentReference(Long orderId, String expectedReference, String newReference) {
        Order order = orderRepository.findByIdForUpdate(orderId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Order not found"));
        if (order.getStatus() != OrderStatus.PENDING) {
            throw new OrderStateException("Order " + orderId + " is " + order.getStatus() + " and cannot be paid");
        }
        if (!Objects.equals(order.getPaymentReference(), expectedReference)) {
            log.info("Order {} now holds payment {}, not replacing it with {}",
                    orderId, order.getPaymentReference(), newReference);
            return new OrderTransition(order, false);
        }
        order.setPaymentReference(newReference);
        return new OrderTransition(orderRepository.save(order), true);
    }

    @Transactional(readOnly = true)
    public Order get(User buyer, Long orderId) {
        return orderRepository.findByIdAndBuyerId(orderId, buyer.getId())
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Order not found"));
    }

    @Transactional(readOnly = true)
    public List<Order> list(User buyer) {
        return orderRepository.findAllByBuyerIdOrderByCreatedAtDesc(buyer.getId());
    }
}
