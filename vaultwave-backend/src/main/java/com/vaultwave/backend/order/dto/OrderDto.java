package com.vaultwave.backend.order.dto;

import com.vaultwave.backend.order.Order;
import com.vaultwave.backend.order.OrderItem;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

public record OrderDto(
        Long id,
        String status,
        BigDecimal totalAmount,
        String currency,
        String paymentReference,
        String failureReason,
        Instant createdAt,
        Instant updatedAt,
        Instant completedAt,
        List<Line> items
) {
    public record Line(Long productId, String productName, int quantity, BigDecimal priceAtPurchase, BigDecimal lineTotal) {
        static Line from(OrderItem item) {
            return new Line(
                    item.getProduct().getId(),
                    item.getProduct().getName(),
                    item.getQuantity(),
                    item.getPriceAtPurchase(),
                    item.lineTotal()
            );
        }
    }

    public static OrderDto from(Order order) {
        return new OrderDto(
                order.getId(),
                order.getStatus().name(),
                order.getTotalAmount(),
                order.getCurrency(),
                order.getPaymentReference(),
                order.getFailureReason(),
                order.getCreatedAt(),
                order.getUpdatedAt(),
                order.getCompletedAt(),
                order.getItems().stream().map(Line::from).toList()
        );
    }
}
