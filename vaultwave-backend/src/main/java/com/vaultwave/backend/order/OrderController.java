package com.vaultwave.backend.order;

import com.vaultwave.backend.order.dto.CancelOrderRequest;
import com.vaultwave.backend.order.dto.CreateOrderRequest;
import com.vaultwave.backend.order.dto.OrderDto;
import com.vaultwave.backend.payment.PaymentGatewayAdapter;
import com.vaultwave.backend.payment.dto.PaymentSession;
import com.vaultwave.backend.user.CurrentUserService;
import com.vaultwave.backend.user.User;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/orders")
@RequiredArgsConstructor
@Slf4j
public class OrderController {

    private final OrderLedger orderLedger;
    private final PaymentGatewayAdapter paymentGatewayAdapter;
    private final CurrentUserService currentUserService;

    @PostMapping
    public ResponseEntity<OrderDto> create(@Valid @RequestBody CreateOrderRequest request) {
        User buyer = currentUserService.getCurrentUserOrThrow();
        List<OrderLine> lines = request.getItems() == null ? List.of() : request.getItems().stream()
                .map(i -> new OrderLine(i.getProductId(), i.getPriceOverride(), i.getQuantity() != null ? i.getQuantity() : 1))
                .toList();

        Order order = orderLedger.create(buyer, lines);
        return ResponseEntity.status(HttpStatus.CREATED).body(OrderDto.from(order));
    }

    @GetMapping
    public List<OrderDto> list() {
        return orderLedger.list(currentUserService.getCurrentUserOrThrow()).stream()
                .map(OrderDto::from)
                .toList();
    }

    @GetMapping("/{id}")
    public OrderDto get(@PathVariable Long id) {
        return OrderDto.from(orderLedger.get(currentUserService.getCurrentUserOrThrow(), id));
    }

    @PostMapping("/{id}/cancel")
    public OrderDto cancel(@PathVariable Long id, @RequestBody(required = false) CancelOrderRequest request) {
        User buyer = currentUserService.getCurrentUserOrThrow();
        return OrderDto.from(orderLedger.cancel(buyer, id, request != null ? request.reason() : null).order());
    }

    @PostMapping("/{id}/pay")
    public PaymentSession pay(@PathVariable Long id) {
        User buyer = currentUserService.getCurrentUserOrThrow();
        Order order = orderLedger.get(buyer, id);
        return paymentGatewayAdapter.initiate(order);
    }
}
