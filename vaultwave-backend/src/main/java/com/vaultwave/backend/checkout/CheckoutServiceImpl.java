package com.vaultwave.backend.checkout;

import com.vaultwave.backend.cart.CartService;
import com.vaultwave.backend.checkout.dto.CheckoutRequest;
import com.vaultwave.backend.checkout.dto.CheckoutResult;
import com.vaultwave.backend.order.Order;
import com.vaultwave.backend.order.OrderLedger;
import com.vaultwave.backend.order.OrderLine;
import com.vaultwave.backend.order.dto.OrderDto;
import com.vaultwave.backend.payment.PaymentGatewayAdapter;
import com.vaultwave.backend.payment.dto.PaymentSession;
import com.vaultwave.backend.user.User;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Turns the cart into a PENDING order. Not one transaction: the order is committed
 * first, and the cart is only emptied once that has succeeded.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CheckoutServiceImpl implements CheckoutService {

    private final CartService cartService;
    private final OrderLedger orderLedger;
    private final PaymentGatewayAdapter paymentGatewayAdapter;

    @Override
    public CheckoutResult checkout(User user, CheckoutRequest request) {
        List<OrderLine> lines = cartService.snapshot(user);
        log.info("[CHECKOUT] User {} checking out {} cart line(s)", user.getId(), lines.size());

        Order order = orderLedger.create(user, lines);
        cartService.clear(user);

        PaymentSession payment = null;
        if (request != null && request.isStartPayment()) {
            payment = paymentGatewayAdapter.initiate(order);
            if (!payment.isRequiresRedirect()) {
                order = orderLedger.get(user, order.getId());
            }
        }

        return CheckoutResult.builder()
                .order(OrderDto.from(order))
                .payment(payment)
                .build();
    }
}
