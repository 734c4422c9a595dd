package com.vaultwave.backend.cart;

import com.vaultwave.backend.catalog.PricingModel;
import com.vaultwave.backend.catalog.Product;
import com.vaultwave.backend.catalog.ProductRepository;
import com.vaultwave.backend.exception.CurrencyMismatchException;
import com.vaultwave.backend.exception.InvalidPriceException;
import com.vaultwave.backend.library.LibraryEntryRepository;
import com.vaultwave.backend.order.OrderLine;
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
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Pre-checkout holding area. Prices shown here are a preview; the order ledger re-prices every
 * line when the order is created.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CartService {

    private final CartRepository cartRepository;
    private final ProductRepository productRepository;
    private final LibraryEntryRepository libraryEntryRepository;
    private final PricingResolver pricingResolver;

    @Value("${app.payments.currency:USD}")
    private String defaultCurrency;

    @Transactional
    public CartView view(User user) {
        return toView(getOrCreate(user));
    }

    /**
     * Add a product, or replace the price override if it is already in the cart.
     */
    @Transactional
    public CartView addItem(User user, Long productId, String rawOverride) {
        Product product = productRepository.findById(productId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Product not found: " + productId));
        if (!product.isActive()) {
            throw new IllegalArgumentException("Product '" + product.getName() + "' is not for sale");
        }
        if (libraryEntryRepository.existsByUserIdAndProductId(user.getId(), productId)) {
            throw new IllegalArgumentException("'" + product.getName() + "' is already in your library");
        }

        ResolvedPrice price = pricingResolver.resolve(product, rawOverride);
        Cart cart = getOrCreate(user);

        String cartCurrency = currencyOf(cart, productId);
        if (cartCurrency != null && price.currency() != null
                && !cartCurrency.equalsIgnoreCase(price.currency())) {
            throw new CurrencyMismatchException("Your cart is priced in " + cartCurrency
                    + " but '" + product.getName() + "' is priced in " + price.currency());
        }

        BigDecimal override = product.getPricingModel() == PricingModel.NAME_YOUR_PRICE ? price.amount() : null;
        CartItem item = cart.findItem(productId).orElseGet(() -> {
            CartItem created = new CartItem();
            created.setProduct(product);
            cart.addItem(created);
            return created;
        });
        item.setPriceOverride(override);

        Cart saved = cartRepository.save(cart);
        log.info("User {} added product {} to cart {} at {} {}", user.getId(), productId, saved.getId(), price.amount(), price.currency());
        return toView(saved);
    }

    @Transactional
    public CartView removeItem(User user, Long productId) {
        Cart cart = getOrCreate(user);
        boolean removed = cart.getItems().removeIf(i -> i.getProduct().getId().equals(productId));
        if (removed) {
            log.info("User {} removed product {} from cart", user.getId(), productId);
        }
        return toView(cartRepository.save(cart));
    }

    @Transactional
    public void clear(User user) {
        cartRepository.findByUserId(user.getId()).ifPresent(cart -> {
            cart.getItems().clear();
            cartRepository.save(cart);
        });
    }

    /** Current contents as order lines. Lines keep their stored override as the client value. */
    @Transactional(readOnly = true)
    public List<OrderLine> snapshot(User user) {
        return cartRepository.findByUserId(user.getId())
                .map(cart -> cart.getItems().stream()
                        .map(i -> OrderLine.of(i.getProduct().getId(),
                                i.getPriceOverride() != null ? i.getPriceOverride().toPlainString() : null))
                        .toList())
                .orElse(List.of());
    }

    private Cart getOrCreate(User user) {
        return cartRepository.findByUserId(user.getId())
                .orElseGet(() -> cartRepository.save(new Cart(user)));
    }

    // Currency of the other items in the cart, or null when none of them carries one
    private String currencyOf(Cart cart, Long excludingProductId) {
        return cart.getItems().stream()
                .filter(i -> !i.getProduct().getId().equals(excludingProductId))
                .map(i -> i.getProduct().getCurrency())
                .filter(Objects::nonNull)
                .map(c -> c.toUpperCase(Locale.ROOT))
                .findFirst()
                .orElse(null);
    }

    private CartView toView(Cart cart) {
        List<CartLine> lines = new ArrayList<>();
        BigDecimal total = BigDecimal.ZERO.setScale(2);
        String currency = null;

        for (CartItem item : cart.getItems()) {
            Product product = item.getProduct();
            ResolvedPrice price = null;
            if (product.isActive()) {
                try {
                    price = pricingResolver.resolve(product, item.getPriceOverride());
                } catch (InvalidPriceException e) {
                    log.warn("Cart {} item for product {} cannot be priced: {}", cart.getId(), product.getId(), e.getMessage());
                }
            }
            if (price != null) {
                total = total.add(price.amount());
                if (currency == null && price.currency() != null) currency = price.currency().toUpperCase(Locale.ROOT);
            }
            lines.add(new CartLine(item, product, price));
        }

        return new CartView(cart.getId(), lines, total, currency != null ? currency : defaultCurrency);
    }
}
