package com.vaultwave.backend.library;

import com.vaultwave.backend.catalog.PricingModel;
import com.vaultwave.backend.catalog.Product;
import com.vaultwave.backend.catalog.ProductRepository;
import com.vaultwave.backend.order.Order;
import com.vaultwave.backend.order.OrderItem;
import com.vaultwave.backend.order.OrderStatus;
import com.vaultwave.backend.user.User;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

import java.math.BigDecimal;

/**
 * The only writer of {@link LibraryEntry} rows. Granting is insert-if-absent, so replaying a
 * grant for the same order changes nothing.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EntitlementGrantor {

    private final LibraryEntryRepository libraryEntryRepository;
    private final ProductRepository productRepository;

    /**
     * Materialise one entry per line of a completed order.
     *
     * <p>Runs inside the caller's transaction so the entries commit together with the
     * order's status flip, or not at all.
     *
     * @return number of entries actually created
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public int grant(Order order) {
        if (order.getStatus() != OrderStatus.COMPLETED) {
            throw new IllegalStateException("Cannot grant entitlements for order " + order.getId()
                    + " in status " + order.getStatus());
        }

        User buyer = order.getBuyer();
        int created = 0;
        for (OrderItem item : order.getItems()) {
            Product product = item.getProduct();
            if (libraryEntryRepository.existsByUserIdAndProductId(buyer.getId(), product.getId())) {
                log.debug("User {} already owns product {}, skipping", buyer.getId(), product.getId());
                continue;
            }

            LibraryEntry entry = new LibraryEntry();
            entry.setUser(buyer);
            entry.setProduct(product);
            entry.setRelease(product.getRelease());
            entry.setAcquisitionType(acquisitionTypeFor(product));
            entry.setPricePaid(item.getPriceAtPurchase());
            entry.setCurrency(order.getCurrency());
            entry.setSourceOrderId(order.getId());
            libraryEntryRepository.save(entry);
            created++;
        }

        log.info("Granted {} library entries for order {} (buyer {})", created, order.getId(), buyer.getId());
        return created;
    }

    /**
     * Add a FREE release to a user's library without going through checkout.
     */
    @Transactional
    public LibraryEntry acquireFree(User user, Long releaseId) {
        Product product = productRepository.findByReleaseId(releaseId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Release not found"));

        if (!product.isActive() || !product.getRelease().isPublished()) {
            throw new IllegalArgumentException("This release cannot be added to the library at this time");
        }
        if (product.getPricingModel() != PricingModel.FREE) {
            throw new IllegalArgumentException("Priced releases are added to the library on purchase");
        }

        return libraryEntryRepository.findByUserIdAndProductId(user.getId(), product.getId())
                .orElseGet(() -> {
                    LibraryEntry entry = new LibraryEntry();
                    entry.setUser(user);
                    entry.setProduct(product);
                    entry.setRelease(product.getRelease());
                    entry.setAcquisitionType(AcquisitionType.FREE);
                    entry.setPricePaid(BigDecimal.ZERO);
                    entry.setCurrency(product.getCurrency());
                    log.info("User {} acquired free release {}", user.getId(), releaseId);
                    return libraryEntryRepository.save(entry);
                });
    }

    static AcquisitionType acquisitionTypeFor(Product product) {
        return switch (product.getPricingModel()) {
            case FREE -> AcquisitionType.FREE;
            case PAID -> AcquisitionType.PURCHASED;
            case NAME_YOUR_PRICE -> AcquisitionType.NYP;
        };
    }
}
