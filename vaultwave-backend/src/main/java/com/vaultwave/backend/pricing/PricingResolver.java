package com.vaultwave.backend.pricing;

import com.vaultwave.backend.catalog.PricingModel;
import com.vaultwave.backend.catalog.Product;
import com.vaultwave.backend.exception.InvalidPriceException;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Computes what a product costs. Called once when an item is added to a cart and again,
 * authoritatively, when the order is created; both calls must agree, so this class holds no
 * state and never looks at the clock.
 */
@Component
public class PricingResolver {

    private static final int MONEY_SCALE = 2;

    /**
     * Resolve from a raw client value, as received in a request body.
     *
     * @param rawOverride client-supplied amount, only honoured for name-your-price products
     * @throws InvalidPriceException when the amount cannot be accepted
     */
    public ResolvedPrice resolve(Product product, String rawOverride) {
        if (product.getPricingModel() != PricingModel.NAME_YOUR_PRICE) {
            return resolve(product, (BigDecimal) null);
        }
        if (rawOverride == null || rawOverride.isBlank()) {
            throw new InvalidPriceException("Price must be specified for name-your-price item '" + product.getName() + "'");
        }
        BigDecimal parsed;
        try {
            parsed = new BigDecimal(rawOverride.trim());
        } catch (NumberFormatException e) {
            throw new InvalidPriceException("Price '" + rawOverride + "' is not a number");
        }
        return resolve(product, parsed);
    }

    /**
     * @param override client-supplied amount; ignored for FREE and PAID products
     * @throws InvalidPriceException when the amount cannot be accepted
     */
    public ResolvedPrice resolve(Product product, BigDecimal override) {
        PricingModel model = product.getPricingModel();
        if (model == null) {
            throw new InvalidPriceException("Product '" + product.getName() + "' has no pricing model");
        }

        switch (model) {
            case FREE:
                return new ResolvedPrice(BigDecimal.ZERO.setScale(MONEY_SCALE), product.getCurrency());

            case PAID: {
                BigDecimal base = product.getBasePrice();
                if (base == null || base.signum() <= 0 || isBlank(product.getCurrency())) {
                    throw new InvalidPriceException("Product '" + product.getName() + "' is not correctly priced");
                }
                return new ResolvedPrice(base.setScale(MONEY_SCALE, RoundingMode.HALF_UP), product.getCurrency());
            }

            case NAME_YOUR_PRICE: {
                if (isBlank(product.getCurrency())) {
                    throw new InvalidPriceException("Product '" + product.getName() + "' has no currency");
                }
                if (override == null) {
                    throw new InvalidPriceException("Price must be specified for name-your-price item '" + product.getName() + "'");
                }
                if (override.signum() < 0) {
                    throw new InvalidPriceException("Price cannot be negative");
                }
                if (override.stripTrailingZeros().scale() > MONEY_SCALE) {
                    throw new InvalidPriceException("Price " + override.toPlainString() + " has too many decimal places");
                }
                BigDecimal minimum = product.getMinimumPrice() != null ? product.getMinimumPrice() : BigDecimal.ZERO;
                if (override.compareTo(minimum) < 0) {
                    throw new InvalidPriceException("Entered price " + override.toPlainString() + " " + product.getCurrency()
                            + " is below the minimum of " + minimum.toPlainString() + " " + product.getCurrency());
                }
                return new ResolvedPrice(override.setScale(MONEY_SCALE, RoundingMode.UNNECESSARY), product.getCurrency());
            }

            default:
                throw new InvalidPriceException("Unsupported pricing model: " + model);
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
