package com.vaultwave.backend.payment;

import java.util.Optional;

/**
 * Outbound calls to the payment provider. Implementations may throw any runtime exception on
 * transport or provider errors; the adapter treats those as the provider being unavailable.
 */
public interface PaymentProviderClient {

    /** Short provider code stored on sessions, e.g. "local". */
    String name();

    PaymentIntent createIntent(PaymentIntentRequest request);

    Optional<PaymentIntent> findIntent(String intentId);
}
