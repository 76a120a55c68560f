package com.collectiveip.ledger.token;

import com.collectiveip.core.exception.ErrorReason;
import com.collectiveip.core.exception.ValidationException;
import com.collectiveip.core.support.Addresses;

import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of the payment-token ledgers the collective accepts, keyed by currency address.
 */
public class PaymentTokens {

    private final Map<String, PaymentTokenLedger> ledgers = new ConcurrentHashMap<>();

    public PaymentTokens register(PaymentTokenLedger ledger) {
        Objects.requireNonNull(ledger, "Ledger cannot be null");
        ledgers.put(Addresses.normalize(ledger.currency(), "currency"), ledger);
        return this;
    }

    /**
     * @throws ValidationException if the currency is malformed or not registered
     */
    public PaymentTokenLedger resolve(String currency) {
        String normalized = Addresses.normalize(currency, "currency");
        PaymentTokenLedger ledger = ledgers.get(normalized);
        if (ledger == null) {
            throw new ValidationException(ErrorReason.UNKNOWN_CURRENCY, "Unknown currency: " + normalized);
        }
        return ledger;
    }

    public boolean supports(String currency) {
        return Addresses.isValid(currency) && ledgers.containsKey(Addresses.normalize(currency, "currency"));
    }

    public Set<String> currencies() {
        return Set.copyOf(ledgers.keySet());
    }
}
