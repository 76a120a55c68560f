package com.collectiveip.api.token;

import com.collectiveip.core.exception.ErrorReason;
import com.collectiveip.core.exception.ValidationException;
import com.collectiveip.core.support.Addresses;
import com.collectiveip.ledger.kernel.CollectiveLedger;
import com.collectiveip.ledger.kernel.Guards;
import com.collectiveip.ledger.kernel.LedgerConfiguration;
import com.collectiveip.ledger.token.InMemoryPaymentToken;
import com.collectiveip.ledger.token.PaymentTokenLedger;
import com.collectiveip.ledger.token.PaymentTokens;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigInteger;

/**
 * Funding and allowances on the in-memory payment tokens backing the ledger.
 * The pool is always the spender of an allowance.
 */
@Service
public class TokenService {

    private static final Logger log = LoggerFactory.getLogger(TokenService.class);

    private final PaymentTokens paymentTokens;
    private final LedgerConfiguration configuration;

    public TokenService(PaymentTokens paymentTokens, CollectiveLedger ledger) {
        this.paymentTokens = paymentTokens;
        this.configuration = ledger.configuration();
    }

    public record Position(String currency, String holder, BigInteger balance, BigInteger poolAllowance) {}

    /**
     * Credits fresh tokens. Administrator only.
     */
    public Position mint(String caller, String currency, String recipient, BigInteger amount) {
        String actor = Guards.caller(caller);
        Guards.requireAdministrator(configuration, actor);
        Guards.requirePositive(amount, "Amount");
        InMemoryPaymentToken token = mintable(currency);
        token.mint(recipient, amount);
        log.info("Minted {} of {} to {}", amount, token.currency(), recipient);
        return position(currency, recipient);
    }

    /**
     * Sets the allowance the caller grants the pool, replacing any previous one.
     */
    public Position approvePool(String caller, String currency, BigInteger amount) {
        String owner = Guards.caller(caller);
        Guards.requireNonNegative(amount, "Amount");
        InMemoryPaymentToken token = mintable(currency);
        token.approve(owner, configuration.poolAddress(), amount);
        log.debug("{} approved pool for {} of {}", owner, amount, token.currency());
        return position(currency, owner);
    }

    public Position position(String currency, String holder) {
        PaymentTokenLedger token = paymentTokens.resolve(currency);
        String normalized = Addresses.normalize(holder, "holder");
        return new Position(token.currency(), normalized, token.balanceOf(normalized),
                token.allowance(normalized, configuration.poolAddress()));
    }

    private InMemoryPaymentToken mintable(String currency) {
        if (paymentTokens.resolve(currency) instanceof InMemoryPaymentToken token) {
            return token;
        }
        throw new ValidationException(ErrorReason.UNKNOWN_CURRENCY, currency + " is not an in-memory token");
    }
}
