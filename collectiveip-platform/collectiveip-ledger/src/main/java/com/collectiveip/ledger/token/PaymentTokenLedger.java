package com.collectiveip.ledger.token;

import java.math.BigInteger;

/**
 * Allowance and transfer primitives of one payment currency.
 * <p>
 * Implementations raise {@link com.collectiveip.core.exception.InsufficientFundsException} when a
 * balance or allowance is too low and move nothing in that case.
 */
public interface PaymentTokenLedger {

    /**
     * Normalized address identifying the currency.
     */
    String currency();

    /**
     * Moves {@code amount} from {@code payer} to {@code recipient}, consuming the allowance
     * {@code payer} granted to {@code spender}.
     */
    void transferFrom(String spender, String payer, String recipient, BigInteger amount);

    void transfer(String sender, String recipient, BigInteger amount);

    BigInteger balanceOf(String holder);

    BigInteger allowance(String owner, String spender);
}
