package com.collectiveip.ledger.token;

import com.collectiveip.core.exception.ErrorReason;
import com.collectiveip.core.exception.InsufficientFundsException;
import com.collectiveip.core.support.Addresses;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;

/**
 * ERC-20 style payment token held in memory. Each transfer either moves the full amount or
 * nothing.
 */
public class InMemoryPaymentToken implements PaymentTokenLedger {

    private record Allowance(String owner, String spender) {}

    private final String currency;
    private final Map<String, BigInteger> balances = new HashMap<>();
    private final Map<Allowance, BigInteger> allowances = new HashMap<>();

    public InMemoryPaymentToken(String currency) {
        this.currency = Addresses.normalize(currency, "currency");
    }

    @Override
    public String currency() {
        return currency;
    }

    public synchronized void mint(String recipient, BigInteger amount) {
        requirePositive(amount);
        balances.merge(Addresses.normalize(recipient, "recipient"), amount, BigInteger::add);
    }

    public synchronized void approve(String owner, String spender, BigInteger amount) {
        if (amount.signum() < 0) {
            throw new IllegalArgumentException("Allowance cannot be negative");
        }
        allowances.put(new Allowance(Addresses.normalize(owner, "owner"), Addresses.normalize(spender, "spender")), amount);
    }

    @Override
    public synchronized void transferFrom(String spender, String payer, String recipient, BigInteger amount) {
        requirePositive(amount);
        var key = new Allowance(Addresses.normalize(payer, "payer"), Addresses.normalize(spender, "spender"));
        BigInteger allowed = allowances.getOrDefault(key, BigInteger.ZERO);
        if (allowed.compareTo(amount) < 0) {
            throw new InsufficientFundsException(ErrorReason.INSUFFICIENT_ALLOWANCE,
                    "Allowance " + allowed + " of " + key.owner() + " is below " + amount);
        }
        move(key.owner(), Addresses.normalize(recipient, "recipient"), amount);
        allowances.put(key, allowed.subtract(amount));
    }

    @Override
    public synchronized void transfer(String sender, String recipient, BigInteger amount) {
        requirePositive(amount);
        move(Addresses.normalize(sender, "sender"), Addresses.normalize(recipient, "recipient"), amount);
    }

    @Override
    public synchronized BigInteger balanceOf(String holder) {
        return balances.getOrDefault(Addresses.normalize(holder, "holder"), BigInteger.ZERO);
    }

    @Override
    public synchronized BigInteger allowance(String owner, String spender) {
        return allowances.getOrDefault(
                new Allowance(Addresses.normalize(owner, "owner"), Addresses.normalize(spender, "spender")),
                BigInteger.ZERO);
    }

    private void move(String from, String to, BigInteger amount) {
        BigInteger available = balances.getOrDefault(from, BigInteger.ZERO);
        if (available.compareTo(amount) < 0) {
            throw new InsufficientFundsException(ErrorReason.INSUFFICIENT_BALANCE,
                    "Balance " + available + " of " + from + " is below " + amount);
        }
        balances.put(from, available.subtract(amount));
        balances.merge(to, amount, BigInteger::add);
    }

    private static void requirePositive(BigInteger amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("Transfer amount must be positive");
        }
    }
}
