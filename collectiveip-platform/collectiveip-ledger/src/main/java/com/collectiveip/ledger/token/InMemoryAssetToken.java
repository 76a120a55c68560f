package com.collectiveip.ledger.token;

import java.math.BigInteger;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Asset-token balances held in memory.
 */
public class InMemoryAssetToken implements AssetTokenLedger {

    private record Holding(String holder, long assetId) {}

    private final Map<Holding, BigInteger> balances = new ConcurrentHashMap<>();

    @Override
    public void mint(String recipient, long assetId, BigInteger amount) {
        if (amount.signum() <= 0) {
            throw new IllegalArgumentException("Mint amount must be positive");
        }
        balances.merge(new Holding(recipient, assetId), amount, BigInteger::add);
    }

    @Override
    public BigInteger balanceOf(String holder, long assetId) {
        return balances.getOrDefault(new Holding(holder, assetId), BigInteger.ZERO);
    }
}
