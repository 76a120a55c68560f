package com.collectiveip.ledger.token;

import java.math.BigInteger;

/**
 * Fungible per-asset token balances. The ledger only mints; transfers happen elsewhere.
 */
public interface AssetTokenLedger {

    void mint(String recipient, long assetId, BigInteger amount);

    BigInteger balanceOf(String holder, long assetId);
}
