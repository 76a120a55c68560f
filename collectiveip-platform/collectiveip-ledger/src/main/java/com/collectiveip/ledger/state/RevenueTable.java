package com.collectiveip.ledger.state;

import com.collectiveip.core.domain.PendingBalance;
import com.collectiveip.core.domain.RevenueAccount;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Revenue accounts per (asset, currency) and pending balances per (asset, owner, currency).
 */
public class RevenueTable {

    private record AccountKey(long assetId, String currency) {}

    private record BalanceKey(long assetId, String owner, String currency) {}

    private final Map<AccountKey, RevenueAccount> accounts;
    private final Map<BalanceKey, PendingBalance> balances;

    public RevenueTable() {
        this.accounts = new LinkedHashMap<>();
        this.balances = new LinkedHashMap<>();
    }

    public Optional<RevenueAccount> account(long assetId, String currency) {
        return Optional.ofNullable(accounts.get(new AccountKey(assetId, currency)));
    }

    public RevenueAccount accountOrOpen(long assetId, String currency) {
        return accounts.computeIfAbsent(new AccountKey(assetId, currency),
                key -> RevenueAccount.open(assetId, currency));
    }

    public Optional<PendingBalance> balance(long assetId, String owner, String currency) {
        return Optional.ofNullable(balances.get(new BalanceKey(assetId, owner, currency)));
    }

    public PendingBalance balanceOrOpen(long assetId, String owner, String currency) {
        return balances.computeIfAbsent(new BalanceKey(assetId, owner, currency),
                key -> PendingBalance.open(assetId, owner, currency));
    }

    public RevenueTable copy() {
        var copy = new RevenueTable();
        accounts.forEach((key, account) -> copy.accounts.put(key, account.copy()));
        balances.forEach((key, balance) -> copy.balances.put(key, balance.copy()));
        return copy;
    }
}
