package com.collectiveip.ledger.ownership;

import com.collectiveip.core.exception.LedgerException;
import com.collectiveip.ledger.LedgerFixture;
import com.collectiveip.ledger.ownership.OwnershipLedger.OwnerShare;
import net.jqwik.api.*;
import net.jqwik.api.constraints.IntRange;
import net.jqwik.api.constraints.LongRange;
import net.jqwik.api.constraints.Size;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Property-based tests for share transfers.
 */
class OwnershipLedgerPropertyTest {

    private static final List<String> PARTIES = List.of(
            LedgerFixture.OWNER_1, LedgerFixture.OWNER_2, LedgerFixture.OWNER_3, LedgerFixture.OUTSIDER);

    record Transfer(int from, int to, int percentage) {}

    @Property(tries = 100)
    void transfers_preserveTotalPercentage(@ForAll @Size(max = 25) List<@From("transfers") Transfer> transfers) {
        LedgerFixture fixture = new LedgerFixture();
        OwnershipLedger ownership = fixture.ledger.ownership();
        long assetId = fixture.registerStandardAsset();

        for (Transfer transfer : transfers) {
            String from = PARTIES.get(transfer.from());
            String to = PARTIES.get(transfer.to());
            try {
                ownership.transferShare(from, assetId, from, to, transfer.percentage());
            } catch (LedgerException expected) {
                // rejected transfers must leave the set untouched, checked below
            }
            assertThat(ownership.owners(assetId).stream().mapToInt(OwnerShare::percentage).sum()).isEqualTo(100);
            assertThat(ownership.owners(assetId)).allSatisfy(share -> {
                assertThat(share.percentage()).isBetween(0, 100);
                assertThat(share.governanceWeight()).isNotNegative();
            });
        }
    }

    @Property(tries = 100)
    void transfer_neverMovesMoreWeightThanSenderHolds(
            @ForAll @IntRange(min = 1, max = 100) int percentage,
            @ForAll @LongRange(min = 0, max = 1_000_000) long weight) {
        LedgerFixture fixture = new LedgerFixture();
        OwnershipLedger ownership = fixture.ledger.ownership();
        long assetId = ownership.registerAsset(LedgerFixture.OWNER_1, "PATENT", "ipfs://asset",
                List.of(LedgerFixture.OWNER_1, LedgerFixture.OWNER_2), List.of(100, 0), List.of(weight, 0L));

        long moved = ownership.transferShare(LedgerFixture.OWNER_1, assetId,
                LedgerFixture.OWNER_1, LedgerFixture.OWNER_2, percentage);

        assertThat(moved).isLessThanOrEqualTo(weight);
        assertThat(moved).isEqualTo(weight * percentage / 100);
        assertThat(ownership.governanceWeightOf(assetId, LedgerFixture.OWNER_1) + moved).isEqualTo(weight);
        assertThat(ownership.totalGovernanceWeight(assetId)).isEqualTo(weight);
    }

    @Provide
    Arbitrary<Transfer> transfers() {
        Arbitrary<Integer> party = Arbitraries.integers().between(0, PARTIES.size() - 1);
        return Combinators.combine(party, party, Arbitraries.integers().between(1, 70)).as(Transfer::new);
    }
}
