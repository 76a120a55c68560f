package com.collectiveip.ledger.revenue;

import com.collectiveip.core.domain.LicenseType;
import com.collectiveip.core.domain.RevenueAccount;
import com.collectiveip.core.exception.ErrorReason;
import com.collectiveip.ledger.LedgerFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static com.collectiveip.ledger.LedgerFixture.*;
import static org.assertj.core.api.Assertions.assertThat;

class RevenuePoolTest {

    private LedgerFixture fixture;
    private RevenuePool revenue;
    private long assetId;

    @BeforeEach
    void setUp() {
        fixture = new LedgerFixture();
        revenue = fixture.ledger.revenue();
        assetId = fixture.registerStandardAsset();
        fixture.fund(OUTSIDER, 100_000);
    }

    @Test
    void receiveRevenue_pullsFundsIntoPool() {
        revenue.receiveRevenue(OUTSIDER, assetId, CURRENCY, units(1_000));

        RevenueAccount account = revenue.account(assetId, CURRENCY).orElseThrow();
        assertThat(account.getTotalReceived()).isEqualTo(units(1_000));
        assertThat(account.getAccumulated()).isEqualTo(units(1_000));
        assertThat(fixture.paymentToken.balanceOf(POOL)).isEqualTo(units(1_000));
        assertThat(fixture.paymentToken.balanceOf(OUTSIDER)).isEqualTo(units(99_000));
    }

    @Test
    void receiveRevenue_rejectsBadInput() {
        assertFails(ErrorReason.NON_POSITIVE_AMOUNT, () -> revenue.receiveRevenue(OUTSIDER, assetId, CURRENCY, BigInteger.ZERO));
        assertFails(ErrorReason.ASSET_NOT_FOUND, () -> revenue.receiveRevenue(OUTSIDER, 42L, CURRENCY, units(1)));
        assertFails(ErrorReason.UNKNOWN_CURRENCY, () -> revenue.receiveRevenue(OUTSIDER, assetId,
                "0x00000000000000000000000000000000000c0002", units(1)));
        assertFails(ErrorReason.INSUFFICIENT_ALLOWANCE, () -> revenue.receiveRevenue(LICENSEE, assetId, CURRENCY, units(1)));
        assertThat(revenue.account(assetId, CURRENCY)).isEmpty();
    }

    @Test
    void distributeRevenue_splitsAfterTransfer() {
        fixture.ledger.ownership().transferShare(OWNER_1, assetId, OWNER_1, OWNER_2, 10);
        revenue.receiveRevenue(OUTSIDER, assetId, CURRENCY, units(1_000));

        DistributionSummary summary = revenue.distributeAllRevenue(OWNER_1, assetId, CURRENCY);

        assertThat(summary.distributed()).isEqualTo(units(1_000));
        assertThat(summary.residue()).isZero();
        assertThat(revenue.pendingRevenue(assetId, OWNER_1, CURRENCY)).isEqualTo(units(500));
        assertThat(revenue.pendingRevenue(assetId, OWNER_2, CURRENCY)).isEqualTo(units(400));
        assertThat(revenue.pendingRevenue(assetId, OWNER_3, CURRENCY)).isEqualTo(units(100));
        RevenueAccount account = revenue.account(assetId, CURRENCY).orElseThrow();
        assertThat(account.getAccumulated()).isZero();
        assertThat(account.getTotalDistributed()).isEqualTo(units(1_000));
        assertThat(account.getDistributionCount()).isEqualTo(1L);
    }

    @Test
    void routedLicenseFee_isCountedApartFromDistributions() {
        fixture.fund(LICENSEE, 1_000);
        long licenseId = fixture.ledger.licenses().createOffer(OWNER_1, offer(assetId, LicenseType.NON_EXCLUSIVE, 500, 0, 0));
        fixture.ledger.licenses().execute(LICENSEE, licenseId);

        RevenueAccount afterFee = revenue.account(assetId, CURRENCY).orElseThrow();
        assertThat(afterFee.getRoutedPaymentCount()).isEqualTo(1L);
        assertThat(afterFee.getDistributionCount()).isZero();
        assertThat(afterFee.getLastDistributionAt()).isZero();
        assertThat(afterFee.getTotalDistributed()).isEqualTo(units(500));

        revenue.receiveRevenue(OUTSIDER, assetId, CURRENCY, units(1_000));
        revenue.distributeAllRevenue(OWNER_2, assetId, CURRENCY);

        RevenueAccount account = revenue.account(assetId, CURRENCY).orElseThrow();
        assertThat(account.getRoutedPaymentCount()).isEqualTo(1L);
        assertThat(account.getDistributionCount()).isEqualTo(1L);
        assertThat(account.getTotalReceived()).isEqualTo(units(1_500));
        assertThat(account.getAccumulated()).isZero();
    }

    @Test
    void distributeRevenue_keepsRoundingResidueInPool() {
        revenue.receiveRevenue(OUTSIDER, assetId, CURRENCY, units(999));

        DistributionSummary summary = revenue.distributeRevenue(OWNER_2, assetId, CURRENCY, units(999));

        // 599 + 299 + 99
        assertThat(summary.distributed()).isEqualTo(units(997));
        assertThat(summary.residue()).isEqualTo(units(2));
        assertThat(revenue.account(assetId, CURRENCY).orElseThrow().getAccumulated()).isEqualTo(units(2));
    }

    @Test
    void distributeRevenue_enforcesOwnershipBalanceAndMinimum() {
        revenue.receiveRevenue(OUTSIDER, assetId, CURRENCY, units(100));
        revenue.setMinimumDistribution(OWNER_1, assetId, CURRENCY, units(50));

        assertFails(ErrorReason.NOT_ASSET_OWNER, () -> revenue.distributeRevenue(OUTSIDER, assetId, CURRENCY, units(60)));
        assertFails(ErrorReason.NON_POSITIVE_AMOUNT, () -> revenue.distributeRevenue(OWNER_1, assetId, CURRENCY, BigInteger.ZERO));
        assertFails(ErrorReason.INSUFFICIENT_ACCUMULATED_REVENUE,
                () -> revenue.distributeRevenue(OWNER_1, assetId, CURRENCY, units(101)));
        assertFails(ErrorReason.BELOW_MINIMUM_DISTRIBUTION,
                () -> revenue.distributeRevenue(OWNER_1, assetId, CURRENCY, units(49)));

        revenue.distributeRevenue(OWNER_1, assetId, CURRENCY, units(50));
        assertThat(revenue.account(assetId, CURRENCY).orElseThrow().getAccumulated()).isEqualTo(units(50));
    }

    @Test
    void distributeAllRevenue_isNoOpWhenNothingAccumulated() {
        DistributionSummary summary = revenue.distributeAllRevenue(OWNER_1, assetId, CURRENCY);

        assertThat(summary.credits()).isEmpty();
        assertThat(summary.distributed()).isZero();
        assertThat(revenue.account(assetId, CURRENCY)).isEmpty();
    }

    @Test
    void withdrawPendingRevenue_paysOnceThenFails() {
        revenue.receiveRevenue(OUTSIDER, assetId, CURRENCY, units(1_000));
        revenue.distributeAllRevenue(OWNER_1, assetId, CURRENCY);

        BigInteger paid = revenue.withdrawPendingRevenue(OWNER_1, assetId, CURRENCY);

        assertThat(paid).isEqualTo(units(600));
        assertThat(fixture.paymentToken.balanceOf(OWNER_1)).isEqualTo(units(600));
        assertThat(revenue.pendingRevenue(assetId, OWNER_1, CURRENCY)).isZero();
        assertThat(revenue.earnings(assetId, OWNER_1, CURRENCY).totalWithdrawn()).isEqualTo(units(600));
        assertFails(ErrorReason.NOTHING_TO_WITHDRAW, () -> revenue.withdrawPendingRevenue(OWNER_1, assetId, CURRENCY));
        assertFails(ErrorReason.NOT_ASSET_OWNER, () -> revenue.withdrawPendingRevenue(OUTSIDER, assetId, CURRENCY));
    }

    @Test
    void withdrawPendingRevenue_remainsAvailableAfterShareDropsToZero() {
        revenue.receiveRevenue(OUTSIDER, assetId, CURRENCY, units(1_000));
        revenue.distributeAllRevenue(OWNER_1, assetId, CURRENCY);
        fixture.ledger.ownership().transferShare(OWNER_3, assetId, OWNER_3, OWNER_1, 10);

        assertThat(revenue.withdrawPendingRevenue(OWNER_3, assetId, CURRENCY)).isEqualTo(units(100));
    }

    @Test
    void setMinimumDistribution_isOwnerGated() {
        assertFails(ErrorReason.NOT_ASSET_OWNER, () -> revenue.setMinimumDistribution(OUTSIDER, assetId, CURRENCY, units(1)));
        assertFails(ErrorReason.NEGATIVE_AMOUNT, () -> revenue.setMinimumDistribution(OWNER_1, assetId, CURRENCY, units(-1)));
    }
}
