package com.collectiveip.ledger.kernel;

import com.collectiveip.core.domain.LicenseType;
import com.collectiveip.core.exception.ErrorReason;
import com.collectiveip.core.exception.LedgerException;
import com.collectiveip.ledger.LedgerFixture;
import com.collectiveip.ledger.event.LedgerEvent;
import com.collectiveip.ledger.event.LedgerEventType;
import com.collectiveip.ledger.revenue.RevenuePool;
import com.collectiveip.ledger.token.InMemoryPaymentToken;
import com.collectiveip.ledger.token.PaymentTokenLedger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

import static com.collectiveip.ledger.LedgerFixture.*;
import static org.assertj.core.api.Assertions.assertThat;

class CollectiveLedgerTest {

    // ==================== Pause control ====================

    @Nested
    class PauseControl {

        private LedgerFixture fixture;

        @BeforeEach
        void setUp() {
            fixture = new LedgerFixture();
        }

        @Test
        void administratorPausesAndUnpauses() {
            long assetId = fixture.registerStandardAsset();

            fixture.ledger.pause(ADMIN);

            assertThat(fixture.ledger.isPaused()).isTrue();
            assertFails(ErrorReason.SYSTEM_PAUSED, fixture::registerStandardAsset);
            assertFails(ErrorReason.SYSTEM_PAUSED, () -> fixture.ledger.pause(ADMIN));
            assertThat(fixture.ledger.ownership().percentageOf(assetId, OWNER_1)).isEqualTo(60);

            fixture.ledger.unpause(ADMIN);

            assertThat(fixture.ledger.isPaused()).isFalse();
            assertThat(fixture.registerStandardAsset()).isEqualTo(2L);
        }

        @Test
        void pauseControl_isAdministratorOnly() {
            assertFails(ErrorReason.NOT_ADMINISTRATOR, () -> fixture.ledger.pause(OWNER_1));
            assertFails(ErrorReason.SYSTEM_NOT_PAUSED, () -> fixture.ledger.unpause(ADMIN));
            assertFails(ErrorReason.INVALID_ADDRESS, () -> fixture.ledger.pause("admin"));
        }
    }

    // ==================== Reentrancy ====================

    /**
     * Payment token that runs a callback before every outgoing transfer.
     */
    static class CallbackPaymentToken implements PaymentTokenLedger {

        final InMemoryPaymentToken delegate = new InMemoryPaymentToken(CURRENCY);
        Runnable beforeTransfer = () -> { };

        @Override
        public String currency() {
            return delegate.currency();
        }

        @Override
        public void transferFrom(String spender, String payer, String recipient, BigInteger amount) {
            beforeTransfer.run();
            delegate.transferFrom(spender, payer, recipient, amount);
        }

        @Override
        public void transfer(String sender, String recipient, BigInteger amount) {
            beforeTransfer.run();
            delegate.transfer(sender, recipient, amount);
        }

        @Override
        public BigInteger balanceOf(String holder) {
            return delegate.balanceOf(holder);
        }

        @Override
        public BigInteger allowance(String owner, String spender) {
            return delegate.allowance(owner, spender);
        }
    }

    @Nested
    class Reentrancy {

        private CallbackPaymentToken token;
        private LedgerFixture fixture;
        private RevenuePool revenue;
        private long assetId;

        @BeforeEach
        void setUp() {
            token = new CallbackPaymentToken();
            fixture = new LedgerFixture(token);
            revenue = fixture.ledger.revenue();
            assetId = fixture.registerStandardAsset();
            token.delegate.mint(OUTSIDER, units(1_000));
            token.delegate.approve(OUTSIDER, POOL, units(1_000));
            revenue.receiveRevenue(OUTSIDER, assetId, CURRENCY, units(1_000));
            revenue.distributeAllRevenue(OWNER_1, assetId, CURRENCY);
        }

        @Test
        void reentrantWithdrawal_failsAndRollsBack() {
            token.beforeTransfer = () -> revenue.withdrawPendingRevenue(OWNER_1, assetId, CURRENCY);

            assertFails(ErrorReason.REENTRANT_CALL, () -> revenue.withdrawPendingRevenue(OWNER_1, assetId, CURRENCY));

            assertThat(revenue.pendingRevenue(assetId, OWNER_1, CURRENCY)).isEqualTo(units(600));
            assertThat(token.balanceOf(OWNER_1)).isZero();
            assertThat(token.balanceOf(POOL)).isEqualTo(units(1_000));
        }

        @Test
        void swallowedReentry_cannotPayTwice() {
            List<LedgerException> rejected = new ArrayList<>();
            token.beforeTransfer = () -> {
                try {
                    revenue.withdrawPendingRevenue(OWNER_1, assetId, CURRENCY);
                } catch (LedgerException e) {
                    rejected.add(e);
                }
            };

            assertThat(revenue.withdrawPendingRevenue(OWNER_1, assetId, CURRENCY)).isEqualTo(units(600));

            assertThat(rejected).singleElement().extracting(LedgerException::reason).isEqualTo(ErrorReason.REENTRANT_CALL);
            assertThat(token.balanceOf(OWNER_1)).isEqualTo(units(600));
            assertThat(revenue.pendingRevenue(assetId, OWNER_1, CURRENCY)).isZero();
        }

        @Test
        void reentrantCallDuringFeeCollection_isRejected() {
            token.delegate.mint(LICENSEE, units(1_000));
            token.delegate.approve(LICENSEE, POOL, units(1_000));
            long licenseId = fixture.ledger.licenses().createOffer(OWNER_1,
                    offer(assetId, LicenseType.NON_EXCLUSIVE, 100, 0, 0));
            token.beforeTransfer = () -> fixture.ledger.licenses().revoke(OWNER_1, licenseId, "race");

            assertFails(ErrorReason.REENTRANT_CALL, () -> fixture.ledger.licenses().execute(LICENSEE, licenseId));

            assertThat(fixture.ledger.licenses().license(licenseId).orElseThrow().isActive()).isFalse();
            assertThat(token.balanceOf(LICENSEE)).isEqualTo(units(1_000));
        }
    }

    // ==================== Events ====================

    @Nested
    class Events {

        private LedgerFixture fixture;
        private List<LedgerEvent> events;

        @BeforeEach
        void setUp() {
            fixture = new LedgerFixture();
            events = new ArrayList<>();
            fixture.ledger.events().subscribe(LedgerEventType.ALL, events::add);
        }

        @Test
        void committedCalls_publishEvents() {
            long assetId = fixture.registerStandardAsset();
            fixture.ledger.ownership().transferShare(OWNER_2, assetId, OWNER_2, OWNER_3, 10);

            assertThat(events).extracting(LedgerEvent::eventType)
                    .containsExactly(LedgerEventType.ASSET_REGISTERED, LedgerEventType.SHARE_TRANSFERRED);
            LedgerEvent transfer = events.get(1);
            assertThat(transfer.assetId()).isEqualTo(assetId);
            assertThat(transfer.actor()).isEqualTo(OWNER_2);
            assertThat(transfer.timestamp()).isEqualTo(fixture.clock.epochSecond());
            assertThat(transfer.attributes()).containsEntry("weight", 100L);
        }

        @Test
        void failedCalls_publishNothing() {
            long assetId = fixture.registerStandardAsset();
            events.clear();

            assertFails(ErrorReason.INSUFFICIENT_SHARE,
                    () -> fixture.ledger.ownership().transferShare(OWNER_3, assetId, OWNER_3, OWNER_1, 50));

            assertThat(events).isEmpty();
        }

        @Test
        void handlers_mayCallBackAfterCommit() {
            long assetId = fixture.registerStandardAsset();
            fixture.ledger.events().subscribe(LedgerEventType.REVENUE_RECEIVED,
                    event -> fixture.ledger.revenue().distributeAllRevenue(OWNER_1, event.assetId(), CURRENCY));
            fixture.fund(OUTSIDER, 500);

            fixture.ledger.revenue().receiveRevenue(OUTSIDER, assetId, CURRENCY, units(500));

            assertThat(fixture.ledger.revenue().pendingRevenue(assetId, OWNER_1, CURRENCY)).isEqualTo(units(300));
            assertThat(events).extracting(LedgerEvent::eventType)
                    .contains(LedgerEventType.REVENUE_RECEIVED, LedgerEventType.REVENUE_DISTRIBUTED);
        }

        @Test
        void failingHandler_doesNotAffectCall() {
            fixture.ledger.events().subscribe(LedgerEventType.ASSET_REGISTERED, event -> {
                throw new IllegalStateException("subscriber down");
            });

            long assetId = fixture.registerStandardAsset();

            assertThat(fixture.ledger.ownership().asset(assetId)).isPresent();
            assertThat(events).hasSize(1);
        }
    }
}
