package com.collectiveip.api.config;

import com.collectiveip.core.domain.GovernanceSettings;
import com.collectiveip.ledger.kernel.CollectiveLedger;
import com.collectiveip.ledger.kernel.LedgerConfiguration;
import com.collectiveip.ledger.token.InMemoryAssetToken;
import com.collectiveip.ledger.token.InMemoryPaymentToken;
import com.collectiveip.ledger.token.PaymentTokens;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * Ledger wiring.
 *
 * Token balances are kept in memory; every currency listed under
 * {@code collectiveip.ledger.currencies} gets its own payment-token ledger.
 */
@Configuration
public class LedgerConfig {

    @Value("${collectiveip.ledger.pool-address}")
    private String poolAddress;

    @Value("${collectiveip.ledger.administrator}")
    private String administrator;

    @Value("${collectiveip.ledger.default-asset-supply:1000}")
    private BigInteger defaultAssetSupply;

    @Value("${collectiveip.ledger.approval-fee-threshold:500}")
    private BigInteger approvalFeeThreshold;

    @Value("${collectiveip.ledger.royalty-payment-interval:30d}")
    private Duration royaltyPaymentInterval;

    @Value("${collectiveip.ledger.license-voting-period:7d}")
    private Duration licenseVotingPeriod;

    @Value("${collectiveip.ledger.license-execution-window:1d}")
    private Duration licenseExecutionWindow;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public InMemoryAssetToken assetToken() {
        return new InMemoryAssetToken();
    }

    @Bean
    public PaymentTokens paymentTokens(@Value("${collectiveip.ledger.currencies}") List<String> currencies) {
        PaymentTokens tokens = new PaymentTokens();
        for (String currency : currencies) {
            tokens.register(new InMemoryPaymentToken(currency.trim()));
        }
        return tokens;
    }

    @Bean
    public LedgerConfiguration ledgerConfiguration() {
        return LedgerConfiguration.builder()
                .poolAddress(poolAddress)
                .administrator(administrator)
                .defaultAssetSupply(defaultAssetSupply)
                .approvalFeeThreshold(approvalFeeThreshold)
                .royaltyPaymentInterval(royaltyPaymentInterval.toSeconds())
                .licenseVotingPeriod(licenseVotingPeriod.toSeconds())
                .licenseExecutionWindow(licenseExecutionWindow.toSeconds())
                .defaultGovernanceSettings(GovernanceSettings.defaults())
                .build();
    }

    @Bean
    public CollectiveLedger collectiveLedger(LedgerConfiguration configuration, Clock clock,
                                             InMemoryAssetToken assetToken, PaymentTokens paymentTokens) {
        return new CollectiveLedger(configuration, clock, assetToken, paymentTokens);
    }
}
