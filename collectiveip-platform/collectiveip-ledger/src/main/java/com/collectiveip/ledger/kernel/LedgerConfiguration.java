package com.collectiveip.ledger.kernel;

import com.collectiveip.core.domain.GovernanceSettings;
import com.collectiveip.core.support.Addresses;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Immutable settings of one ledger instance.
 */
public final class LedgerConfiguration {

    public static final long DAY = 86_400;

    private final String poolAddress;
    private final String administrator;
    private final BigInteger defaultAssetSupply;
    private final BigInteger approvalFeeThreshold;
    private final long royaltyPaymentInterval;
    private final long licenseVotingPeriod;
    private final long licenseExecutionWindow;
    private final GovernanceSettings defaultGovernanceSettings;

    private LedgerConfiguration(Builder builder) {
        this.poolAddress = Addresses.normalize(builder.poolAddress, "pool");
        this.administrator = Addresses.normalize(builder.administrator, "administrator");
        this.defaultAssetSupply = requirePositive(builder.defaultAssetSupply, "Default asset supply");
        this.approvalFeeThreshold = Objects.requireNonNull(builder.approvalFeeThreshold, "Approval fee threshold cannot be null");
        if (approvalFeeThreshold.signum() < 0) {
            throw new IllegalArgumentException("Approval fee threshold cannot be negative");
        }
        this.royaltyPaymentInterval = requirePositive(builder.royaltyPaymentInterval, "Royalty payment interval");
        this.licenseVotingPeriod = requirePositive(builder.licenseVotingPeriod, "License voting period");
        this.licenseExecutionWindow = requirePositive(builder.licenseExecutionWindow, "License execution window");
        this.defaultGovernanceSettings = Objects.requireNonNull(builder.defaultGovernanceSettings,
                "Default governance settings cannot be null").validate();
    }

    public static Builder builder() {
        return new Builder();
    }

    public String poolAddress() { return poolAddress; }
    public String administrator() { return administrator; }
    public BigInteger defaultAssetSupply() { return defaultAssetSupply; }
    public BigInteger approvalFeeThreshold() { return approvalFeeThreshold; }
    public long royaltyPaymentInterval() { return royaltyPaymentInterval; }
    public long licenseVotingPeriod() { return licenseVotingPeriod; }
    public long licenseExecutionWindow() { return licenseExecutionWindow; }
    public GovernanceSettings defaultGovernanceSettings() { return defaultGovernanceSettings; }

    private static BigInteger requirePositive(BigInteger value, String name) {
        Objects.requireNonNull(value, name + " cannot be null");
        if (value.signum() <= 0) {
            throw new IllegalArgumentException(name + " must be positive");
        }
        return value;
    }

    private static long requirePositive(long value, String name) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be positive");
        }
        return value;
    }

    public static final class Builder {
        private String poolAddress;
        private String administrator;
        private BigInteger defaultAssetSupply = BigInteger.valueOf(1_000);
        private BigInteger approvalFeeThreshold = BigInteger.valueOf(500);
        private long royaltyPaymentInterval = 30 * DAY;
        private long licenseVotingPeriod = 7 * DAY;
        private long licenseExecutionWindow = DAY;
        private GovernanceSettings defaultGovernanceSettings = GovernanceSettings.defaults();

        private Builder() {}

        public Builder poolAddress(String poolAddress) {
            this.poolAddress = poolAddress;
            return this;
        }

        public Builder administrator(String administrator) {
            this.administrator = administrator;
            return this;
        }

        public Builder defaultAssetSupply(BigInteger defaultAssetSupply) {
            this.defaultAssetSupply = defaultAssetSupply;
            return this;
        }

        public Builder approvalFeeThreshold(BigInteger approvalFeeThreshold) {
            this.approvalFeeThreshold = approvalFeeThreshold;
            return this;
        }

        public Builder royaltyPaymentInterval(long royaltyPaymentInterval) {
            this.royaltyPaymentInterval = royaltyPaymentInterval;
            return this;
        }

        public Builder licenseVotingPeriod(long licenseVotingPeriod) {
            this.licenseVotingPeriod = licenseVotingPeriod;
            return this;
        }

        public Builder licenseExecutionWindow(long licenseExecutionWindow) {
            this.licenseExecutionWindow = licenseExecutionWindow;
            return this;
        }

        public Builder defaultGovernanceSettings(GovernanceSettings defaultGovernanceSettings) {
            this.defaultGovernanceSettings = defaultGovernanceSettings;
            return this;
        }

        public LedgerConfiguration build() {
            return new LedgerConfiguration(this);
        }
    }
}
