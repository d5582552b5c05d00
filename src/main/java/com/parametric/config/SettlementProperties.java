package com.parametric.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Tunables under {@code settlement.*}. Defaults match the production rule set,
 * so {@code new SettlementProperties()} is a valid configuration for tests.
 */
@ConfigurationProperties(prefix = "settlement")
public class SettlementProperties {

    private Consensus consensus = new Consensus();
    private Attestation attestation = new Attestation();
    private Trigger trigger = new Trigger();
    private Payout payout = new Payout();
    private Premium premium = new Premium();
    private Scheduling scheduling = new Scheduling();

    public Consensus getConsensus() {
        return consensus;
    }

    public void setConsensus(Consensus consensus) {
        this.consensus = consensus;
    }

    public Attestation getAttestation() {
        return attestation;
    }

    public void setAttestation(Attestation attestation) {
        this.attestation = attestation;
    }

    public Trigger getTrigger() {
        return trigger;
    }

    public void setTrigger(Trigger trigger) {
        this.trigger = trigger;
    }

    public Payout getPayout() {
        return payout;
    }

    public void setPayout(Payout payout) {
        this.payout = payout;
    }

    public Premium getPremium() {
        return premium;
    }

    public void setPremium(Premium premium) {
        this.premium = premium;
    }

    public Scheduling getScheduling() {
        return scheduling;
    }

    public void setScheduling(Scheduling scheduling) {
        this.scheduling = scheduling;
    }

    public static class Consensus {
        private int requiredSignatures = 3;
        private double weightThreshold = 0.66;
        private double outlierThreshold = 2.0;
        private String outlierMethod = "median-deviation";

        public int getRequiredSignatures() {
            return requiredSignatures;
        }

        public void setRequiredSignatures(int requiredSignatures) {
            this.requiredSignatures = requiredSignatures;
        }

        public double getWeightThreshold() {
            return weightThreshold;
        }

        public void setWeightThreshold(double weightThreshold) {
            this.weightThreshold = weightThreshold;
        }

        public double getOutlierThreshold() {
            return outlierThreshold;
        }

        public void setOutlierThreshold(double outlierThreshold) {
            this.outlierThreshold = outlierThreshold;
        }

        public String getOutlierMethod() {
            return outlierMethod;
        }

        public void setOutlierMethod(String outlierMethod) {
            this.outlierMethod = outlierMethod;
        }
    }

    public static class Attestation {
        private Duration ttl = Duration.ofHours(24);

        public Duration getTtl() {
            return ttl;
        }

        public void setTtl(Duration ttl) {
            this.ttl = ttl;
        }
    }

    public static class Trigger {
        private Duration pendingTimeout = Duration.ofHours(24);

        public Duration getPendingTimeout() {
            return pendingTimeout;
        }

        public void setPendingTimeout(Duration pendingTimeout) {
            this.pendingTimeout = pendingTimeout;
        }
    }

    public static class Payout {
        private int maxRetries = 3;
        private Duration retryDelay = Duration.ofSeconds(30);
        private double backoffMultiplier = 2.0;
        private long finalityThreshold = 5000;
        private Duration finalityTimeout = Duration.ofMinutes(10);

        public int getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
        }

        public Duration getRetryDelay() {
            return retryDelay;
        }

        public void setRetryDelay(Duration retryDelay) {
            this.retryDelay = retryDelay;
        }

        public double getBackoffMultiplier() {
            return backoffMultiplier;
        }

        public void setBackoffMultiplier(double backoffMultiplier) {
            this.backoffMultiplier = backoffMultiplier;
        }

        public long getFinalityThreshold() {
            return finalityThreshold;
        }

        public void setFinalityThreshold(long finalityThreshold) {
            this.finalityThreshold = finalityThreshold;
        }

        public Duration getFinalityTimeout() {
            return finalityTimeout;
        }

        public void setFinalityTimeout(Duration finalityTimeout) {
            this.finalityTimeout = finalityTimeout;
        }
    }

    public static class Premium {
        private BigDecimal poolShare = new BigDecimal("0.70");
        private BigDecimal reinsurerShare = new BigDecimal("0.25");
        private BigDecimal systemFeeShare = new BigDecimal("0.05");

        public BigDecimal getPoolShare() {
            return poolShare;
        }

        public void setPoolShare(BigDecimal poolShare) {
            this.poolShare = poolShare;
        }

        public BigDecimal getReinsurerShare() {
            return reinsurerShare;
        }

        public void setReinsurerShare(BigDecimal reinsurerShare) {
            this.reinsurerShare = reinsurerShare;
        }

        public BigDecimal getSystemFeeShare() {
            return systemFeeShare;
        }

        public void setSystemFeeShare(BigDecimal systemFeeShare) {
            this.systemFeeShare = systemFeeShare;
        }
    }

    public static class Scheduling {
        private boolean enabled = true;
        private long sweepIntervalMs = 30000;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public long getSweepIntervalMs() {
            return sweepIntervalMs;
        }

        public void setSweepIntervalMs(long sweepIntervalMs) {
            this.sweepIntervalMs = sweepIntervalMs;
        }
    }
}
