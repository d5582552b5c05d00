package com.parametric.oracle;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Track record of one oracle. {@code uptime} and {@code accuracyRate} are fractions in [0, 1].
 */
public class OracleReputation {

    private long totalAttestations;
    private long accurateAttestations;
    private double accuracyRate;
    private double uptime = 1.0;
    private BigDecimal stakingAmount = BigDecimal.ZERO;
    private List<SlashingEvent> slashingHistory = new ArrayList<>();

    public static OracleReputation initial(BigDecimal stakingAmount) {
        OracleReputation reputation = new OracleReputation();
        reputation.setStakingAmount(stakingAmount == null ? BigDecimal.ZERO : stakingAmount);
        return reputation;
    }

    public void recordParticipation() {
        totalAttestations++;
        recomputeAccuracy();
    }

    public void recordAccurate() {
        accurateAttestations = Math.min(accurateAttestations + 1, totalAttestations);
        recomputeAccuracy();
    }

    private void recomputeAccuracy() {
        accuracyRate = totalAttestations == 0 ? 0.0 : (double) accurateAttestations / totalAttestations;
    }

    public long getTotalAttestations() {
        return totalAttestations;
    }

    public void setTotalAttestations(long totalAttestations) {
        this.totalAttestations = totalAttestations;
    }

    public long getAccurateAttestations() {
        return accurateAttestations;
    }

    public void setAccurateAttestations(long accurateAttestations) {
        this.accurateAttestations = accurateAttestations;
    }

    public double getAccuracyRate() {
        return accuracyRate;
    }

    public void setAccuracyRate(double accuracyRate) {
        this.accuracyRate = accuracyRate;
    }

    public double getUptime() {
        return uptime;
    }

    public void setUptime(double uptime) {
        this.uptime = uptime;
    }

    public BigDecimal getStakingAmount() {
        return stakingAmount;
    }

    public void setStakingAmount(BigDecimal stakingAmount) {
        this.stakingAmount = stakingAmount;
    }

    public List<SlashingEvent> getSlashingHistory() {
        return slashingHistory;
    }

    public void setSlashingHistory(List<SlashingEvent> slashingHistory) {
        this.slashingHistory = slashingHistory == null ? new ArrayList<>() : new ArrayList<>(slashingHistory);
    }
}
