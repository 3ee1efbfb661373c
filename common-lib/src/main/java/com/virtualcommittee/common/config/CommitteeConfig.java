package com.virtualcommittee.common.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.virtualcommittee.common.exception.CommitteeException;

/**
 * Per-call account parameters for the committee.
 *
 * <p>Passed explicitly into every evaluation; there is no process-wide mutable
 * default. {@link #defaults()} gives 500.0 capital at 5x leverage.
 *
 * @param capital  account capital in account currency, must be positive
 * @param leverage exposure multiplier, at least 1
 */
public record CommitteeConfig(
    @JsonProperty("capital")  double capital,
    @JsonProperty("leverage") int leverage
) {
    public static final double DEFAULT_CAPITAL  = 500.0;
    public static final int    DEFAULT_LEVERAGE = 5;

    /** Fraction of capital put at risk on a single trade. */
    public static final double MAX_RISK_FRACTION = 0.02;

    public CommitteeConfig {
        if (!(capital > 0) || Double.isInfinite(capital)) {
            throw new CommitteeException("CommitteeConfig", "capital must be positive, got " + capital);
        }
        if (leverage < 1) {
            throw new CommitteeException("CommitteeConfig", "leverage must be at least 1, got " + leverage);
        }
    }

    public static CommitteeConfig defaults() {
        return new CommitteeConfig(DEFAULT_CAPITAL, DEFAULT_LEVERAGE);
    }

    public static CommitteeConfig of(double capital, int leverage) {
        return new CommitteeConfig(capital, leverage);
    }

    /** Overrides only the non-null values of this config. */
    public CommitteeConfig with(Double capitalOverride, Integer leverageOverride) {
        return new CommitteeConfig(
            capitalOverride  != null ? capitalOverride  : capital,
            leverageOverride != null ? leverageOverride : leverage);
    }

    public double maxRiskAmount() {
        return capital * MAX_RISK_FRACTION;
    }

    public double exposureCapacity() {
        return capital * leverage;
    }
}
