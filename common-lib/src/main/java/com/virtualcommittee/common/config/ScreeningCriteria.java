package com.virtualcommittee.common.config;

/**
 * Thresholds an instrument must clear before the committee looks at it.
 *
 * <h3>Average-volume tiers (by market cap)</h3>
 * <pre>
 *   cap &lt; 1B          → minVolumeSmallCap
 *   1B ≤ cap &lt; 10B    → minVolumeMidCap
 *   cap ≥ 10B          → minVolumeLargeCap
 * </pre>
 */
public record ScreeningCriteria(
    double minPrice,
    double maxPrice,
    double minMarketCap,
    double maxMarketCap,
    double minBeta,
    double minVolumeSmallCap,
    double minVolumeMidCap,
    double minVolumeLargeCap
) {
    public static final double SMALL_CAP_CEILING = 1_000_000_000d;
    public static final double MID_CAP_CEILING   = 10_000_000_000d;

    public static ScreeningCriteria defaults() {
        return new ScreeningCriteria(
            2.0, 500.0,
            100_000_000d, 100_000_000_000d,
            1.5,
            1_000_000d, 750_000d, 500_000d);
    }

    public double minVolumeFor(double marketCap) {
        if (marketCap < SMALL_CAP_CEILING) return minVolumeSmallCap;
        if (marketCap < MID_CAP_CEILING)   return minVolumeMidCap;
        return minVolumeLargeCap;
    }
}
