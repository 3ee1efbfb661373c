package com.virtualcommittee.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Per-instrument numeric facts, computed upstream by the data collaborator.
 *
 * <p>Every field except {@code price} is optional. Evaluators never read the raw
 * components for optional fields; they go through the {@code *OrDefault}
 * accessors below so each substitution rule lives in exactly one place:
 * <pre>
 *   price                   absent           → 0 (instrument cannot be evaluated)
 *   atr14                   absent           → 0 (ATR unavailable)
 *   high20d                 absent or ≤ 0    → current price
 *   avgVolume20d            absent           → 1
 *   volume                  absent           → 0
 *   ema20 / ema50 / ema200  absent           → 0 (unavailable)
 *   price10dAgo             absent           → current price
 *   changePct               absent           → 0
 *   beta                    absent           → 1.5
 *   historicalEventReaction absent           → 0
 * </pre>
 */
public record TickerSnapshot(
    @JsonProperty("price")                   Double price,
    @JsonProperty("atr14")                   Double atr14,
    @JsonProperty("high20d")                 Double high20d,
    @JsonProperty("avgVolume20d")            Double avgVolume20d,
    @JsonProperty("volume")                  Double volume,
    @JsonProperty("ema20")                   Double ema20,
    @JsonProperty("ema50")                   Double ema50,
    @JsonProperty("ema200")                  Double ema200,
    @JsonProperty("price10dAgo")             Double price10dAgo,
    @JsonProperty("changePct")               Double changePct,
    @JsonProperty("beta")                    Double beta,
    @JsonProperty("sector")                  String sector,
    @JsonProperty("historicalEventReaction") Double historicalEventReaction,
    @JsonProperty("marketCap")               Double marketCap
) {

    public static final double DEFAULT_BETA = 1.5;

    public double priceOrZero()            { return valueOr(price, 0.0); }
    public double atrOrZero()              { return valueOr(atr14, 0.0); }
    public double avgVolumeOrDefault()     { return valueOr(avgVolume20d, 1.0); }
    public double volumeOrZero()           { return valueOr(volume, 0.0); }
    public double ema20OrZero()            { return valueOr(ema20, 0.0); }
    public double ema50OrZero()            { return valueOr(ema50, 0.0); }
    public double ema200OrZero()           { return valueOr(ema200, 0.0); }
    public double changePctOrZero()        { return valueOr(changePct, 0.0); }
    public double betaOrDefault()          { return valueOr(beta, DEFAULT_BETA); }
    public double historicalReactionOrZero() { return valueOr(historicalEventReaction, 0.0); }

    /** A missing or non-positive rolling high means "no breakout information". */
    public double high20dOrPrice() {
        return (high20d != null && high20d > 0) ? high20d : priceOrZero();
    }

    public double price10dAgoOrPrice() {
        return valueOr(price10dAgo, priceOrZero());
    }

    public boolean hasPrice() {
        return price != null && price > 0;
    }

    private static double valueOr(Double value, double fallback) {
        return value != null ? value : fallback;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Double price;
        private Double atr14;
        private Double high20d;
        private Double avgVolume20d;
        private Double volume;
        private Double ema20;
        private Double ema50;
        private Double ema200;
        private Double price10dAgo;
        private Double changePct;
        private Double beta;
        private String sector;
        private Double historicalEventReaction;
        private Double marketCap;

        private Builder() {}

        public Builder price(Double v)                   { this.price = v; return this; }
        public Builder atr14(Double v)                   { this.atr14 = v; return this; }
        public Builder high20d(Double v)                 { this.high20d = v; return this; }
        public Builder avgVolume20d(Double v)            { this.avgVolume20d = v; return this; }
        public Builder volume(Double v)                  { this.volume = v; return this; }
        public Builder ema20(Double v)                   { this.ema20 = v; return this; }
        public Builder ema50(Double v)                   { this.ema50 = v; return this; }
        public Builder ema200(Double v)                  { this.ema200 = v; return this; }
        public Builder price10dAgo(Double v)             { this.price10dAgo = v; return this; }
        public Builder changePct(Double v)               { this.changePct = v; return this; }
        public Builder beta(Double v)                    { this.beta = v; return this; }
        public Builder sector(String v)                  { this.sector = v; return this; }
        public Builder historicalEventReaction(Double v) { this.historicalEventReaction = v; return this; }
        public Builder marketCap(Double v)               { this.marketCap = v; return this; }

        public TickerSnapshot build() {
            return new TickerSnapshot(price, atr14, high20d, avgVolume20d, volume,
                                      ema20, ema50, ema200, price10dAgo, changePct,
                                      beta, sector, historicalEventReaction, marketCap);
        }
    }
}
