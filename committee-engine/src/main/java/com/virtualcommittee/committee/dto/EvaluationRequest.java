package com.virtualcommittee.committee.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.virtualcommittee.common.model.CatalystDescriptor;
import com.virtualcommittee.common.model.MarketSnapshot;
import com.virtualcommittee.common.model.TickerSnapshot;
import com.virtualcommittee.common.model.TradePlan;

/**
 * Single-instrument committee request. Omitted {@code entry}/{@code stop}/{@code target}
 * are derived; omitted {@code capital}/{@code leverage} fall back to configuration.
 */
public record EvaluationRequest(
    @JsonProperty("instrumentId") String instrumentId,
    @JsonProperty("ticker")       TickerSnapshot ticker,
    @JsonProperty("market")       MarketSnapshot market,
    @JsonProperty("catalyst")     CatalystDescriptor catalyst,
    @JsonProperty("entry")        Double entry,
    @JsonProperty("stop")         Double stop,
    @JsonProperty("target")       Double target,
    @JsonProperty("capital")      Double capital,
    @JsonProperty("leverage")     Integer leverage
) {
    public TradePlan tradePlan() {
        return TradePlan.of(entry, stop, target);
    }
}
