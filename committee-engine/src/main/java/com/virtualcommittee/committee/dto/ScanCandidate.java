package com.virtualcommittee.committee.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.virtualcommittee.common.model.CatalystDescriptor;
import com.virtualcommittee.common.model.TickerSnapshot;

public record ScanCandidate(
    @JsonProperty("instrumentId") String instrumentId,
    @JsonProperty("ticker")       TickerSnapshot ticker,
    @JsonProperty("catalyst")     CatalystDescriptor catalyst
) {
    public static ScanCandidate of(String instrumentId, TickerSnapshot ticker, CatalystDescriptor catalyst) {
        return new ScanCandidate(instrumentId, ticker, catalyst);
    }
}
