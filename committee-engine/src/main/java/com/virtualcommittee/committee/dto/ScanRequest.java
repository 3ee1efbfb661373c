package com.virtualcommittee.committee.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.virtualcommittee.common.model.MarketSnapshot;

import java.util.List;

/**
 * Batch of candidates sharing one market snapshot. {@code capital} and
 * {@code leverage} override the configured defaults when present.
 */
public record ScanRequest(
    @JsonProperty("market")     MarketSnapshot market,
    @JsonProperty("candidates") List<ScanCandidate> candidates,
    @JsonProperty("capital")    Double capital,
    @JsonProperty("leverage")   Integer leverage
) {}
