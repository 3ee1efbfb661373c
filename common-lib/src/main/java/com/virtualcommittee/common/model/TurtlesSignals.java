package com.virtualcommittee.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record TurtlesSignals(
    @JsonProperty("breakout")        boolean breakout,
    @JsonProperty("volumeConfirmed") boolean volumeConfirmed,
    @JsonProperty("atrPct")          double atrPct,
    @JsonProperty("volumeRatio")     double volumeRatio
) {}
