package com.virtualcommittee.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record CommitteeReasoning(
    @JsonProperty("regime")     List<String> regime,
    @JsonProperty("turtles")    List<String> turtles,
    @JsonProperty("seykota")    List<String> seykota,
    @JsonProperty("catalyst")   List<String> catalyst,
    @JsonProperty("riskReward") List<String> riskReward
) {
    public CommitteeReasoning {
        regime     = regime     == null ? List.of() : List.copyOf(regime);
        turtles    = turtles    == null ? List.of() : List.copyOf(turtles);
        seykota    = seykota    == null ? List.of() : List.copyOf(seykota);
        catalyst   = catalyst   == null ? List.of() : List.copyOf(catalyst);
        riskReward = riskReward == null ? List.of() : List.copyOf(riskReward);
    }
}
