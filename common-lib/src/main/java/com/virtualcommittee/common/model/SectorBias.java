package com.virtualcommittee.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Sector hints emitted by the regime detector. Entries are matched as
 * case-insensitive substrings of an instrument's sector label.
 */
public record SectorBias(
    @JsonProperty("boost")    List<String> boost,
    @JsonProperty("penalize") List<String> penalize
) {
    public SectorBias {
        boost    = boost    == null ? List.of() : List.copyOf(boost);
        penalize = penalize == null ? List.of() : List.copyOf(penalize);
    }

    public static SectorBias none() {
        return new SectorBias(List.of(), List.of());
    }
}
