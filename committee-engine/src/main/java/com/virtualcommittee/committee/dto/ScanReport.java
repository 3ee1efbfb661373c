package com.virtualcommittee.committee.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.virtualcommittee.common.model.CommitteeDecision;
import com.virtualcommittee.common.model.RegimeResult;

import java.time.Instant;
import java.util.List;

/**
 * Result of a batch scan.
 *
 * <ul>
 *   <li>{@code opportunities}      BUY decisions, best first, at most 5</li>
 *   <li>{@code watchlist}          WATCHLIST decisions, best first, at most 10</li>
 *   <li>{@code opportunitiesFound} / {@code watchlistCount} counts before truncation</li>
 *   <li>{@code catalystsDetected}  candidates submitted with a catalyst</li>
 *   <li>{@code excludedCount}      candidates removed by the instrument screen</li>
 * </ul>
 */
public record ScanReport(
    @JsonProperty("scanId")             String scanId,
    @JsonProperty("scannedAt")          Instant scannedAt,
    @JsonProperty("regime")             RegimeResult regime,
    @JsonProperty("opportunities")      List<CommitteeDecision> opportunities,
    @JsonProperty("watchlist")          List<CommitteeDecision> watchlist,
    @JsonProperty("totalScanned")       int totalScanned,
    @JsonProperty("opportunitiesFound") int opportunitiesFound,
    @JsonProperty("watchlistCount")     int watchlistCount,
    @JsonProperty("catalystsDetected")  int catalystsDetected,
    @JsonProperty("excludedCount")      int excludedCount
) {}
