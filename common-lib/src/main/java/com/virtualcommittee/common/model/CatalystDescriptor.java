package com.virtualcommittee.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Locale;

/**
 * Optional known event for an instrument (earnings, regulatory decision, M&amp;A, ...).
 *
 * <p>{@code type} is free-form and matched against the catalyst taxonomy;
 * {@code daysToEvent} absent means "far or unknown" (999).
 */
public record CatalystDescriptor(
    @JsonProperty("type")        String type,
    @JsonProperty("daysToEvent") Integer daysToEvent,
    @JsonProperty("expectation") Expectation expectation
) {
    public static final int UNKNOWN_DAYS = 999;

    public static CatalystDescriptor of(String type, Integer daysToEvent, Expectation expectation) {
        return new CatalystDescriptor(type, daysToEvent, expectation);
    }

    /**
     * Lower-cased type, {@code "unknown"} when absent or blank. Surrounding
     * whitespace is kept, so a padded type never counts as an exact match.
     */
    public String normalizedType() {
        return (type == null || type.isBlank()) ? "unknown" : type.toLowerCase(Locale.ROOT);
    }

    public int daysToEventOrUnknown() {
        return daysToEvent != null ? daysToEvent : UNKNOWN_DAYS;
    }

    public Expectation expectationOrUnspecified() {
        return expectation != null ? expectation : Expectation.UNSPECIFIED;
    }
}
