package com.virtualcommittee.common.exception;

/**
 * Raised at the service edge for malformed requests and invalid configuration.
 * The scoring core itself never throws for data problems.
 *
 * <p>{@code instrumentId} is set when the problem belongs to one instrument of a
 * request, and is {@code null} for request-wide or configuration problems.
 */
public class CommitteeException extends RuntimeException {
    private final String component;
    private final String instrumentId;

    public CommitteeException(String component, String message) {
        this(component, null, message);
    }

    private CommitteeException(String component, String instrumentId, String message) {
        super("[" + component + "] " + message + (instrumentId != null ? " (instrument=" + instrumentId + ")" : ""));
        this.component = component;
        this.instrumentId = instrumentId;
    }

    public static CommitteeException forInstrument(String component, String instrumentId, String message) {
        return new CommitteeException(component, instrumentId, message);
    }

    public String getComponent() {
        return component;
    }

    public String getInstrumentId() {
        return instrumentId;
    }
}
