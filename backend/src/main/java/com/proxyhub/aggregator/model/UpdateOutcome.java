package com.proxyhub.aggregator.model;

import com.proxyhub.aggregator.util.ReasonCodeClassifier;

/**
 * Result of one subscription update without exceptions: either the endpoint count or a failure category.
 */
public record UpdateOutcome(Status status, int endpointCount, String reasonCode, String message) {

    public enum Status {
        OK,
        FETCH_FAILED,
        PARSE_FAILED
    }

    public static UpdateOutcome ok(int endpointCount) {
        return new UpdateOutcome(Status.OK, endpointCount, null, null);
    }

    public static UpdateOutcome fetchFailed(String reasonCode, String message) {
        return new UpdateOutcome(Status.FETCH_FAILED, 0, reasonCode, message);
    }

    public static UpdateOutcome parseFailed(String message) {
        return new UpdateOutcome(Status.PARSE_FAILED, 0, ReasonCodeClassifier.PARSING_FAILED, message);
    }

    public boolean isOk() {
        return status == Status.OK;
    }
}
