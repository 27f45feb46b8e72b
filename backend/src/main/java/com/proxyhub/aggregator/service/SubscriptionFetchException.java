package com.proxyhub.aggregator.service;

/**
 * The subscription URL could not be reached or answered with a non-2xx status.
 */
public class SubscriptionFetchException extends SubscriptionException {
    private final String reasonCode;

    public SubscriptionFetchException(String message, String reasonCode, Throwable cause) {
        super(message, cause);
        this.reasonCode = reasonCode;
    }

    public String reasonCode() {
        return reasonCode;
    }
}
