package com.proxyhub.aggregator.service;

/**
 * The subscription was reachable but its content yielded no recognized endpoint descriptors.
 */
public class SubscriptionParseException extends SubscriptionException {
    public SubscriptionParseException(String message) {
        super(message);
    }
}
