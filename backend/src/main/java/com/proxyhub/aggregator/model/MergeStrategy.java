package com.proxyhub.aggregator.model;

/**
 * How test history is carried from a subscription's previous endpoint list onto a freshly parsed one.
 */
public enum MergeStrategy {
    /** Records match only when the raw descriptor strings are identical. */
    EXACT_DESCRIPTOR,
    /** Records match on protocol, address, port and display name, so reissued descriptors keep history. */
    ENDPOINT_IDENTITY
}
