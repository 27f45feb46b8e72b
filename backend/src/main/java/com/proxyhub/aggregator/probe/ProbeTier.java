package com.proxyhub.aggregator.probe;

/**
 * Probe strategies in the order they are attempted, from most to least accurate.
 */
public enum ProbeTier {
    FULL,
    QUICK,
    RAW
}
