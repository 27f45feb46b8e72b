package com.proxyhub.aggregator.probe;

/**
 * Result for one candidate of a batch, tagged with its position in the input list.
 */
public record CandidateResult(String descriptor, int index, ProbeResult result) {
}
