package com.proxyhub.aggregator.util;

import org.junit.jupiter.api.Test;

import java.net.ConnectException;
import java.net.UnknownHostException;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ReasonCodeClassifierTest {

  @Test
  void mapsHttpStatuses() {
    assertEquals(ReasonCodeClassifier.HTTP_401_403, ReasonCodeClassifier.fromHttpStatus(403));
    assertEquals(ReasonCodeClassifier.HTTP_404, ReasonCodeClassifier.fromHttpStatus(404));
    assertEquals(ReasonCodeClassifier.HTTP_429_RATE_LIMIT, ReasonCodeClassifier.fromHttpStatus(429));
    assertEquals(ReasonCodeClassifier.HTTP_4XX, ReasonCodeClassifier.fromHttpStatus(410));
    assertEquals(ReasonCodeClassifier.HTTP_5XX, ReasonCodeClassifier.fromHttpStatus(503));
    assertEquals(ReasonCodeClassifier.UNKNOWN, ReasonCodeClassifier.fromHttpStatus(null));
  }

  @Test
  void walksCauseChain() {
    RuntimeException wrapped = new RuntimeException("boom", new UnknownHostException("nowhere.invalid"));
    assertEquals(ReasonCodeClassifier.DNS_FAILURE, ReasonCodeClassifier.fromException(wrapped));
    assertEquals(ReasonCodeClassifier.CONNECTION_REFUSED, ReasonCodeClassifier.fromException(new ConnectException()));
  }

  @Test
  void normalizesProberErrorStrings() {
    assertEquals(ReasonCodeClassifier.TIMEOUT, ReasonCodeClassifier.normalize("timeout"));
    assertEquals(ReasonCodeClassifier.CONNECTION_REFUSED, ReasonCodeClassifier.normalize("Connection refused by peer"));
    assertEquals(ReasonCodeClassifier.ENGINE_UNAVAILABLE, ReasonCodeClassifier.normalize("engine_unavailable"));
    assertEquals(ReasonCodeClassifier.UNKNOWN, ReasonCodeClassifier.normalize(null));
    assertEquals(ReasonCodeClassifier.UNKNOWN, ReasonCodeClassifier.normalize("weird"));
  }
}
