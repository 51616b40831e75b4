package com.delta.signaltracker.ingest.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ReasonCodeClassifierTest {

  @Test
  void mapsStatusCodes() {
    assertEquals(ReasonCodeClassifier.HTTP_401_403, ReasonCodeClassifier.fromHttpStatus(403));
    assertEquals(ReasonCodeClassifier.HTTP_429_RATE_LIMIT, ReasonCodeClassifier.fromHttpStatus(429));
    assertEquals(ReasonCodeClassifier.HTTP_5XX, ReasonCodeClassifier.fromHttpStatus(503));
    assertEquals(ReasonCodeClassifier.TIMEOUT, ReasonCodeClassifier.fromHttpStatus(408));
    assertEquals(ReasonCodeClassifier.HTTP_OTHER, ReasonCodeClassifier.fromHttpStatus(418));
    assertEquals(ReasonCodeClassifier.UNKNOWN, ReasonCodeClassifier.fromHttpStatus(null));
  }

  @Test
  void mapsTransportErrors() {
    assertEquals(
        ReasonCodeClassifier.DNS_FAILURE,
        ReasonCodeClassifier.fromErrorCode("io_error", "UnknownHostException: feeds.example"));
    assertEquals(
        ReasonCodeClassifier.TLS_FAILURE,
        ReasonCodeClassifier.fromErrorCode("io_error", "SSLHandshakeException: bad cert"));
    assertEquals(
        ReasonCodeClassifier.CONNECTION_FAILED,
        ReasonCodeClassifier.fromErrorCode("io_error", "ConnectException: refused"));
    assertEquals(ReasonCodeClassifier.TIMEOUT, ReasonCodeClassifier.fromErrorCode("timeout", null));
    assertEquals(ReasonCodeClassifier.INTERRUPTED, ReasonCodeClassifier.fromErrorCode("interrupted", null));
  }
}
