package com.storagegateway.domain.storage.eventlog;

import com.fasterxml.jackson.databind.JsonNode;

@FunctionalInterface
public interface EventSignatureVerifier {
  boolean verify(String eventName, JsonNode payload, JsonNode sendOptions, String signature);
}
