package com.storagegateway.worker.eventlog;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;

public record EventLogRow(
    long id,
    String eventName,
    JsonNode payload,
    JsonNode sendOptions,
    String signature,
    EventLogStatus status,
    Instant createdAt) {}
