package com.storagegateway.domain.storage.backend;

import java.time.Instant;

public record CopyResult(String eTag, Instant lastModified, int httpStatusCode) {}
