package com.storagegateway.domain.storage.backend;

import java.time.Instant;

public record ObjectMetadata(
    long size,
    String mimetype,
    String cacheControl,
    String eTag,
    Instant lastModified,
    long contentLength,
    int httpStatusCode) {}
