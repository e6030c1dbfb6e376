package com.storagegateway.domain.storage.backend;

public record UploadedPart(int partNumber, String eTag) {}
