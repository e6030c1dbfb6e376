package com.storagegateway.domain.storage.backend;

public record CompletedUpload(String version, String location, String bucket, String key) {}
