package com.storagegateway.domain.storage.backend;

import java.io.InputStream;

public record ObjectContent(InputStream body, ObjectMetadata metadata) {}
