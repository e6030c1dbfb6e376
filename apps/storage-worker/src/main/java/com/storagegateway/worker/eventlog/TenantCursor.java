package com.storagegateway.worker.eventlog;

public record TenantCursor(String tenantId, long cursorId) {}
