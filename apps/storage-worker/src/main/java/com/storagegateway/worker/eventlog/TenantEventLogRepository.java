package com.storagegateway.worker.eventlog;

import java.util.List;

/** Reads and prunes the {@code storage.event_log} table of one tenant database. */
public interface TenantEventLogRepository {
  List<EventLogRow> findPending(String tenantId, int limit);

  int markSignatureInvalid(String tenantId, List<Long> ids);

  int deleteForwarded(String tenantId, List<Long> ids);

  boolean hasPending(String tenantId);
}
