package com.storagegateway.worker.eventlog;

import java.time.Duration;
import java.util.List;

/** Control-plane bookkeeping of which tenants have event-log rows waiting to be forwarded. */
public interface TenantLeaseRepository {
  /**
   * Claims up to {@code limit} due tenants and pushes their next poll out by {@code lease}, so a
   * crashed publisher's tenants are picked up again once the lease runs out.
   */
  List<String> claimDue(int limit, Duration lease);

  void remove(String tenantId);

  /** Records a successful poll and schedules the next one {@code delay} from now. */
  void reschedule(String tenantId, Duration delay);

  List<TenantCursor> listTenants(long afterCursor, int limit);

  int register(List<String> tenantIds);
}
