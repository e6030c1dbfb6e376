package com.storagegateway.worker.eventlog;

import com.fasterxml.jackson.databind.JsonNode;
import com.storagegateway.domain.storage.eventlog.HmacEventSignature;
import com.storagegateway.infra.database.connection.TenantTransaction;
import java.util.Objects;
import org.springframework.stereotype.Component;

/**
 * Records an event in the tenant's event log as part of the caller's transaction, so the event
 * exists exactly when the change that produced it commits.
 */
@Component
public class EventLogWriter {
  private static final String INSERT_SQL =
      """
      INSERT INTO storage.event_log (event_name, payload, send_options, signature)
      VALUES (?, ?::jsonb, ?::jsonb, ?)
      """;

  private final HmacEventSignature signature;
  private final EventNotifier notifier;

  public EventLogWriter(HmacEventSignature signature, EventNotifier notifier) {
    this.signature = signature;
    this.notifier = notifier;
  }

  public void write(
      String tenantId, TenantTransaction transaction, String eventName, JsonNode payload, JsonNode sendOptions) {
    Objects.requireNonNull(transaction, "transaction must not be null");
    Objects.requireNonNull(eventName, "eventName must not be null");
    Objects.requireNonNull(payload, "payload must not be null");
    boolean hasOptions = sendOptions != null && !sendOptions.isNull();
    transaction
        .jdbc()
        .update(
            INSERT_SQL,
            eventName,
            payload.toString(),
            hasOptions ? sendOptions.toString() : null,
            signature.sign(eventName, payload, hasOptions ? sendOptions : null));
    notifier.notify(tenantId);
  }
}
