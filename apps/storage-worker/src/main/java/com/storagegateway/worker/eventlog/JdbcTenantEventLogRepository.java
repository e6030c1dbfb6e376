package com.storagegateway.worker.eventlog;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.storagegateway.infra.database.connection.TenantConnectionFactory;
import com.storagegateway.infra.database.connection.TenantTransaction;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.List;
import java.util.function.Function;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

/** Runs every statement in its own short transaction as the tenant's service role. */
@Repository
public class JdbcTenantEventLogRepository implements TenantEventLogRepository {
  private final TenantConnectionFactory connectionFactory;
  private final ObjectMapper objectMapper;

  public JdbcTenantEventLogRepository(TenantConnectionFactory connectionFactory, ObjectMapper objectMapper) {
    this.connectionFactory = connectionFactory;
    this.objectMapper = objectMapper;
  }

  @Override
  public List<EventLogRow> findPending(String tenantId, int limit) {
    String sql =
        """
        SELECT id, event_name, payload, send_options, signature, status, created_at
        FROM storage.event_log
        WHERE status = 'PENDING'
        ORDER BY id ASC
        LIMIT ?
        """;
    return inTransaction(tenantId, jdbc -> jdbc.query(sql, this::mapRow, Math.max(1, limit)));
  }

  @Override
  public int markSignatureInvalid(String tenantId, List<Long> ids) {
    if (ids.isEmpty()) {
      return 0;
    }
    String sql = "UPDATE storage.event_log SET status = 'SIGNATURE_INVALID' WHERE id = ANY(?::bigint[])";
    return inTransaction(tenantId, jdbc -> jdbc.update(sql, (Object) ids.toArray(new Long[0])));
  }

  @Override
  public int deleteForwarded(String tenantId, List<Long> ids) {
    if (ids.isEmpty()) {
      return 0;
    }
    String sql = "DELETE FROM storage.event_log WHERE id = ANY(?::bigint[])";
    return inTransaction(tenantId, jdbc -> jdbc.update(sql, (Object) ids.toArray(new Long[0])));
  }

  @Override
  public boolean hasPending(String tenantId) {
    String sql = "SELECT EXISTS (SELECT 1 FROM storage.event_log WHERE status = 'PENDING')";
    Boolean pending = inTransaction(tenantId, jdbc -> jdbc.queryForObject(sql, Boolean.class));
    return Boolean.TRUE.equals(pending);
  }

  private <T> T inTransaction(String tenantId, Function<JdbcTemplate, T> work) {
    try (TenantTransaction transaction = connectionFactory.superUserConnection(tenantId).transaction()) {
      T result = work.apply(transaction.jdbc());
      transaction.commit();
      return result;
    }
  }

  private EventLogRow mapRow(ResultSet rs, int rowNum) throws SQLException {
    Timestamp createdAt = rs.getTimestamp("created_at");
    return new EventLogRow(
        rs.getLong("id"),
        rs.getString("event_name"),
        readJson(rs.getString("payload")),
        readJson(rs.getString("send_options")),
        rs.getString("signature"),
        EventLogStatus.valueOf(rs.getString("status")),
        createdAt == null ? null : createdAt.toInstant());
  }

  private JsonNode readJson(String json) throws SQLException {
    if (json == null) {
      return null;
    }
    try {
      return objectMapper.readTree(json);
    } catch (JsonProcessingException ex) {
      throw new SQLException("Invalid event log json", ex);
    }
  }
}
