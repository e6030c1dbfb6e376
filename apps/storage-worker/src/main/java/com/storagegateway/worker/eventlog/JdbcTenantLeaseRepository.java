package com.storagegateway.worker.eventlog;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Duration;
import java.util.List;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class JdbcTenantLeaseRepository implements TenantLeaseRepository {
  private final JdbcTemplate jdbcTemplate;

  public JdbcTenantLeaseRepository(JdbcTemplate jdbcTemplate) {
    this.jdbcTemplate = jdbcTemplate;
  }

  @Override
  public List<String> claimDue(int limit, Duration lease) {
    String sql =
        """
        WITH claimed AS (
            SELECT tenant_id
            FROM event_log_tenants
            WHERE next_poll_at <= NOW()
            ORDER BY next_poll_at ASC
            LIMIT ?
            FOR UPDATE SKIP LOCKED
        )
        UPDATE event_log_tenants lease
        SET next_poll_at = NOW() + make_interval(secs => ?)
        FROM claimed
        WHERE lease.tenant_id = claimed.tenant_id
        RETURNING lease.tenant_id
        """;
    return jdbcTemplate.queryForList(sql, String.class, Math.max(1, limit), lease.toSeconds());
  }

  @Override
  public void remove(String tenantId) {
    jdbcTemplate.update("DELETE FROM event_log_tenants WHERE tenant_id = ?", tenantId);
  }

  @Override
  public void reschedule(String tenantId, Duration delay) {
    String sql =
        """
        UPDATE event_log_tenants
        SET last_polled_at = NOW(),
            next_poll_at = NOW() + make_interval(secs => ?),
            poll_count = poll_count + 1
        WHERE tenant_id = ?
        """;
    jdbcTemplate.update(sql, Math.max(0L, delay.toSeconds()), tenantId);
  }

  @Override
  public List<TenantCursor> listTenants(long afterCursor, int limit) {
    String sql =
        """
        SELECT id, cursor_id
        FROM tenants
        WHERE cursor_id > ?
        ORDER BY cursor_id ASC
        LIMIT ?
        """;
    return jdbcTemplate.query(sql, this::mapCursor, afterCursor, Math.max(1, limit));
  }

  @Override
  public int register(List<String> tenantIds) {
    if (tenantIds.isEmpty()) {
      return 0;
    }
    String sql =
        """
        INSERT INTO event_log_tenants (tenant_id)
        SELECT UNNEST(?::text[])
        ON CONFLICT (tenant_id) DO NOTHING
        """;
    return jdbcTemplate.update(sql, (Object) tenantIds.toArray(new String[0]));
  }

  private TenantCursor mapCursor(ResultSet rs, int rowNum) throws SQLException {
    return new TenantCursor(rs.getString("id"), rs.getLong("cursor_id"));
  }
}
