package com.storagegateway.infra.queue.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.storagegateway.infra.queue.errors.QueueException;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;

public class JdbcQueueStore implements QueueStore {
  private static final Logger log = LoggerFactory.getLogger(JdbcQueueStore.class);

  private static final String INSERT_SQL =
      """
      INSERT INTO queue.job (
        id, name, data, priority, retry_limit, retry_delay, retry_backoff,
        start_after, singleton_key, expire_in, dead_letter, policy
      )
      SELECT j.id,
             j.name,
             j.data,
             COALESCE(j.priority, 0),
             COALESCE(j."retryLimit", q.retry_limit),
             COALESCE(j."retryDelay", q.retry_delay),
             COALESCE(j."retryBackoff", q.retry_backoff),
             COALESCE(j."startAfter", NOW()),
             j."singletonKey",
             make_interval(secs => COALESCE(j."expireInSeconds", q.expire_seconds)),
             COALESCE(j."deadLetter", q.dead_letter),
             q.policy
      FROM json_to_recordset(?::json) AS j (
        id UUID,
        name TEXT,
        data JSONB,
        priority INT,
        "retryLimit" INT,
        "retryDelay" INT,
        "retryBackoff" BOOLEAN,
        "startAfter" TIMESTAMPTZ,
        "singletonKey" TEXT,
        "deadLetter" TEXT,
        "expireInSeconds" INT
      )
      JOIN queue.queue q ON q.name = j.name
      ON CONFLICT DO NOTHING
      RETURNING id
      """;

  private static final String CAN_RETRY =
      """
      j.retry_count < j.retry_limit
      AND NOT EXISTS (
        SELECT 1 FROM queue.job r
        WHERE j.policy = 'stately'
          AND r.name = j.name
          AND r.state = 'retry'
          AND COALESCE(r.singleton_key, '') = COALESCE(j.singleton_key, '')
          AND r.id <> j.id
      )
      """;

  private static final String RETRY_STATE_UPDATE =
      """
      UPDATE queue.job j
      SET state = CASE WHEN d.can_retry THEN 'retry'::queue.job_state ELSE 'failed'::queue.job_state END,
          start_after = CASE
            WHEN d.can_retry THEN NOW() + make_interval(secs => CASE
              WHEN j.retry_backoff THEN j.retry_delay * power(2, LEAST(j.retry_count, 16))
              ELSE j.retry_delay
            END)
            ELSE j.start_after
          END,
          completed_on = CASE WHEN d.can_retry THEN NULL ELSE NOW() END,
          output = ?::jsonb
      FROM decision d
      WHERE j.id = d.id
      RETURNING j.*
      """;

  private static final String DEAD_LETTER_COPY =
      """
      dead_lettered AS (
        INSERT INTO queue.job (
          name, data, output, priority, retry_limit, retry_delay, retry_backoff,
          expire_in, policy, dead_letter, singleton_key
        )
        SELECT f.dead_letter, f.data, f.output, f.priority, q.retry_limit, q.retry_delay,
               q.retry_backoff, make_interval(secs => q.expire_seconds), q.policy, q.dead_letter,
               f.singleton_key
        FROM failed f
        JOIN queue.queue q ON q.name = f.dead_letter
        WHERE f.state = 'failed' AND f.dead_letter IS NOT NULL
        ON CONFLICT DO NOTHING
        RETURNING id
      )
      """;

  private final DataSource dataSource;
  private final JdbcTemplate jdbcTemplate;
  private final ObjectMapper objectMapper;
  private final QueueStoreObserver observer;

  public JdbcQueueStore(DataSource dataSource, ObjectMapper objectMapper, QueueStoreObserver observer) {
    this(dataSource, new JdbcTemplate(dataSource), objectMapper, observer);
  }

  public JdbcQueueStore(
      DataSource dataSource,
      JdbcTemplate jdbcTemplate,
      ObjectMapper objectMapper,
      QueueStoreObserver observer) {
    this.dataSource = Objects.requireNonNull(dataSource, "dataSource must not be null");
    this.jdbcTemplate = Objects.requireNonNull(jdbcTemplate, "jdbcTemplate must not be null");
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    this.observer = observer == null ? QueueStoreObserver.NONE : observer;
  }

  @Override
  public void migrate() {
    observe("migrate", () -> {
      QueueSchemaMigrator.migrate(dataSource);
      return null;
    });
  }

  @Override
  public boolean createQueue(QueueDefinition definition) {
    String sql =
        """
        INSERT INTO queue.queue (
          name, policy, retry_limit, retry_delay, retry_backoff,
          expire_seconds, retention_minutes, dead_letter
        )
        VALUES (?, ?, ?, ?, ?, ?, ?, ?)
        ON CONFLICT (name) DO NOTHING
        """;
    int created =
        observe(
            "createQueue",
            () ->
                jdbcTemplate.update(
                    sql,
                    definition.name(),
                    definition.policy().wireName(),
                    definition.retryLimit(),
                    definition.retryDelaySeconds(),
                    definition.retryBackoff(),
                    definition.expireInSeconds(),
                    definition.retentionMinutes(),
                    definition.deadLetter()));
    return created > 0;
  }

  @Override
  public int insert(List<JobInsert> jobs) {
    if (jobs == null || jobs.isEmpty()) {
      return 0;
    }
    String payload = toRecordset(jobs);
    List<UUID> inserted = observe("insert", () -> jdbcTemplate.queryForList(INSERT_SQL, UUID.class, payload));
    if (inserted.size() < jobs.size()) {
      log.debug("Queue insert deduplicated requested={} inserted={}", jobs.size(), inserted.size());
    }
    return inserted.size();
  }

  @Override
  public Optional<UUID> send(JobInsert job) {
    String payload = toRecordset(List.of(job));
    List<UUID> inserted = observe("send", () -> jdbcTemplate.queryForList(INSERT_SQL, UUID.class, payload));
    return inserted.stream().findFirst();
  }

  @Override
  public List<Job> fetch(String queue, int limit) {
    if (limit <= 0) {
      return List.of();
    }
    String sql =
        """
        WITH next AS (
          SELECT j.id, j.policy, COALESCE(j.singleton_key, '') AS key, j.priority, j.created_on
          FROM queue.job j
          WHERE j.name = ?
            AND j.state < 'active'
            AND j.start_after <= NOW()
            AND NOT (
              j.policy IN ('singleton', 'stately')
              AND EXISTS (
                SELECT 1 FROM queue.job a
                WHERE a.name = j.name
                  AND a.state = 'active'
                  AND COALESCE(a.singleton_key, '') = COALESCE(j.singleton_key, '')
              )
            )
          ORDER BY j.priority DESC, j.created_on, j.id
          LIMIT ?
          FOR UPDATE OF j SKIP LOCKED
        ),
        picked AS (
          SELECT DISTINCT ON (CASE WHEN policy IN ('singleton', 'stately') THEN key ELSE id::text END) id
          FROM next
          ORDER BY CASE WHEN policy IN ('singleton', 'stately') THEN key ELSE id::text END,
                   priority DESC, created_on, id
        )
        UPDATE queue.job j
        SET state = 'active',
            started_on = NOW(),
            retry_count = CASE WHEN j.state = 'retry' THEN j.retry_count + 1 ELSE j.retry_count END
        FROM picked
        WHERE j.id = picked.id
        RETURNING j.*
        """;
    List<Job> jobs = observe("fetch", () -> jdbcTemplate.query(sql, this::mapJob, queue, limit));
    return jobs.stream()
        .sorted(Comparator.comparingInt(Job::priority).reversed().thenComparing(Job::createdOn))
        .toList();
  }

  @Override
  public boolean complete(String queue, UUID jobId) {
    String sql =
        """
        UPDATE queue.job
        SET state = 'completed', completed_on = NOW()
        WHERE name = ? AND id = ? AND state = 'active'
        """;
    return observe("complete", () -> jdbcTemplate.update(sql, queue, jobId)) > 0;
  }

  @Override
  public Optional<JobState> fail(String queue, UUID jobId, Throwable error) {
    String sql =
        "WITH decision AS (SELECT j.id, "
            + CAN_RETRY
            + " AS can_retry FROM queue.job j WHERE j.name = ? AND j.id = ? AND j.state = 'active' FOR UPDATE),"
            + " failed AS ("
            + RETRY_STATE_UPDATE
            + "), "
            + DEAD_LETTER_COPY
            + " SELECT f.state::text FROM failed f";
    String output = errorOutput(error);
    List<String> states =
        observe("fail", () -> jdbcTemplate.queryForList(sql, String.class, queue, jobId, output));
    return states.stream().findFirst().map(JobState::fromWire);
  }

  @Override
  public int expireActive() {
    String sql =
        "WITH decision AS (SELECT j.id, "
            + CAN_RETRY
            + " AS can_retry FROM queue.job j"
            + " WHERE j.state = 'active' AND j.started_on + j.expire_in < NOW()"
            + " FOR UPDATE SKIP LOCKED),"
            + " failed AS ("
            + RETRY_STATE_UPDATE
            + "), "
            + DEAD_LETTER_COPY
            + " SELECT COUNT(*) FROM failed";
    String output = "{\"message\":\"job expired\"}";
    Integer expired = observe("expireActive", () -> jdbcTemplate.queryForObject(sql, Integer.class, output));
    return expired == null ? 0 : expired;
  }

  @Override
  public int purgeFinished() {
    String sql =
        """
        DELETE FROM queue.job j
        USING queue.queue q
        WHERE q.name = j.name
          AND j.state > 'active'
          AND j.completed_on < NOW() - make_interval(mins => q.retention_minutes)
        """;
    return observe("purgeFinished", () -> jdbcTemplate.update(sql));
  }

  @Override
  public void close() {
    if (dataSource instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception ex) {
        throw new QueueException("Failed to close queue store", ex);
      }
    }
  }

  private <T> T observe(String operation, Supplier<T> call) {
    try {
      T result = call.get();
      observer.onSuccess(operation);
      return result;
    } catch (RuntimeException ex) {
      observer.onError(operation, ex);
      throw ex;
    }
  }

  private String toRecordset(List<JobInsert> jobs) {
    ArrayNode records = objectMapper.createArrayNode();
    for (JobInsert job : jobs) {
      ObjectNode record = records.addObject();
      record.put("id", job.id().toString());
      record.put("name", job.name());
      record.set("data", job.data());
      record.put("priority", job.priority());
      record.put("retryLimit", job.retryLimit());
      record.put("retryDelay", job.retryDelaySeconds());
      record.put("retryBackoff", job.retryBackoff());
      record.put("startAfter", job.startAfter() == null ? null : job.startAfter().toString());
      record.put("singletonKey", job.singletonKey());
      record.put("deadLetter", job.deadLetter());
      record.put("expireInSeconds", job.expireInSeconds());
    }
    try {
      return objectMapper.writeValueAsString(records);
    } catch (JsonProcessingException ex) {
      throw new QueueException("Failed to serialize jobs", ex);
    }
  }

  private String errorOutput(Throwable error) {
    ObjectNode output = objectMapper.createObjectNode();
    if (error != null) {
      output.put("type", error.getClass().getName());
      output.put("message", Objects.requireNonNullElse(error.getMessage(), error.getClass().getSimpleName()));
    }
    return output.toString();
  }

  private Job mapJob(ResultSet rs, int rowNum) throws SQLException {
    return new Job(
        rs.getObject("id", UUID.class),
        rs.getString("name"),
        readData(rs.getString("data")),
        JobState.fromWire(rs.getString("state")),
        rs.getInt("retry_count"),
        rs.getInt("retry_limit"),
        rs.getInt("retry_delay"),
        rs.getBoolean("retry_backoff"),
        rs.getInt("priority"),
        rs.getString("singleton_key"),
        QueuePolicy.fromWire(rs.getString("policy")),
        rs.getString("dead_letter"),
        toInstant(rs.getTimestamp("start_after")),
        toInstant(rs.getTimestamp("created_on")),
        toInstant(rs.getTimestamp("started_on")));
  }

  private JsonNode readData(String json) throws SQLException {
    if (json == null) {
      return objectMapper.nullNode();
    }
    try {
      return objectMapper.readTree(json);
    } catch (JsonProcessingException ex) {
      throw new SQLException("Invalid job data", ex);
    }
  }

  private static Instant toInstant(Timestamp timestamp) {
    return timestamp == null ? null : timestamp.toInstant();
  }
}
