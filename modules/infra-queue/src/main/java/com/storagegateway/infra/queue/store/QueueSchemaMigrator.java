package com.storagegateway.infra.queue.store;

import javax.sql.DataSource;
import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.configuration.FluentConfiguration;

public final class QueueSchemaMigrator {
  public static final String SCHEMA = "queue";
  public static final String LOCATION = "classpath:db/queue";
  public static final String HISTORY_TABLE = "queue_schema_history";

  private QueueSchemaMigrator() {}

  public static FluentConfiguration configure(DataSource dataSource) {
    return Flyway.configure()
        .dataSource(dataSource)
        .schemas(SCHEMA)
        .table(HISTORY_TABLE)
        .locations(LOCATION);
  }

  public static void migrate(DataSource dataSource) {
    configure(dataSource).load().migrate();
  }
}
