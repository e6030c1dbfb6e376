package com.storagegateway.worker.eventlog;

import javax.sql.DataSource;
import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.configuration.FluentConfiguration;

/** Flyway setup for the event-log objects living in a tenant database. */
public final class TenantSchemaMigrator {
  public static final String SCHEMA = "storage";
  public static final String LOCATION = "classpath:db/tenant";
  public static final String HISTORY_TABLE = "event_log_schema_history";

  private TenantSchemaMigrator() {}

  public static FluentConfiguration configure(DataSource dataSource) {
    return Flyway.configure()
        .dataSource(dataSource)
        .schemas(SCHEMA)
        .table(HISTORY_TABLE)
        .locations(LOCATION)
        .baselineOnMigrate(true)
        .baselineVersion("0");
  }

  public static void migrate(DataSource dataSource) {
    configure(dataSource).load().migrate();
  }
}
