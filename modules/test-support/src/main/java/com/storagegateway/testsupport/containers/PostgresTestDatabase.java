package com.storagegateway.testsupport.containers;

import javax.sql.DataSource;
import org.flywaydb.core.Flyway;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.testcontainers.containers.PostgreSQLContainer;

public final class PostgresTestDatabase {
  public static final String IMAGE = "postgres:16-alpine";

  private PostgresTestDatabase() {}

  public static PostgreSQLContainer<?> container() {
    return new PostgreSQLContainer<>(IMAGE)
        .withDatabaseName("storage")
        .withUsername("storage")
        .withPassword("storage");
  }

  public static DriverManagerDataSource dataSource(PostgreSQLContainer<?> postgres) {
    DriverManagerDataSource dataSource = new DriverManagerDataSource();
    dataSource.setDriverClassName(postgres.getDriverClassName());
    dataSource.setUrl(postgres.getJdbcUrl());
    dataSource.setUsername(postgres.getUsername());
    dataSource.setPassword(postgres.getPassword());
    return dataSource;
  }

  /** Drops everything Flyway created for the given locations and migrates again. */
  public static void resetSchema(DataSource dataSource, String table, String... locations) {
    Flyway flyway =
        Flyway.configure()
            .dataSource(dataSource)
            .table(table)
            .locations(locations)
            .cleanDisabled(false)
            .load();
    flyway.clean();
    flyway.migrate();
  }
}
