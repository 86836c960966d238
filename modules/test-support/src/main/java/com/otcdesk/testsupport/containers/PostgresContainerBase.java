package com.otcdesk.testsupport.containers;

import javax.sql.DataSource;
import org.flywaydb.core.Flyway;
import org.springframework.boot.testcontainers.service.connection.ServiceConnection;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

/**
 * Shared PostgreSQL container for store and orchestration tests. Tests are skipped when no Docker
 * daemon is reachable.
 */
@Testcontainers(disabledWithoutDocker = true)
public abstract class PostgresContainerBase {
  @Container @ServiceConnection
  protected static final PostgreSQLContainer<?> POSTGRES =
      new PostgreSQLContainer<>("postgres:16-alpine")
          .withDatabaseName("otcdesk")
          .withUsername("otcdesk")
          .withPassword("otcdesk");

  /** Data source on a freshly cleaned schema migrated from {@code classpath:db/migration}. */
  protected static DataSource migratedDataSource() {
    DriverManagerDataSource dataSource = new DriverManagerDataSource();
    dataSource.setDriverClassName(POSTGRES.getDriverClassName());
    dataSource.setUrl(POSTGRES.getJdbcUrl());
    dataSource.setUsername(POSTGRES.getUsername());
    dataSource.setPassword(POSTGRES.getPassword());

    Flyway flyway =
        Flyway.configure()
            .dataSource(dataSource)
            .locations("classpath:db/migration")
            .cleanDisabled(false)
            .load();
    flyway.clean();
    flyway.migrate();
    return dataSource;
  }
}
