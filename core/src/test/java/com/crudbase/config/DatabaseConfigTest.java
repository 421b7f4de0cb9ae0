package com.crudbase.config;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Map;
import org.junit.jupiter.api.Test;

/** Tests for DatabaseConfig loading, validation and derived values. */
public class DatabaseConfigTest {

  @Test
  void testDefaults() {
    DatabaseConfig config = DatabaseConfig.fromEnvironment(Map.of());

    assertEquals(AppEnvironment.DEVELOPMENT, config.environment());
    assertEquals(BackendKind.EMBEDDED_FILE, config.backendKind());
    assertEquals("app.db", config.databaseName());
    assertEquals("user", config.user());
    assertEquals("changeme", config.password());
    assertEquals("localhost", config.host());
    assertNull(config.connectionUri());
    assertEquals(83, config.poolSize());
    assertEquals(9, config.expectedWorkerCount());
    assertEquals(64, config.maxOverflow());
    assertEquals(30_000L, config.connectionTimeoutMs());
    assertEquals(DatabaseConfig.defaults(), config);
  }

  @Test
  void testFromEnvironmentReadsEveryKey() {
    DatabaseConfig config =
        DatabaseConfig.fromEnvironment(
            Map.ofEntries(
                Map.entry("ENVIRONMENT", "production"),
                Map.entry("DB_TYPE", "postgres"),
                Map.entry("DB_NAME", "shop"),
                Map.entry("DB_USER", "shop_rw"),
                Map.entry("DB_PASSWORD", "s3cret"),
                Map.entry("DB_HOST", "db.internal:5433"),
                Map.entry("DB_POOL_SIZE", "40"),
                Map.entry("WEB_CONCURRENCY", "4"),
                Map.entry("MAX_OVERFLOW", "10"),
                Map.entry("DB_CONNECTION_TIMEOUT_MS", "2500")));

    assertEquals(AppEnvironment.PRODUCTION, config.environment());
    assertFalse(config.environment().logsStatements());
    assertEquals(BackendKind.CLIENT_SERVER, config.backendKind());
    assertEquals("jdbc:postgresql://db.internal:5433/shop", config.jdbcUrl());
    assertEquals("shop_rw", config.user());
    assertEquals(10, config.effectivePoolSize());
    assertEquals(10, config.maxOverflow());
    assertEquals(2500L, config.connectionTimeoutMs());
  }

  @Test
  void testEffectivePoolSizeHasFloor() {
    // 83 / 9 = 9
    assertEquals(9, DatabaseConfig.defaults().effectivePoolSize());

    DatabaseConfig small = DatabaseConfig.builder().poolSize(12).expectedWorkerCount(4).build();
    assertEquals(DatabaseConfig.MIN_POOL_SIZE, small.effectivePoolSize());

    DatabaseConfig none = DatabaseConfig.builder().poolSize(0).build();
    assertEquals(DatabaseConfig.MIN_POOL_SIZE, none.effectivePoolSize());
  }

  @Test
  void testJdbcUrlDerivation() {
    assertEquals("jdbc:sqlite:app.db", DatabaseConfig.defaults().jdbcUrl());
    assertEquals("jdbc:sqlite:/tmp/x.db", DatabaseConfig.embedded("/tmp/x.db").jdbcUrl());

    DatabaseConfig postgres =
        DatabaseConfig.builder().backendKind(BackendKind.CLIENT_SERVER).databaseName("app").build();
    assertEquals("jdbc:postgresql://localhost/app", postgres.jdbcUrl());
  }

  @Test
  void testExplicitUriOverridesDerivedUrl() {
    DatabaseConfig config =
        DatabaseConfig.fromEnvironment(
            Map.of(
                "DB_TYPE", "client_server",
                "DB_NAME", "ignored",
                "DB_URL", "jdbc:postgresql://replica:5432/app?ssl=true"));

    assertEquals("jdbc:postgresql://replica:5432/app?ssl=true", config.jdbcUrl());
  }

  @Test
  void testBackendKindParsing() {
    assertEquals(BackendKind.EMBEDDED_FILE, BackendKind.fromConfigValue("embedded_file"));
    assertEquals(BackendKind.EMBEDDED_FILE, BackendKind.fromConfigValue("SQLite"));
    assertEquals(BackendKind.CLIENT_SERVER, BackendKind.fromConfigValue(" client_server "));
    assertEquals(BackendKind.CLIENT_SERVER, BackendKind.fromConfigValue("postgres"));

    IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class, () -> BackendKind.fromConfigValue("oracle"));
    assertEquals("Unsupported backend kind: oracle", e.getMessage());
  }

  @Test
  void testUnsupportedValuesFailFast() {
    assertThrows(
        IllegalArgumentException.class,
        () -> DatabaseConfig.fromEnvironment(Map.of("DB_TYPE", "mysql")));
    assertThrows(
        IllegalArgumentException.class,
        () -> DatabaseConfig.fromEnvironment(Map.of("ENVIRONMENT", "staging")));

    IllegalArgumentException e =
        assertThrows(
            IllegalArgumentException.class,
            () -> DatabaseConfig.fromEnvironment(Map.of("DB_POOL_SIZE", "lots")));
    assertEquals("DB_POOL_SIZE must be an integer, got: lots", e.getMessage());
  }

  @Test
  void testValidation() {
    assertThrows(
        IllegalArgumentException.class,
        () -> DatabaseConfig.builder().expectedWorkerCount(0).build());
    assertThrows(
        IllegalArgumentException.class, () -> DatabaseConfig.builder().poolSize(-1).build());
    assertThrows(
        IllegalArgumentException.class, () -> DatabaseConfig.builder().maxOverflow(-1).build());
    assertThrows(
        IllegalArgumentException.class,
        () -> DatabaseConfig.builder().connectionTimeoutMs(0).build());
    assertThrows(
        IllegalArgumentException.class, () -> DatabaseConfig.builder().databaseName("").build());
  }

  @Test
  void testSecureStringHidesSecrets() {
    DatabaseConfig config =
        DatabaseConfig.builder()
            .backendKind(BackendKind.CLIENT_SERVER)
            .password("hunter2")
            .connectionUri("jdbc:postgresql://db/app?password=hunter2")
            .build();

    String rendered = config.toSecureString();
    assertFalse(rendered.contains("hunter2"));
    assertTrue(rendered.contains("<explicit>"));
    assertEquals(rendered, config.toString());
  }
}
