package com.crudbase.db;

import static org.junit.jupiter.api.Assertions.*;

import com.crudbase.config.BackendKind;
import com.crudbase.config.DatabaseConfig;
import com.crudbase.testing.EmbeddedTestHelper;
import com.crudbase.testing.Member;
import com.crudbase.testing.MemberCreate;
import com.zaxxer.hikari.HikariConfig;
import java.nio.file.Path;
import java.sql.SQLException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/** Tests for pool configuration and session handling against an embedded database. */
public class SessionProviderTest {

  @TempDir Path tempDir;

  @Test
  void testClientServerPoolSizing() {
    DatabaseConfig config =
        DatabaseConfig.builder()
            .backendKind(BackendKind.CLIENT_SERVER)
            .databaseName("app")
            .poolSize(83)
            .expectedWorkerCount(9)
            .maxOverflow(64)
            .connectionTimeoutMs(1500)
            .build();

    HikariConfig hikari = SessionProvider.poolConfig(config);

    assertEquals("jdbc:postgresql://localhost/app", hikari.getJdbcUrl());
    assertEquals(9, hikari.getMinimumIdle());
    assertEquals(9 + 64, hikari.getMaximumPoolSize());
    assertEquals(1500, hikari.getConnectionTimeout());
    assertEquals("user", hikari.getUsername());
    assertFalse(hikari.isAutoCommit());
  }

  @Test
  void testClientServerPoolHasFloor() {
    DatabaseConfig config =
        DatabaseConfig.builder()
            .backendKind(BackendKind.CLIENT_SERVER)
            .poolSize(8)
            .expectedWorkerCount(4)
            .maxOverflow(0)
            .build();

    HikariConfig hikari = SessionProvider.poolConfig(config);

    assertEquals(5, hikari.getMinimumIdle());
    assertEquals(5, hikari.getMaximumPoolSize());
  }

  @Test
  void testEmbeddedPoolIsFixedAndUsesWal() {
    HikariConfig hikari = SessionProvider.poolConfig(DatabaseConfig.embedded("/tmp/a.db"));

    assertEquals("jdbc:sqlite:/tmp/a.db", hikari.getJdbcUrl());
    assertEquals(SessionProvider.EMBEDDED_POOL_SIZE, hikari.getMaximumPoolSize());
    assertEquals("WAL", hikari.getDataSourceProperties().getProperty("journal_mode"));
    assertEquals("5000", hikari.getDataSourceProperties().getProperty("busy_timeout"));
  }

  @Test
  void testUncommittedWorkIsRolledBackOnClose() throws SQLException {
    CrudRepository<Member, Long> members = new CrudRepository<>(Member.DESCRIPTOR);
    try (SessionProvider provider = EmbeddedTestHelper.setupEmbedded(tempDir)) {
      provider.withSession(
          session -> {
            try (var stmt =
                session.prepare(
                    "INSERT INTO members (name, email, created_at, updated_at)"
                        + " VALUES ('Ghost', 'ghost@x.com', 0, 0)")) {
              stmt.executeUpdate();
            }
            return null;
          });

      long count = provider.withSession(session -> members.count(session).getValue());
      assertEquals(0L, count);
    }
  }

  @Test
  void testCommittedWorkIsVisibleToOtherSessions() throws SQLException {
    CrudRepository<Member, Long> members = new CrudRepository<>(Member.DESCRIPTOR);
    try (SessionProvider provider = EmbeddedTestHelper.setupEmbedded(tempDir)) {
      Member created =
          provider.withSession(
              session -> members.create(session, new MemberCreate("Ann", "ann@x.com")).getValue());

      try (Session other = provider.openSession()) {
        assertEquals(created, members.get(other, created.id()).getValue());
      }
      assertEquals(BackendKind.EMBEDDED_FILE, provider.backend());
    }
  }

  @Test
  void testWithSessionClosesWhenWorkThrows() throws SQLException {
    try (SessionProvider provider = EmbeddedTestHelper.setupEmbedded(tempDir)) {
      Session[] seen = new Session[1];
      assertThrows(
          SQLException.class,
          () ->
              provider.withSession(
                  session -> {
                    seen[0] = session;
                    throw new SQLException("boom");
                  }));
      assertTrue(seen[0].isClosed());
    }
  }
}
