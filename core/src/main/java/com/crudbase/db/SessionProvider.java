package com.crudbase.db;

import com.crudbase.config.BackendKind;
import com.crudbase.config.DatabaseConfig;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import java.sql.Connection;
import java.sql.SQLException;
import org.tinylog.Logger;

/**
 * Owns the connection pool for one {@link DatabaseConfig} and hands out {@link Session}s.
 *
 * <p>Embedded (SQLite) databases get a small fixed pool with write-ahead logging and a busy
 * timeout so readers and one writer can proceed concurrently. Client/server (PostgreSQL) pools
 * keep {@link DatabaseConfig#effectivePoolSize()} connections and may grow by {@code
 * maxOverflow} under load.
 */
public final class SessionProvider implements AutoCloseable {

  static final int EMBEDDED_POOL_SIZE = 4;
  static final int EMBEDDED_BUSY_TIMEOUT_MS = 5000;

  private final DatabaseConfig config;
  private final HikariDataSource dataSource;

  /** Work run against a session that {@link #withSession} opens and closes. */
  @FunctionalInterface
  public interface SessionWork<R> {
    R apply(Session session) throws SQLException;
  }

  /**
   * Creates the pool and opens its initial connections.
   *
   * @throws com.zaxxer.hikari.pool.HikariPool.PoolInitializationException if the database cannot
   *     be reached
   */
  public SessionProvider(DatabaseConfig config) {
    this.config = config;
    Logger.info("Initializing database connection pool: {}", config.toSecureString());
    this.dataSource = new HikariDataSource(poolConfig(config));
  }

  static HikariConfig poolConfig(DatabaseConfig config) {
    HikariConfig hikari = new HikariConfig();
    hikari.setJdbcUrl(config.jdbcUrl());
    hikari.setAutoCommit(false);
    hikari.setConnectionTimeout(config.connectionTimeoutMs());
    if (config.backendKind() == BackendKind.EMBEDDED_FILE) {
      hikari.setPoolName("crudbase-embedded");
      hikari.setMaximumPoolSize(EMBEDDED_POOL_SIZE);
      hikari.setMinimumIdle(1);
      hikari.addDataSourceProperty("journal_mode", "WAL");
      hikari.addDataSourceProperty("busy_timeout", String.valueOf(EMBEDDED_BUSY_TIMEOUT_MS));
    } else {
      int poolSize = config.effectivePoolSize();
      hikari.setPoolName("crudbase-client-server");
      hikari.setUsername(config.user());
      hikari.setPassword(config.password());
      hikari.setMinimumIdle(poolSize);
      hikari.setMaximumPoolSize(poolSize + config.maxOverflow());
      hikari.setIdleTimeout(30000);
      hikari.setMaxLifetime(1800000);
      hikari.addDataSourceProperty("prepareThreshold", "5");
    }
    return hikari;
  }

  /**
   * Checks out a connection as a new session. The caller must close it.
   *
   * @throws SQLException if no connection becomes available within the configured timeout
   */
  public Session openSession() throws SQLException {
    Connection connection = dataSource.getConnection();
    try {
      if (connection.getAutoCommit()) {
        connection.setAutoCommit(false);
      }
    } catch (SQLException e) {
      connection.close();
      throw e;
    }
    return new Session(
        connection, config.backendKind(), config.environment().logsStatements());
  }

  /** Runs {@code work} in a fresh session, closing the session however the work ends. */
  public <R> R withSession(SessionWork<R> work) throws SQLException {
    try (Session session = openSession()) {
      return work.apply(session);
    }
  }

  public BackendKind backend() {
    return config.backendKind();
  }

  @Override
  public void close() {
    Logger.info("Closing database connection pool {}", dataSource.getPoolName());
    dataSource.close();
  }
}
