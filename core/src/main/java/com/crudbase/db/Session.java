package com.crudbase.db;

import com.crudbase.config.BackendKind;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import org.tinylog.Logger;

/**
 * A unit of database work over one pooled connection in manual-commit mode.
 *
 * <p>A session is owned by a single caller at a time. Closing it rolls back anything that was not
 * committed and returns the connection to the pool; the connection is released even if the
 * rollback fails.
 *
 * <p>The session tracks whether its open transaction has prepared any statement other than a
 * query. Work done directly on {@link #connection()} is not tracked.
 */
public final class Session implements AutoCloseable {

  private final Connection connection;
  private final BackendKind backend;
  private final boolean logStatements;
  private boolean writePending;
  private boolean closed;

  Session(Connection connection, BackendKind backend, boolean logStatements) {
    this.connection = connection;
    this.backend = backend;
    this.logStatements = logStatements;
  }

  public Connection connection() {
    return connection;
  }

  public BackendKind backend() {
    return backend;
  }

  /** Prepares {@code sql}, echoing it to the log in development. */
  public PreparedStatement prepare(String sql) throws SQLException {
    if (logStatements) {
      Logger.info("SQL: {}", sql);
    }
    if (!isQuery(sql)) {
      writePending = true;
    }
    return connection.prepareStatement(sql);
  }

  public void commit() throws SQLException {
    connection.commit();
    writePending = false;
  }

  public void rollback() throws SQLException {
    connection.rollback();
    writePending = false;
  }

  /**
   * Called before the engine writes. An embedded transaction that has only read holds a snapshot
   * SQLite refuses to upgrade once another session has committed, so it is ended here and the
   * write opens a new transaction that waits on the busy timeout for the write lock.
   */
  void beginWrite() throws SQLException {
    if (backend == BackendKind.EMBEDDED_FILE && !writePending) {
      connection.rollback();
    }
  }

  public boolean isClosed() {
    return closed;
  }

  private static boolean isQuery(String sql) {
    return sql.stripLeading().regionMatches(true, 0, "SELECT", 0, 6);
  }

  @Override
  public void close() throws SQLException {
    if (closed) {
      return;
    }
    closed = true;
    writePending = false;
    try {
      connection.rollback();
    } finally {
      connection.close();
    }
  }
}
