package com.crudbase.db.util;

import com.crudbase.common.status.Status;
import com.crudbase.common.status.StatusOr;
import com.crudbase.config.BackendKind;
import com.crudbase.model.ColumnType;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import org.sqlite.SQLiteErrorCode;
import org.sqlite.SQLiteException;

/**
 * Utility methods for database operations.
 *
 * <p>The embedded SQLite backend has no native UUID or timestamp type: UUIDs are stored as their
 * canonical text and instants as epoch milliseconds. PostgreSQL binds both natively.
 */
public final class DbUtil {

  /** SQLSTATE for {@code unique_violation}. */
  public static final String UNIQUE_VIOLATION_SQL_STATE = "23505";

  private DbUtil() {
    // Utility class, no instances
  }

  /** Converts a java.sql.Timestamp to java.time.Instant. */
  @Nonnull
  public static Instant toInstant(java.sql.Timestamp timestamp) {
    if (timestamp == null) {
      throw new IllegalArgumentException("Timestamp cannot be null");
    }
    return timestamp.toInstant();
  }

  /** Converts a java.time.Instant to java.sql.Timestamp. */
  @Nonnull
  public static java.sql.Timestamp toSqlTimestamp(Instant instant) {
    if (instant == null) {
      throw new IllegalArgumentException("Instant cannot be null");
    }
    return java.sql.Timestamp.from(instant);
  }

  /** Double-quotes an identifier already validated as lower snake case. */
  @Nonnull
  public static String quote(String identifier) {
    return '"' + identifier + '"';
  }

  /**
   * Binds {@code value} to a statement parameter using the representation {@code backend} stores
   * for {@code type}.
   */
  public static void bind(
      PreparedStatement stmt,
      int parameterIndex,
      ColumnType type,
      @Nullable Object value,
      BackendKind backend)
      throws SQLException {
    if (value == null) {
      stmt.setNull(parameterIndex, sqlType(type, backend));
      return;
    }
    switch (type) {
      case LONG -> stmt.setLong(parameterIndex, (Long) value);
      case INTEGER -> stmt.setInt(parameterIndex, (Integer) value);
      case DOUBLE -> stmt.setDouble(parameterIndex, (Double) value);
      case STRING -> stmt.setString(parameterIndex, (String) value);
      case BOOLEAN -> stmt.setBoolean(parameterIndex, (Boolean) value);
      case INSTANT -> stmt.setTimestamp(parameterIndex, toSqlTimestamp((Instant) value));
      case UUID -> {
        if (backend == BackendKind.CLIENT_SERVER) {
          stmt.setObject(parameterIndex, value);
        } else {
          stmt.setString(parameterIndex, value.toString());
        }
      }
    }
  }

  /**
   * Reads a column as its {@link ColumnType} Java type, returning Optional.empty() if the column
   * is null.
   */
  @Nonnull
  public static StatusOr<Optional<Object>> readColumn(
      ResultSet rs, String columnName, ColumnType type, BackendKind backend) {
    try {
      Object value =
          switch (type) {
            case LONG -> rs.getLong(columnName);
            case INTEGER -> rs.getInt(columnName);
            case DOUBLE -> rs.getDouble(columnName);
            case STRING -> rs.getString(columnName);
            case BOOLEAN -> rs.getBoolean(columnName);
            case INSTANT -> rs.getTimestamp(columnName);
            case UUID -> backend == BackendKind.CLIENT_SERVER
                ? rs.getObject(columnName, UUID.class)
                : rs.getString(columnName);
          };
      if (rs.wasNull() || value == null) {
        return StatusOr.ofValue(Optional.empty());
      }
      if (value instanceof java.sql.Timestamp timestamp) {
        return StatusOr.ofValue(Optional.of(timestamp.toInstant()));
      }
      if (type == ColumnType.UUID && value instanceof String text) {
        return UuidUtil.fromString(text).map(uuid -> Optional.<Object>of(uuid));
      }
      return StatusOr.ofValue(Optional.of(value));
    } catch (SQLException e) {
      return StatusOr.ofStatus(
          Status.internal("Failed to read column " + columnName + ": " + e.getMessage(), e));
    }
  }

  /**
   * True if {@code e}, or an exception chained to it, reports a unique or primary key violation.
   * Other integrity violations (not-null, foreign key, check) are not matched.
   */
  public static boolean isUniqueViolation(SQLException e) {
    for (Throwable t = e; t != null; t = nextCause(t)) {
      if (t instanceof SQLiteException sqliteException) {
        SQLiteErrorCode code = sqliteException.getResultCode();
        if (code == SQLiteErrorCode.SQLITE_CONSTRAINT_UNIQUE
            || code == SQLiteErrorCode.SQLITE_CONSTRAINT_PRIMARYKEY) {
          return true;
        }
        // Without extended result codes only the primary code is reported.
        String message = sqliteException.getMessage();
        if (code == SQLiteErrorCode.SQLITE_CONSTRAINT
            && message != null
            && (message.contains("UNIQUE constraint failed")
                || message.contains("PRIMARY KEY constraint failed"))) {
          return true;
        }
      } else if (t instanceof SQLException sqlException
          && UNIQUE_VIOLATION_SQL_STATE.equals(sqlException.getSQLState())) {
        return true;
      }
    }
    return false;
  }

  @Nullable
  private static Throwable nextCause(Throwable t) {
    if (t instanceof SQLException sqlException && sqlException.getNextException() != null) {
      return sqlException.getNextException();
    }
    return t.getCause() == t ? null : t.getCause();
  }

  private static int sqlType(ColumnType type, BackendKind backend) {
    return switch (type) {
      case LONG -> Types.BIGINT;
      case INTEGER -> Types.INTEGER;
      case DOUBLE -> Types.DOUBLE;
      case STRING -> Types.VARCHAR;
      case BOOLEAN -> Types.BOOLEAN;
      case INSTANT -> Types.TIMESTAMP;
      case UUID -> backend == BackendKind.CLIENT_SERVER ? Types.OTHER : Types.VARCHAR;
    };
  }
}
