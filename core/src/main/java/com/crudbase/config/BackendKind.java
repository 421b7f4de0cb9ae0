package com.crudbase.config;

import java.util.Locale;

/**
 * The relational engine a {@link DatabaseConfig} points at.
 *
 * <p>Exactly one kind is active per process. The embedded kind stores everything in a single SQLite
 * file; the client/server kind talks to PostgreSQL over the network.
 */
public enum BackendKind {
  EMBEDDED_FILE("embedded_file", "sqlite", "jdbc:sqlite:"),
  CLIENT_SERVER("client_server", "postgres", "jdbc:postgresql:");

  private final String configValue;
  private final String alias;
  private final String jdbcPrefix;

  BackendKind(String configValue, String alias, String jdbcPrefix) {
    this.configValue = configValue;
    this.alias = alias;
    this.jdbcPrefix = jdbcPrefix;
  }

  /** The value used for this kind in configuration, e.g. {@code embedded_file}. */
  public String configValue() {
    return configValue;
  }

  /** The JDBC URL prefix of the driver serving this kind. */
  public String jdbcPrefix() {
    return jdbcPrefix;
  }

  /**
   * Parses a configured backend kind. Accepts the canonical value or the engine name
   * ({@code sqlite}, {@code postgres}), case-insensitively.
   *
   * @throws IllegalArgumentException if the value names no supported backend
   */
  public static BackendKind fromConfigValue(String value) {
    if (value == null) {
      throw new IllegalArgumentException("Backend kind must be set");
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    for (BackendKind kind : values()) {
      if (kind.configValue.equals(normalized) || kind.alias.equals(normalized)) {
        return kind;
      }
    }
    throw new IllegalArgumentException("Unsupported backend kind: " + value);
  }
}
