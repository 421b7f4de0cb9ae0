package com.crudbase.config;

import java.util.Locale;

/** Deployment environment. Only affects how verbosely SQL statements are logged. */
public enum AppEnvironment {
  DEVELOPMENT,
  PRODUCTION;

  /** Whether sessions should log every SQL statement they issue. */
  public boolean logsStatements() {
    return this == DEVELOPMENT;
  }

  /**
   * Parses {@code development} or {@code production}, case-insensitively.
   *
   * @throws IllegalArgumentException for any other value
   */
  public static AppEnvironment fromConfigValue(String value) {
    if (value == null) {
      throw new IllegalArgumentException("Environment must be set");
    }
    try {
      return valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Unsupported environment: " + value, e);
    }
  }
}
