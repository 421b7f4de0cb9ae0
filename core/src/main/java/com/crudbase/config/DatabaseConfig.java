package com.crudbase.config;

import com.google.common.base.MoreObjects;
import com.google.common.base.Strings;
import java.util.Map;
import java.util.Objects;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Configuration record consumed by {@link com.crudbase.db.SessionProvider} at startup.
 *
 * <p>{@code user}, {@code password}, {@code host}, {@code poolSize}, {@code expectedWorkerCount}
 * and {@code maxOverflow} only matter for {@link BackendKind#CLIENT_SERVER}. For the embedded
 * backend {@code databaseName} names the database file.
 *
 * @param environment deployment environment; development turns on statement logging
 * @param backendKind which relational engine to connect to
 * @param databaseName database name, or file path for the embedded backend
 * @param user database user
 * @param password database password
 * @param host database host, optionally {@code host:port}
 * @param connectionUri explicit JDBC URL; when set it replaces the derived URL entirely
 * @param poolSize total connection budget shared by all workers
 * @param expectedWorkerCount number of worker processes sharing {@code poolSize}
 * @param maxOverflow connections allowed beyond the per-worker pool under load
 * @param connectionTimeoutMs how long acquiring a session waits on an exhausted pool
 */
public record DatabaseConfig(
    AppEnvironment environment,
    BackendKind backendKind,
    String databaseName,
    String user,
    String password,
    String host,
    @Nullable String connectionUri,
    int poolSize,
    int expectedWorkerCount,
    int maxOverflow,
    long connectionTimeoutMs) {

  public static final String DEFAULT_DATABASE_NAME = "app.db";
  public static final String DEFAULT_USER = "user";
  public static final String DEFAULT_PASSWORD = "changeme";
  public static final String DEFAULT_HOST = "localhost";
  public static final int DEFAULT_POOL_SIZE = 83;
  public static final int DEFAULT_WORKER_COUNT = 9;
  public static final int DEFAULT_MAX_OVERFLOW = 64;
  public static final long DEFAULT_CONNECTION_TIMEOUT_MS = 30_000L;

  /** Lower bound of {@link #effectivePoolSize()}. */
  public static final int MIN_POOL_SIZE = 5;

  public DatabaseConfig {
    Objects.requireNonNull(environment, "environment");
    Objects.requireNonNull(backendKind, "backendKind");
    if (Strings.isNullOrEmpty(databaseName) && Strings.isNullOrEmpty(connectionUri)) {
      throw new IllegalArgumentException("Either a database name or a connection URI is required");
    }
    if (poolSize < 0) {
      throw new IllegalArgumentException("Pool size must not be negative: " + poolSize);
    }
    if (expectedWorkerCount <= 0) {
      throw new IllegalArgumentException(
          "Expected worker count must be positive: " + expectedWorkerCount);
    }
    if (maxOverflow < 0) {
      throw new IllegalArgumentException("Max overflow must not be negative: " + maxOverflow);
    }
    if (connectionTimeoutMs <= 0) {
      throw new IllegalArgumentException(
          "Connection timeout must be positive: " + connectionTimeoutMs);
    }
  }

  /** Default settings: development environment, embedded file {@code app.db}. */
  public static DatabaseConfig defaults() {
    return builder().build();
  }

  /** Embedded-file settings pointing at the given database file. */
  public static DatabaseConfig embedded(String databaseFile) {
    return builder().backendKind(BackendKind.EMBEDDED_FILE).databaseName(databaseFile).build();
  }

  /**
   * Loads settings from an environment map (typically {@code System.getenv()}). Missing keys take
   * their defaults.
   *
   * <p>Recognized keys: {@code ENVIRONMENT}, {@code DB_TYPE}, {@code DB_NAME}, {@code DB_USER},
   * {@code DB_PASSWORD}, {@code DB_HOST}, {@code DB_URL}, {@code DB_POOL_SIZE},
   * {@code WEB_CONCURRENCY}, {@code MAX_OVERFLOW}, {@code DB_CONNECTION_TIMEOUT_MS}.
   *
   * @throws IllegalArgumentException on unsupported enum values or malformed numbers
   */
  public static DatabaseConfig fromEnvironment(Map<String, String> env) {
    Builder builder = builder();
    String environment = env.get("ENVIRONMENT");
    if (!Strings.isNullOrEmpty(environment)) {
      builder.environment(AppEnvironment.fromConfigValue(environment));
    }
    String backend = env.get("DB_TYPE");
    if (!Strings.isNullOrEmpty(backend)) {
      builder.backendKind(BackendKind.fromConfigValue(backend));
    }
    builder.databaseName(env.getOrDefault("DB_NAME", DEFAULT_DATABASE_NAME));
    builder.user(env.getOrDefault("DB_USER", DEFAULT_USER));
    builder.password(env.getOrDefault("DB_PASSWORD", DEFAULT_PASSWORD));
    builder.host(env.getOrDefault("DB_HOST", DEFAULT_HOST));
    builder.connectionUri(Strings.emptyToNull(env.get("DB_URL")));
    builder.poolSize(parseInt(env, "DB_POOL_SIZE", DEFAULT_POOL_SIZE));
    builder.expectedWorkerCount(parseInt(env, "WEB_CONCURRENCY", DEFAULT_WORKER_COUNT));
    builder.maxOverflow(parseInt(env, "MAX_OVERFLOW", DEFAULT_MAX_OVERFLOW));
    builder.connectionTimeoutMs(
        parseInt(env, "DB_CONNECTION_TIMEOUT_MS", (int) DEFAULT_CONNECTION_TIMEOUT_MS));
    return builder.build();
  }

  private static int parseInt(Map<String, String> env, String key, int defaultValue) {
    String raw = env.get(key);
    if (Strings.isNullOrEmpty(raw)) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(raw.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(key + " must be an integer, got: " + raw, e);
    }
  }

  /**
   * Per-worker pool size: the total budget divided across workers, never below
   * {@link #MIN_POOL_SIZE}.
   */
  public int effectivePoolSize() {
    return Math.max(poolSize / expectedWorkerCount, MIN_POOL_SIZE);
  }

  /** The JDBC URL to connect to: {@link #connectionUri()} if set, otherwise derived. */
  @Nonnull
  public String jdbcUrl() {
    if (!Strings.isNullOrEmpty(connectionUri)) {
      return connectionUri;
    }
    return switch (backendKind) {
      case EMBEDDED_FILE -> backendKind.jdbcPrefix() + databaseName;
      case CLIENT_SERVER -> backendKind.jdbcPrefix() + "//" + host + "/" + databaseName;
    };
  }

  /**
   * Returns a string representation of this object without the password, safe for logs.
   *
   * <p>An explicit connection URI may embed credentials, so only its presence is shown.
   */
  public String toSecureString() {
    MoreObjects.ToStringHelper helper =
        MoreObjects.toStringHelper(this)
            .add("environment", environment)
            .add("backendKind", backendKind.configValue());
    if (Strings.isNullOrEmpty(connectionUri)) {
      helper.add("jdbcUrl", jdbcUrl());
    } else {
      helper.add("connectionUri", "<explicit>");
    }
    helper.add("user", user);
    if (backendKind == BackendKind.CLIENT_SERVER) {
      helper
          .add("poolSize", effectivePoolSize())
          .add("maxOverflow", maxOverflow)
          .add("connectionTimeoutMs", connectionTimeoutMs);
    }
    return helper.toString();
  }

  @Override
  public String toString() {
    return toSecureString();
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Builder seeded with the default settings. */
  public static final class Builder {
    private AppEnvironment environment = AppEnvironment.DEVELOPMENT;
    private BackendKind backendKind = BackendKind.EMBEDDED_FILE;
    private String databaseName = DEFAULT_DATABASE_NAME;
    private String user = DEFAULT_USER;
    private String password = DEFAULT_PASSWORD;
    private String host = DEFAULT_HOST;
    private String connectionUri;
    private int poolSize = DEFAULT_POOL_SIZE;
    private int expectedWorkerCount = DEFAULT_WORKER_COUNT;
    private int maxOverflow = DEFAULT_MAX_OVERFLOW;
    private long connectionTimeoutMs = DEFAULT_CONNECTION_TIMEOUT_MS;

    private Builder() {}

    public Builder environment(AppEnvironment environment) {
      this.environment = environment;
      return this;
    }

    public Builder backendKind(BackendKind backendKind) {
      this.backendKind = backendKind;
      return this;
    }

    public Builder databaseName(String databaseName) {
      this.databaseName = databaseName;
      return this;
    }

    public Builder user(String user) {
      this.user = user;
      return this;
    }

    public Builder password(String password) {
      this.password = password;
      return this;
    }

    public Builder host(String host) {
      this.host = host;
      return this;
    }

    public Builder connectionUri(@Nullable String connectionUri) {
      this.connectionUri = connectionUri;
      return this;
    }

    public Builder poolSize(int poolSize) {
      this.poolSize = poolSize;
      return this;
    }

    public Builder expectedWorkerCount(int expectedWorkerCount) {
      this.expectedWorkerCount = expectedWorkerCount;
      return this;
    }

    public Builder maxOverflow(int maxOverflow) {
      this.maxOverflow = maxOverflow;
      return this;
    }

    public Builder connectionTimeoutMs(long connectionTimeoutMs) {
      this.connectionTimeoutMs = connectionTimeoutMs;
      return this;
    }

    public DatabaseConfig build() {
      return new DatabaseConfig(
          environment,
          backendKind,
          databaseName,
          user,
          password,
          host,
          connectionUri,
          poolSize,
          expectedWorkerCount,
          maxOverflow,
          connectionTimeoutMs);
    }
  }
}
