package com.crudbase.testing;

import com.crudbase.config.DatabaseConfig;
import com.crudbase.db.SessionProvider;
import com.google.common.base.Splitter;
import com.google.common.io.Resources;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Sets up file-backed SQLite databases for tests. Each test passes its own {@code @TempDir}, so
 * databases never leak between tests.
 */
public final class EmbeddedTestHelper {

  public static final String SCHEMA_SQL_PATH = "/db/sqlite-schema.sql";

  private EmbeddedTestHelper() {}

  public static DatabaseConfig config(Path directory) {
    return DatabaseConfig.embedded(directory.resolve("test.db").toString());
  }

  /** Opens a provider on a fresh database file in {@code directory} with the fixture tables. */
  public static SessionProvider setupEmbedded(Path directory) throws SQLException {
    SessionProvider provider = new SessionProvider(config(directory));
    initializeSchema(provider);
    return provider;
  }

  /**
   * Runs the schema script one statement at a time, since the SQLite driver executes only the
   * first statement of a batch string.
   */
  public static void initializeSchema(SessionProvider provider) throws SQLException {
    String script = readResource(SCHEMA_SQL_PATH);
    provider.withSession(
        session -> {
          try (Statement stmt = session.connection().createStatement()) {
            for (String sql : Splitter.on(';').trimResults().omitEmptyStrings().split(script)) {
              stmt.execute(sql);
            }
          }
          session.commit();
          return null;
        });
  }

  static String readResource(String path) {
    try {
      return Resources.toString(
          Resources.getResource(EmbeddedTestHelper.class, path), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read " + path, e);
    }
  }
}
