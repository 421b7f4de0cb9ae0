/**
 * Sessions, connection pooling and the generic CRUD engine.
 *
 * <p>A {@link com.crudbase.db.SessionProvider} is built once per process from a {@link
 * com.crudbase.config.DatabaseConfig}. Callers open one {@link com.crudbase.db.Session} per unit of
 * work and pass it to {@link com.crudbase.db.CrudRepository} operations, which block on JDBC on the
 * calling thread:
 *
 * <pre>{@code
 * try (SessionProvider sessions = new SessionProvider(DatabaseConfig.fromEnvironment(System.getenv()));
 *     Session session = sessions.openSession()) {
 *   StatusOr<Member> member = members.create(session, Map.of("name", "Alice", "email", "a@x.io"));
 * }
 * }</pre>
 */
package com.crudbase.db;
