package com.crudbase.db;

import static org.junit.jupiter.api.Assertions.*;

import com.crudbase.common.status.StatusCode;
import com.crudbase.common.status.StatusOr;
import com.crudbase.testing.Account;
import com.crudbase.testing.Member;
import com.crudbase.testing.MemberCreate;
import com.crudbase.testing.PostgresTestHelper;
import com.crudbase.testing.Product;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

/**
 * Tests for CrudRepository against PostgreSQL using Testcontainers. Skipped when Docker is not
 * available.
 */
@Testcontainers(disabledWithoutDocker = true)
public class CrudRepositoryPostgresTest {

  @Container
  private static final PostgreSQLContainer<?> postgres =
      PostgresTestHelper.createPostgresContainer("crudbase_test");

  private static SessionProvider provider;

  private final CrudRepository<Member, Long> members = new CrudRepository<>(Member.DESCRIPTOR);
  private final CrudRepository<Product, Long> products = new CrudRepository<>(Product.DESCRIPTOR);
  private final CrudRepository<Account, UUID> accounts = new CrudRepository<>(Account.DESCRIPTOR);

  @BeforeAll
  static void setUp() {
    provider = new SessionProvider(PostgresTestHelper.config(postgres));
  }

  @AfterAll
  static void tearDown() {
    if (provider != null) {
      provider.close();
    }
  }

  @BeforeEach
  void clearDatabase() throws SQLException {
    PostgresTestHelper.truncateAll(provider);
  }

  @Test
  void testSerialIdsComeFromReturning() throws SQLException {
    try (Session session = provider.openSession()) {
      Member first = members.create(session, new MemberCreate("Ann", "ann@x.com")).getValue();
      Member second = members.create(session, new MemberCreate("Bob", "bob@x.com")).getValue();

      assertEquals(1L, first.id());
      assertEquals(2L, second.id());
      assertEquals(first, members.get(session, first.id()).getValue());
    }
  }

  @Test
  void testNativeUuidRoundTrip() throws SQLException {
    try (Session session = provider.openSession()) {
      Account account =
          accounts
              .create(
                  session,
                  Map.of("display_name", "Ann", "email", "ann@x.com", "hashed_password", "h"))
              .getValue();

      assertEquals(account, accounts.get(session, account.id()).getValue());
      assertTrue(accounts.exists(session, Map.of("id", account.id())).getValue());
    }
  }

  @Test
  void testUniqueViolationIsAlreadyExists() throws SQLException {
    try (Session session = provider.openSession()) {
      members.create(session, new MemberCreate("Ann", "ann@x.com"));

      StatusOr<Member> duplicate = members.create(session, new MemberCreate("A", "ann@x.com"));

      assertEquals(StatusCode.ALREADY_EXISTS, duplicate.getCode());
      // The aborted transaction was rolled back, so the session still works
      assertEquals(1L, members.count(session).getValue());
    }
  }

  @Test
  void testSoftDeleteAndPaging() throws SQLException {
    try (Session session = provider.openSession()) {
      for (int i = 0; i < 5; i++) {
        products.create(session, Map.of("name", "p" + i, "price", 1.5 * i));
      }
      List<Product> page = products.getMulti(session, 2, 2).getValue();
      assertEquals(List.of(3L, 4L), page.stream().map(Product::id).toList());

      assertTrue(products.delete(session, 3L, true).getValue());
      Product deleted = products.get(session, 3L).getValue();
      assertTrue(deleted.isDeleted());
      assertNotNull(deleted.deletion().deletedAt());
      assertEquals(deleted.deletion().deletedAt(), deleted.updatedAt());

      assertTrue(products.delete(session, 3L).getValue());
      assertEquals(StatusCode.NOT_FOUND, products.get(session, 3L).getCode());
    }
  }

  @Test
  void testCheckViolationIsRolledBackAndSessionStaysUsable() throws SQLException {
    try (Session session = provider.openSession()) {
      Product lamp = products.create(session, Map.of("name", "Lamp", "price", 20.0)).getValue();

      StatusOr<Product> rejected =
          products.create(session, Map.of("name", "Desk", "price", -1.0));
      assertEquals(StatusCode.INTERNAL, rejected.getCode());

      // Without a rollback PostgreSQL would refuse every further statement in this transaction
      assertEquals(lamp, products.get(session, lamp.id()).getValue());

      StatusOr<Product> badUpdate = products.update(session, lamp.id(), Map.of("price", -5.0));
      assertEquals(StatusCode.INTERNAL, badUpdate.getCode());
      assertEquals(20.0, products.get(session, lamp.id()).getValue().price());
      assertEquals(1L, products.count(session).getValue());
    }
  }

  @Test
  void testConcurrentGetOrCreateStoresOneRow() throws Exception {
    int threads = 8;
    ExecutorService executor = Executors.newFixedThreadPool(threads);
    CountDownLatch start = new CountDownLatch(1);
    List<Future<StatusOr<GetOrCreateResult<Member>>>> futures = new ArrayList<>();
    try {
      for (int i = 0; i < threads; i++) {
        String name = "racer-" + i;
        futures.add(
            executor.submit(
                () -> {
                  start.await();
                  return provider.withSession(
                      session ->
                          members.getOrCreate(
                              session,
                              new MemberCreate(name, "race@x.com"),
                              Map.of("email", "race@x.com")));
                }));
      }
      start.countDown();

      int created = 0;
      for (Future<StatusOr<GetOrCreateResult<Member>>> future : futures) {
        StatusOr<GetOrCreateResult<Member>> result = future.get(30, TimeUnit.SECONDS);
        if (result.isOk()) {
          created += result.getValue().created() ? 1 : 0;
        } else {
          // Lost the race between lookup and insert
          assertEquals(StatusCode.ALREADY_EXISTS, result.getCode());
        }
      }
      assertEquals(1, created);
    } finally {
      executor.shutdownNow();
    }

    try (Session session = provider.openSession()) {
      assertEquals(1L, members.count(session).getValue());
    }
  }
}
