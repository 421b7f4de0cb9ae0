package com.crudbase.db;

import static org.junit.jupiter.api.Assertions.*;

import com.crudbase.common.status.Status;
import com.crudbase.common.status.StatusCode;
import java.sql.SQLException;
import org.junit.jupiter.api.Test;

/** Tests for the messages and context of CRUD failure statuses. */
public class CrudErrorsTest {

  @Test
  void testNotFound() {
    Status status = CrudErrors.notFound("Product", 7L);

    assertEquals(StatusCode.NOT_FOUND, status.getCode());
    assertEquals("Unable to find the Product with id 7.", status.getMessage());
    assertEquals(7L, status.getContext().identifier());
  }

  @Test
  void testAlreadyExistsKeepsCause() {
    SQLException cause = new SQLException("duplicate key", "23505");

    Status status = CrudErrors.alreadyExists("Member", null, cause);

    assertEquals(StatusCode.ALREADY_EXISTS, status.getCode());
    assertEquals("The Member already exists.", status.getMessage());
    assertSame(cause, status.getCause());
    assertEquals("duplicate key", status.getContext().detail());
    assertNull(status.getContext().identifier());

    Status withoutCause = CrudErrors.alreadyExists("Member", 4L, null);
    assertNull(withoutCause.getCause());
    assertNull(withoutCause.getContext().detail());
    assertEquals(4L, withoutCause.getContext().identifier());
  }

  @Test
  void testCallerRaisedKinds() {
    Status denied = CrudErrors.accessDenied("Member", 3L);
    assertEquals(StatusCode.PERMISSION_DENIED, denied.getCode());
    assertEquals(403, denied.getHttpCode());
    assertEquals("Access denied due to insufficient permissions.", denied.getMessage());

    Status noChange = CrudErrors.noChange("Member", 3L);
    assertEquals(StatusCode.NO_CHANGE, noChange.getCode());
    assertEquals("No changes detected in the content update.", noChange.getMessage());
    assertEquals("Member", noChange.getContext().entityType());
  }

  @Test
  void testFieldErrors() {
    Status unknown = CrudErrors.unknownField("Member", "age");
    assertEquals(StatusCode.UNKNOWN_FIELD, unknown.getCode());
    assertEquals("age", unknown.getContext().field());

    Status invalid = CrudErrors.invalidField("Member", "email", "Invalid email address: x");
    assertEquals(StatusCode.INVALID_ARGUMENT, invalid.getCode());
    assertEquals("email", invalid.getContext().field());
  }
}
