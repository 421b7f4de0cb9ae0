package com.crudbase.db.util;

import static org.junit.jupiter.api.Assertions.*;

import com.crudbase.common.status.StatusOr;
import java.util.UUID;
import org.junit.jupiter.api.Test;

/** Tests for UuidUtil. */
public class UuidUtilTest {

  @Test
  void testFromString() {
    UUID uuid = UuidUtil.newId();
    StatusOr<UUID> parsed = UuidUtil.fromString(uuid.toString());
    assertTrue(parsed.isOk());
    assertEquals(uuid, parsed.getValue());
  }

  @Test
  void testInvalidUuidString() {
    StatusOr<UUID> result = UuidUtil.fromString("not-a-uuid");
    assertFalse(result.isOk());
    assertEquals("INVALID_ARGUMENT: Invalid UUID string: not-a-uuid", result.getStatus().toString());

    assertEquals(
        "INVALID_ARGUMENT: UUID string cannot be null or empty",
        UuidUtil.fromString("").getStatus().toString());
  }

  @Test
  void testNewIdsDiffer() {
    assertNotEquals(UuidUtil.newId(), UuidUtil.newId());
  }
}
