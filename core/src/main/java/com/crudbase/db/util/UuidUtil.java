package com.crudbase.db.util;

import com.crudbase.common.status.Status;
import com.crudbase.common.status.StatusOr;
import java.util.UUID;
import javax.annotation.Nonnull;

/** Utility methods for working with UUIDs. */
public final class UuidUtil {

  private UuidUtil() {
    // Utility class, no instances
  }

  /** Generates the identifier for a new UUID-keyed row. */
  @Nonnull
  public static UUID newId() {
    return UUID.randomUUID();
  }

  /**
   * Converts a string to a UUID.
   *
   * @param str The string representation of the UUID
   * @return StatusOr containing the UUID or an error status
   */
  @Nonnull
  public static StatusOr<UUID> fromString(String str) {
    if (str == null || str.isEmpty()) {
      return StatusOr.ofStatus(Status.invalidArgument("UUID string cannot be null or empty"));
    }
    try {
      return StatusOr.ofValue(UUID.fromString(str));
    } catch (IllegalArgumentException e) {
      return StatusOr.ofStatus(Status.invalidArgument("Invalid UUID string: " + str));
    }
  }
}
