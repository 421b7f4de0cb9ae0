package com.crudbase.model;

import com.google.common.base.MoreObjects;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import javax.annotation.Nullable;

/**
 * Login fields of a user-like entity. The password is stored and compared only in hashed form;
 * hashing is the caller's concern.
 */
public record Credentials(String email, String hashedPassword, boolean isActive) {

  public static final String EMAIL = "email";
  public static final String HASHED_PASSWORD = "hashed_password";
  public static final String IS_ACTIVE = "is_active";

  static final ImmutableList<Column> COLUMNS =
      ImmutableList.of(
          Column.required(EMAIL, ColumnType.STRING),
          Column.required(HASHED_PASSWORD, ColumnType.STRING),
          Column.withDefault(IS_ACTIVE, ColumnType.BOOLEAN, true));

  public Credentials {
    if (!isValidEmail(email)) {
      throw new IllegalArgumentException("Invalid email address: " + email);
    }
    if (Strings.isNullOrEmpty(hashedPassword)) {
      throw new IllegalArgumentException("hashedPassword must not be empty");
    }
  }

  /** Returns whether {@code email} is a well-formed address with a dotted domain. */
  public static boolean isValidEmail(@Nullable String email) {
    return EmailAddresses.isValid(email);
  }

  public static Credentials fromRow(Row row) {
    Boolean active = row.getBoolean(IS_ACTIVE);
    return new Credentials(
        row.getString(EMAIL), row.getString(HASHED_PASSWORD), active == null || active);
  }

  /** Omits the password hash. */
  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("email", email)
        .add("isActive", isActive)
        .toString();
  }
}
