package com.crudbase.model;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.util.Locale;
import javax.annotation.Nonnull;

/**
 * Java-side type of a declared column. Values written through the CRUD engine are coerced to the
 * column's Java type before they are bound; anything that cannot be coerced is rejected.
 */
public enum ColumnType {
  LONG(Long.class),
  INTEGER(Integer.class),
  DOUBLE(Double.class),
  STRING(String.class),
  BOOLEAN(Boolean.class),
  INSTANT(Instant.class),
  UUID(java.util.UUID.class);

  private final Class<?> javaType;

  ColumnType(Class<?> javaType) {
    this.javaType = javaType;
  }

  public Class<?> javaType() {
    return javaType;
  }

  /**
   * Converts {@code value} to this column's Java type.
   *
   * <p>Integral numbers widen to {@code LONG}, any number to {@code DOUBLE}, offset and zoned date
   * times to {@code INSTANT}, and canonical UUID strings to {@code UUID}.
   *
   * @throws IllegalArgumentException if the value cannot represent this type
   */
  @Nonnull
  public Object coerce(@Nonnull Object value) {
    if (javaType.isInstance(value)) {
      return value;
    }
    switch (this) {
      case LONG:
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
          return ((Number) value).longValue();
        }
        break;
      case INTEGER:
        if (value instanceof Short || value instanceof Byte) {
          return ((Number) value).intValue();
        }
        if (value instanceof Long longValue
            && longValue >= Integer.MIN_VALUE
            && longValue <= Integer.MAX_VALUE) {
          return longValue.intValue();
        }
        break;
      case DOUBLE:
        if (value instanceof Number number) {
          return number.doubleValue();
        }
        break;
      case INSTANT:
        if (value instanceof OffsetDateTime offsetDateTime) {
          return offsetDateTime.toInstant();
        }
        if (value instanceof ZonedDateTime zonedDateTime) {
          return zonedDateTime.toInstant();
        }
        break;
      case UUID:
        if (value instanceof String text) {
          return java.util.UUID.fromString(text);
        }
        break;
      default:
        break;
    }
    throw new IllegalArgumentException(
        "expected "
            + name().toLowerCase(Locale.ROOT)
            + " but got "
            + value.getClass().getSimpleName());
  }
}
