package com.crudbase.model;

import java.util.Objects;
import java.util.regex.Pattern;
import javax.annotation.Nullable;

/**
 * A declared column of an entity table.
 *
 * @param name column name, lower snake case
 * @param type Java-side value type
 * @param nullable whether the column accepts null
 * @param hasDefault whether a create may omit this column
 * @param defaultValue value used when a create omits the column
 * @param managed set by the engine only (id, timestamps); never accepted from caller input
 */
public record Column(
    String name,
    ColumnType type,
    boolean nullable,
    boolean hasDefault,
    @Nullable Object defaultValue,
    boolean managed) {

  private static final Pattern IDENTIFIER = Pattern.compile("[a-z_][a-z0-9_]*");

  public Column {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(type, "type");
    if (!isIdentifier(name)) {
      throw new IllegalArgumentException("Invalid column name: " + name);
    }
    if (defaultValue != null) {
      defaultValue = type.coerce(defaultValue);
    }
  }

  /** A non-null column that every create must supply. */
  public static Column required(String name, ColumnType type) {
    return new Column(name, type, false, false, null, false);
  }

  /** A nullable column defaulting to null. */
  public static Column optional(String name, ColumnType type) {
    return new Column(name, type, true, true, null, false);
  }

  /** A non-null column with a default used when a create omits it. */
  public static Column withDefault(String name, ColumnType type, Object defaultValue) {
    return new Column(name, type, false, true, Objects.requireNonNull(defaultValue), false);
  }

  /** A non-null column written only by the engine. */
  public static Column managed(String name, ColumnType type) {
    return new Column(name, type, false, false, null, true);
  }

  /** True if {@code name} is safe to splice into SQL as a quoted identifier. */
  public static boolean isIdentifier(String name) {
    return name != null && IDENTIFIER.matcher(name).matches();
  }
}
