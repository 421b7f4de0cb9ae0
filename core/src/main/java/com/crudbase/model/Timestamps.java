package com.crudbase.model;

import com.google.common.collect.ImmutableList;
import java.time.Instant;
import java.util.Objects;

/**
 * Creation and last-modification instants of a row. Both are set by the engine on create;
 * {@code updatedAt} is refreshed by every update and soft delete.
 */
public record Timestamps(Instant createdAt, Instant updatedAt) {

  public static final String CREATED_AT = "created_at";
  public static final String UPDATED_AT = "updated_at";

  static final ImmutableList<Column> COLUMNS =
      ImmutableList.of(
          Column.managed(CREATED_AT, ColumnType.INSTANT),
          Column.managed(UPDATED_AT, ColumnType.INSTANT));

  public Timestamps {
    Objects.requireNonNull(createdAt, "createdAt");
    Objects.requireNonNull(updatedAt, "updatedAt");
  }

  public static Timestamps fromRow(Row row) {
    return new Timestamps(row.getInstant(CREATED_AT), row.getInstant(UPDATED_AT));
  }
}
