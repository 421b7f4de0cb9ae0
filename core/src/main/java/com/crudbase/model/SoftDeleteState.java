package com.crudbase.model;

import com.google.common.collect.ImmutableList;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import javax.annotation.Nullable;

/**
 * Logical deletion state of a row. {@code deletedAt} is set exactly when {@code isDeleted} is
 * true; the constructor rejects any other combination.
 */
public record SoftDeleteState(boolean isDeleted, @Nullable Instant deletedAt) {

  public static final String IS_DELETED = "is_deleted";
  public static final String DELETED_AT = "deleted_at";

  public static final SoftDeleteState ACTIVE = new SoftDeleteState(false, null);

  static final ImmutableList<Column> COLUMNS =
      ImmutableList.of(
          Column.withDefault(IS_DELETED, ColumnType.BOOLEAN, false),
          Column.optional(DELETED_AT, ColumnType.INSTANT));

  public SoftDeleteState {
    if (isDeleted && deletedAt == null) {
      throw new IllegalArgumentException("deleted_at must be set when is_deleted is true");
    }
    if (!isDeleted && deletedAt != null) {
      throw new IllegalArgumentException("deleted_at must be null when is_deleted is false");
    }
  }

  public static SoftDeleteState deletedAt(Instant at) {
    return new SoftDeleteState(true, Objects.requireNonNull(at, "at"));
  }

  public static SoftDeleteState fromRow(Row row) {
    Boolean deleted = row.getBoolean(IS_DELETED);
    return new SoftDeleteState(
        deleted != null && deleted, row.getInstant(DELETED_AT));
  }

  /** Marks deleted at {@code at}. A state that is already deleted keeps its original instant. */
  public SoftDeleteState markDeleted(Instant at) {
    return isDeleted ? this : deletedAt(at);
  }

  public SoftDeleteState restore() {
    return ACTIVE;
  }

  /** Column values for this state, keyed by column name. {@code deleted_at} may map to null. */
  public Map<String, Object> asFieldValues() {
    Map<String, Object> values = new LinkedHashMap<>();
    values.put(IS_DELETED, isDeleted);
    values.put(DELETED_AT, deletedAt);
    return values;
  }
}
