package com.crudbase.model;

import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;
import javax.annotation.Nullable;

/**
 * One stored row, keyed by column name, with values already converted to their {@link ColumnType}
 * Java types. Null column values are kept as null entries.
 */
public final class Row {

  private final String entityName;
  private final Map<String, Object> values;

  public Row(String entityName, Map<String, ?> values) {
    this.entityName = entityName;
    this.values = Collections.unmodifiableMap(new HashMap<>(values));
  }

  /**
   * Returns the value of {@code column}, which may be null.
   *
   * @throws IllegalArgumentException if the row has no such column
   */
  @Nullable
  public Object get(String column) {
    if (!values.containsKey(column)) {
      throw new IllegalArgumentException("No column '" + column + "' in " + entityName + " row");
    }
    return values.get(column);
  }

  @Nullable
  public <V> V get(String column, Class<V> type) {
    return type.cast(get(column));
  }

  @Nullable
  public Long getLong(String column) {
    return get(column, Long.class);
  }

  @Nullable
  public Integer getInteger(String column) {
    return get(column, Integer.class);
  }

  @Nullable
  public Double getDouble(String column) {
    return get(column, Double.class);
  }

  @Nullable
  public String getString(String column) {
    return get(column, String.class);
  }

  @Nullable
  public Boolean getBoolean(String column) {
    return get(column, Boolean.class);
  }

  @Nullable
  public Instant getInstant(String column) {
    return get(column, Instant.class);
  }

  @Nullable
  public UUID getUuid(String column) {
    return get(column, UUID.class);
  }

  @Override
  public String toString() {
    return entityName + values;
  }
}
