package com.crudbase.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import javax.annotation.Nullable;

/** Builds insertion-ordered field maps that, unlike {@link Map#of}, may hold null values. */
public final class FieldValues {

  private FieldValues() {}

  public static Builder builder() {
    return new Builder();
  }

  public static final class Builder {
    private final Map<String, Object> values = new LinkedHashMap<>();

    private Builder() {}

    public Builder put(String field, @Nullable Object value) {
      values.put(field, value);
      return this;
    }

    /** Adds the field only when {@code value} is non-null; used for partial updates. */
    public Builder putIfNotNull(String field, @Nullable Object value) {
      if (value != null) {
        values.put(field, value);
      }
      return this;
    }

    public Map<String, Object> build() {
      return Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }
  }
}
