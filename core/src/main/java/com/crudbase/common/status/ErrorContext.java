package com.crudbase.common.status;

import com.google.common.base.MoreObjects;
import javax.annotation.Nullable;

/**
 * Structured details attached to a failed {@link Status}.
 *
 * <p>Lets a caller render a precise message (or pick a response field) without parsing the status
 * message. Every component is optional.
 *
 * @param entityType simple name of the entity type involved, e.g. {@code "Product"}
 * @param identifier the identifier that was looked up or collided, if known
 * @param field the offending field name, if the failure concerns a single field
 * @param detail the storage layer's own description of the failure, e.g. the violated constraint
 */
public record ErrorContext(
    @Nullable String entityType,
    @Nullable Object identifier,
    @Nullable String field,
    @Nullable String detail) {

  /** Context naming only the entity type. */
  public static ErrorContext ofEntity(String entityType) {
    return new ErrorContext(entityType, null, null, null);
  }

  /** Context naming an entity type and one of its identifiers. */
  public static ErrorContext ofIdentifier(String entityType, Object identifier) {
    return new ErrorContext(entityType, identifier, null, null);
  }

  /** Context naming an entity type and one of its fields. */
  public static ErrorContext ofField(String entityType, String field) {
    return new ErrorContext(entityType, null, field, null);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .omitNullValues()
        .add("entityType", entityType)
        .add("identifier", identifier)
        .add("field", field)
        .add("detail", detail)
        .toString();
  }
}
