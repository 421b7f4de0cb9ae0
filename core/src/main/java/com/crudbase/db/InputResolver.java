package com.crudbase.db;

import com.crudbase.common.status.Status;
import com.crudbase.common.status.StatusOr;
import com.crudbase.model.Capability;
import com.crudbase.model.Column;
import com.crudbase.model.Credentials;
import com.crudbase.model.EntityDescriptor;
import com.crudbase.model.SoftDeleteState;
import com.google.common.base.Strings;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import javax.annotation.Nullable;

/**
 * Checks caller-supplied field maps against an entity descriptor and converts their values to
 * column types. Resolved maps are insertion-ordered and may hold null values.
 */
final class InputResolver {

  private final EntityDescriptor<?, ?> descriptor;

  InputResolver(EntityDescriptor<?, ?> descriptor) {
    this.descriptor = descriptor;
  }

  /**
   * Resolves create input: every writable column ends up with a value, defaults filling in what
   * the caller omitted.
   */
  StatusOr<Map<String, Object>> forCreate(Map<String, ?> input) {
    StatusOr<Map<String, Object>> valuesOr = resolveWritable(input, "is assigned on create");
    if (valuesOr.isNotOk()) {
      return valuesOr;
    }
    Map<String, Object> values = valuesOr.getValue();
    for (Column column : descriptor.columns()) {
      if (column.managed() || values.containsKey(column.name())) {
        continue;
      }
      if (!column.hasDefault()) {
        return StatusOr.ofStatus(
            CrudErrors.invalidField(
                descriptor.entityName(),
                column.name(),
                "Missing required field '" + column.name() + "'"));
      }
      values.put(column.name(), column.defaultValue());
    }
    Status traits = checkTraits(values, SoftDeleteState.ACTIVE);
    return traits.isOk() ? StatusOr.ofValue(values) : StatusOr.ofStatus(traits);
  }

  /**
   * Resolves a partial update. {@code current} is the stored deletion state when the entity
   * supports soft delete, so a change to one half of the pair is checked against the other.
   */
  StatusOr<Map<String, Object>> forUpdate(
      Map<String, ?> updates, @Nullable SoftDeleteState current) {
    StatusOr<Map<String, Object>> valuesOr = resolveWritable(updates, "cannot be updated");
    if (valuesOr.isNotOk()) {
      return valuesOr;
    }
    Status traits =
        checkTraits(valuesOr.getValue(), current == null ? SoftDeleteState.ACTIVE : current);
    return traits.isOk() ? valuesOr : StatusOr.ofStatus(traits);
  }

  /** Resolves equality filters. Any declared column may be filtered on, null meaning IS NULL. */
  StatusOr<Map<String, Object>> forFilters(Map<String, ?> filters) {
    Map<String, Object> values = new LinkedHashMap<>();
    for (Map.Entry<String, ?> entry : filters.entrySet()) {
      Optional<Column> column = descriptor.column(entry.getKey());
      if (column.isEmpty()) {
        return StatusOr.ofStatus(CrudErrors.unknownField(descriptor.entityName(), entry.getKey()));
      }
      if (entry.getValue() == null) {
        values.put(entry.getKey(), null);
        continue;
      }
      StatusOr<Object> valueOr = coerce(column.get(), entry.getValue());
      if (valueOr.isNotOk()) {
        return valueOr.propagate();
      }
      values.put(entry.getKey(), valueOr.getValue());
    }
    return StatusOr.ofValue(values);
  }

  private StatusOr<Map<String, Object>> resolveWritable(Map<String, ?> input, String managedHint) {
    Map<String, Object> values = new LinkedHashMap<>();
    for (Map.Entry<String, ?> entry : input.entrySet()) {
      String field = entry.getKey();
      Optional<Column> columnOpt = descriptor.column(field);
      if (columnOpt.isEmpty()) {
        return StatusOr.ofStatus(CrudErrors.unknownField(descriptor.entityName(), field));
      }
      Column column = columnOpt.get();
      if (column.managed()) {
        return StatusOr.ofStatus(
            CrudErrors.invalidField(
                descriptor.entityName(), field, "Field '" + field + "' " + managedHint));
      }
      if (entry.getValue() == null) {
        if (!column.nullable()) {
          return StatusOr.ofStatus(
              CrudErrors.invalidField(
                  descriptor.entityName(), field, "Field '" + field + "' must not be null"));
        }
        values.put(field, null);
        continue;
      }
      StatusOr<Object> valueOr = coerce(column, entry.getValue());
      if (valueOr.isNotOk()) {
        return valueOr.propagate();
      }
      values.put(field, valueOr.getValue());
    }
    return StatusOr.ofValue(values);
  }

  private StatusOr<Object> coerce(Column column, Object value) {
    try {
      return StatusOr.ofValue(column.type().coerce(value));
    } catch (IllegalArgumentException e) {
      return StatusOr.ofStatus(
          CrudErrors.invalidField(
              descriptor.entityName(),
              column.name(),
              "Invalid value for field '" + column.name() + "': " + e.getMessage()));
    }
  }

  private Status checkTraits(Map<String, Object> values, SoftDeleteState current) {
    if (descriptor.has(Capability.CREDENTIALS)) {
      if (values.containsKey(Credentials.EMAIL)
          && !Credentials.isValidEmail((String) values.get(Credentials.EMAIL))) {
        return CrudErrors.invalidField(
            descriptor.entityName(),
            Credentials.EMAIL,
            "Invalid email address: " + values.get(Credentials.EMAIL));
      }
      if (values.containsKey(Credentials.HASHED_PASSWORD)
          && Strings.isNullOrEmpty((String) values.get(Credentials.HASHED_PASSWORD))) {
        return CrudErrors.invalidField(
            descriptor.entityName(),
            Credentials.HASHED_PASSWORD,
            "Field '" + Credentials.HASHED_PASSWORD + "' must not be empty");
      }
    }
    if (descriptor.has(Capability.SOFT_DELETE)
        && (values.containsKey(SoftDeleteState.IS_DELETED)
            || values.containsKey(SoftDeleteState.DELETED_AT))) {
      boolean isDeleted =
          values.containsKey(SoftDeleteState.IS_DELETED)
              ? (Boolean) values.get(SoftDeleteState.IS_DELETED)
              : current.isDeleted();
      Instant deletedAt =
          values.containsKey(SoftDeleteState.DELETED_AT)
              ? (Instant) values.get(SoftDeleteState.DELETED_AT)
              : current.deletedAt();
      try {
        new SoftDeleteState(isDeleted, deletedAt);
      } catch (IllegalArgumentException e) {
        return CrudErrors.invalidField(
            descriptor.entityName(), SoftDeleteState.IS_DELETED, e.getMessage());
      }
    }
    return Status.ok();
  }
}
