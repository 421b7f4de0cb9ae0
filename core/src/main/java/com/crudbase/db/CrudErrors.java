package com.crudbase.db;

import com.crudbase.common.status.ErrorContext;
import com.crudbase.common.status.Status;
import javax.annotation.Nullable;

/** Builds the failure statuses returned by the CRUD engine, each tagged with its entity. */
public final class CrudErrors {

  private CrudErrors() {
    // Utility class, no instances
  }

  public static Status notFound(String entityName, Object id) {
    return Status.notFound("Unable to find the " + entityName + " with id " + id + ".")
        .withContext(ErrorContext.ofIdentifier(entityName, id));
  }

  /**
   * A uniqueness conflict. The storage message of {@code cause}, which names the violated
   * constraint, is kept as the context detail.
   */
  public static Status alreadyExists(
      String entityName, @Nullable Object id, @Nullable Throwable cause) {
    Status status =
        Status.alreadyExists("The " + entityName + " already exists.")
            .withContext(
                new ErrorContext(
                    entityName, id, null, cause == null ? null : cause.getMessage()));
    return cause == null ? status : status.withCause(cause);
  }

  public static Status accessDenied(String entityName, Object id) {
    return Status.permissionDenied("Access denied due to insufficient permissions.")
        .withContext(ErrorContext.ofIdentifier(entityName, id));
  }

  public static Status noChange(String entityName, Object id) {
    return Status.noChange("No changes detected in the content update.")
        .withContext(ErrorContext.ofIdentifier(entityName, id));
  }

  public static Status invalidArgument(String entityName, String message) {
    return Status.invalidArgument(message).withContext(ErrorContext.ofEntity(entityName));
  }

  public static Status invalidField(String entityName, String field, String message) {
    return Status.invalidArgument(message).withContext(ErrorContext.ofField(entityName, field));
  }

  public static Status unknownField(String entityName, String field) {
    return Status.unknownField("Model " + entityName + " does not have attribute '" + field + "'")
        .withContext(ErrorContext.ofField(entityName, field));
  }
}
