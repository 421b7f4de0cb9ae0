package com.crudbase.common.status;

import java.util.Objects;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Represents the status of an operation, possibly with additional error details. This class is
 * inspired by the gRPC Status concept and provides a unified way to represent success or the error
 * kinds of the data-access layer.
 */
public class Status {
  private final StatusCode code;
  private final String message;
  private final Throwable cause;
  private final ErrorContext context;

  private Status(StatusCode code, String message, Throwable cause, ErrorContext context) {
    this.code = Objects.requireNonNull(code);
    this.message = message;
    this.cause = cause;
    this.context = context;
  }

  /** Creates a new status with the given code and message. */
  public static Status of(StatusCode code, String message) {
    return new Status(code, message, null, null);
  }

  /** Creates a new status with the given code, message, and cause. */
  public static Status of(StatusCode code, String message, Throwable cause) {
    return new Status(code, message, cause, null);
  }

  /** Creates a new OK status. */
  public static Status ok() {
    return new Status(StatusCode.OK, null, null, null);
  }

  /** Creates a new NOT_FOUND status with the given message. */
  public static Status notFound(String message) {
    return new Status(StatusCode.NOT_FOUND, message, null, null);
  }

  /** Creates a new INTERNAL status with the given message and cause. */
  public static Status internal(String message, Throwable cause) {
    return new Status(StatusCode.INTERNAL, message, cause, null);
  }

  /** Creates a new INVALID_ARGUMENT status with the given message. */
  public static Status invalidArgument(String message) {
    return new Status(StatusCode.INVALID_ARGUMENT, message, null, null);
  }

  /** Creates a new ALREADY_EXISTS status with the given message. */
  public static Status alreadyExists(String message) {
    return new Status(StatusCode.ALREADY_EXISTS, message, null, null);
  }

  /** Creates a new PERMISSION_DENIED status with the given message. */
  public static Status permissionDenied(String message) {
    return new Status(StatusCode.PERMISSION_DENIED, message, null, null);
  }

  /** Creates a new UNKNOWN_FIELD status with the given message. */
  public static Status unknownField(String message) {
    return new Status(StatusCode.UNKNOWN_FIELD, message, null, null);
  }

  /** Creates a new NO_CHANGE status with the given message. */
  public static Status noChange(String message) {
    return new Status(StatusCode.NO_CHANGE, message, null, null);
  }

  /** Returns a copy of this status carrying the given context. */
  @Nonnull
  public Status withContext(ErrorContext context) {
    return new Status(code, message, cause, context);
  }

  /** Returns a copy of this status carrying the given cause. */
  @Nonnull
  public Status withCause(Throwable cause) {
    return new Status(code, message, cause, context);
  }

  /** Returns the code for this status. */
  @Nonnull
  public StatusCode getCode() {
    return code;
  }

  /** Returns the HTTP status code corresponding to this status. */
  public int getHttpCode() {
    return code.getHttpCode();
  }

  /** Returns the message for this status, or null if there is no message. */
  public String getMessage() {
    return message;
  }

  /** Returns the cause of this status, or null if there is no cause. */
  public Throwable getCause() {
    return cause;
  }

  /** Returns the structured context of this status, or null if none was attached. */
  @Nullable
  public ErrorContext getContext() {
    return context;
  }

  /** Returns true if this status represents an error (i.e., the code is not OK). */
  public boolean isError() {
    return code != StatusCode.OK;
  }

  /** Returns true if this status is OK. */
  public boolean isOk() {
    return code == StatusCode.OK;
  }

  @Override
  public String toString() {
    if (message == null) {
      return code.toString();
    }
    return code + ": " + message;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || getClass() != obj.getClass()) {
      return false;
    }
    Status other = (Status) obj;
    return code == other.code
        && Objects.equals(message, other.message)
        && Objects.equals(cause, other.cause)
        && Objects.equals(context, other.context);
  }

  @Override
  public int hashCode() {
    return Objects.hash(code, message, cause, context);
  }
}
