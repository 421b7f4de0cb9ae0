package com.crudbase.common.status;

/**
 * Status codes shared by the data-access layer and its callers.
 *
 * <p>The first group mirrors the gRPC status codes; the second group holds the kinds that only make
 * sense for CRUD operations. Every code carries the HTTP status a transport layer should answer
 * with.
 */
public enum StatusCode {
    OK(200),                 // 200 OK
    INVALID_ARGUMENT(400),   // 400 Bad Request
    NOT_FOUND(404),          // 404 Not Found
    ALREADY_EXISTS(409),     // 409 Conflict
    PERMISSION_DENIED(403),  // 403 Forbidden
    INTERNAL(500),           // 500 Internal Server Error

    // Data-access specific
    UNKNOWN_FIELD(400),      // 400 Bad Request: key is not a declared column
    NO_CHANGE(400);          // 400 Bad Request: update would not change stored data

    private final int httpCode;

    StatusCode(int httpCode) {
        this.httpCode = httpCode;
    }

    /**
     * Returns the corresponding HTTP status code.
     */
    public int getHttpCode() {
        return httpCode;
    }

    /**
     * Returns whether this status code represents a successful operation.
     */
    public boolean isSuccess() {
        return this == OK;
    }

    /**
     * Returns whether this status code represents an error.
     */
    public boolean isError() {
        return !isSuccess();
    }
}
