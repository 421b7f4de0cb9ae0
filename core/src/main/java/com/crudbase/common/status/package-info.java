/**
 * Error handling and status reporting for the data-access layer.
 *
 * <p>Operations report expected failures as values rather than exceptions:
 *
 * <ul>
 *   <li>{@link com.crudbase.common.status.StatusCode} - the error taxonomy, each kind mapped to an
 *       HTTP status
 *   <li>{@link com.crudbase.common.status.Status} - a code with an optional message, cause and
 *       {@link com.crudbase.common.status.ErrorContext}
 *   <li>{@link com.crudbase.common.status.StatusOr} - either a successful value or an error status
 * </ul>
 *
 * <p>Example usage:
 *
 * <pre>
 * StatusOr&lt;Product&gt; result = products.get(session, productId);
 * if (result.isOk()) {
 *     render(result.getValue());
 * } else {
 *     Status error = result.getStatus();
 *     respond(error.getHttpCode(), error.getMessage());
 * }
 * </pre>
 *
 * <p>Configuration mistakes and programmer errors (an unsupported backend, an entity record that
 * does not implement the interfaces its descriptor declares) are not statuses; they throw at
 * startup.
 */
package com.crudbase.common.status;
