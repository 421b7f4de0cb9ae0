/**
 * Entity model: identifier kinds, column declarations, the optional field sets (timestamps, soft
 * delete, credentials) an entity type can opt into, and {@link
 * com.crudbase.model.EntityDescriptor}, which ties an entity record to its table.
 *
 * <p>Entities are plain records. A record opts into a capability by implementing its trait
 * interface and declaring it on the descriptor:
 *
 * <pre>{@code
 * public record Member(Long id, String name, String email, Timestamps timestamps)
 *     implements Identified<Long>, Timestamped {}
 * }</pre>
 */
package com.crudbase.model;
