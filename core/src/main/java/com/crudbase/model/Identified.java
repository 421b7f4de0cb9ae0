package com.crudbase.model;

/**
 * An entity with a unique, immutable identifier.
 *
 * @param <ID> {@link Long} for {@link IdKind#SERIAL} entities, {@link java.util.UUID} for
 *     {@link IdKind#UUID} entities
 */
public interface Identified<ID> {

  /** The identifier assigned when the row was created. */
  ID id();
}
