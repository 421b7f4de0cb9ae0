package com.crudbase.model;

import java.time.Instant;

/**
 * Entities declaring {@link Capability#SOFT_DELETE}.
 *
 * @param <T> the implementing entity type, returned by the copy-on-write helpers
 */
public interface SoftDeletable<T> {

  SoftDeleteState deletion();

  /** Returns a copy of this entity carrying {@code state}. */
  T withDeletion(SoftDeleteState state);

  default boolean isDeleted() {
    return deletion().isDeleted();
  }

  default T markDeleted(Instant at) {
    return withDeletion(deletion().markDeleted(at));
  }

  default T restore() {
    return withDeletion(deletion().restore());
  }
}
