package com.crudbase.db;

/**
 * Outcome of {@link CrudRepository#getOrCreate}.
 *
 * @param entity the matching row, or the row just inserted
 * @param created true if this call inserted the row
 */
public record GetOrCreateResult<T>(T entity, boolean created) {

  public static <T> GetOrCreateResult<T> existing(T entity) {
    return new GetOrCreateResult<>(entity, false);
  }

  public static <T> GetOrCreateResult<T> created(T entity) {
    return new GetOrCreateResult<>(entity, true);
  }
}
