package com.crudbase.model;

/** Entities declaring {@link Capability#CREDENTIALS}. */
public interface HasCredentials {

  Credentials credentials();

  default String email() {
    return credentials().email();
  }

  default boolean isActive() {
    return credentials().isActive();
  }
}
