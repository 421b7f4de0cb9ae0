package com.crudbase.model;

import java.time.Instant;

/** Entities declaring {@link Capability#TIMESTAMPS}. */
public interface Timestamped {

  Timestamps timestamps();

  default Instant createdAt() {
    return timestamps().createdAt();
  }

  default Instant updatedAt() {
    return timestamps().updatedAt();
  }
}
