package com.crudbase.model;

import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * Optional field sets an entity type can opt into. Each capability contributes a fixed list of
 * columns to the descriptor and requires the entity record to implement a matching interface.
 */
public enum Capability {
  TIMESTAMPS(Timestamped.class, Timestamps.COLUMNS),
  SOFT_DELETE(SoftDeletable.class, SoftDeleteState.COLUMNS),
  CREDENTIALS(HasCredentials.class, Credentials.COLUMNS);

  private final Class<?> traitInterface;
  private final ImmutableList<Column> columns;

  Capability(Class<?> traitInterface, List<Column> columns) {
    this.traitInterface = traitInterface;
    this.columns = ImmutableList.copyOf(columns);
  }

  /** The interface an entity record must implement to declare this capability. */
  public Class<?> traitInterface() {
    return traitInterface;
  }

  /** Columns this capability adds to the table. */
  public ImmutableList<Column> columns() {
    return columns;
  }
}
