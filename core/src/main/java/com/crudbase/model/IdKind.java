package com.crudbase.model;

/** How an entity's identifier is assigned. Fixed when the entity's descriptor is defined. */
public enum IdKind {
  /** Auto-incrementing integer assigned by the storage engine on insert. */
  SERIAL(ColumnType.LONG),
  /** Random 128-bit identifier generated before insert. */
  UUID(ColumnType.UUID);

  private final ColumnType columnType;

  IdKind(ColumnType columnType) {
    this.columnType = columnType;
  }

  /** Storage type of the {@code id} column. */
  public ColumnType columnType() {
    return columnType;
  }
}
