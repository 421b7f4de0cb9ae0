package com.crudbase.testing;

import com.crudbase.model.ColumnType;
import com.crudbase.model.EntityDescriptor;
import com.crudbase.model.Identified;
import com.crudbase.model.Row;
import com.crudbase.model.SoftDeletable;
import com.crudbase.model.SoftDeleteState;
import com.crudbase.model.Timestamped;
import com.crudbase.model.Timestamps;

/** Serial-id fixture entity with timestamps and soft delete. */
public record Product(
    Long id, String name, double price, Timestamps timestamps, SoftDeleteState deletion)
    implements Identified<Long>, Timestamped, SoftDeletable<Product> {

  public static final EntityDescriptor<Product, Long> DESCRIPTOR =
      EntityDescriptor.serial(Product.class, "products")
          .required("name", ColumnType.STRING)
          .required("price", ColumnType.DOUBLE)
          .withTimestamps()
          .withSoftDelete()
          .mapper(Product::fromRow)
          .build();

  static Product fromRow(Row row) {
    return new Product(
        row.getLong("id"),
        row.getString("name"),
        row.getDouble("price"),
        Timestamps.fromRow(row),
        SoftDeleteState.fromRow(row));
  }

  @Override
  public Product withDeletion(SoftDeleteState state) {
    return new Product(id, name, price, timestamps, state);
  }
}
