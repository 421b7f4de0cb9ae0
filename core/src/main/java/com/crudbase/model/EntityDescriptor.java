package com.crudbase.model;

import com.google.common.base.MoreObjects;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Sets;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import javax.annotation.Nonnull;

/**
 * Static description of one entity type: its table, identifier kind, declared columns, opted-in
 * capabilities and how a stored {@link Row} becomes an entity value.
 *
 * <p>Descriptors are checked once, when built. An entity record must implement the trait
 * interface of every capability it declares and must not implement one it does not declare;
 * column names must be unique. Any violation fails with {@link IllegalArgumentException} so a
 * misdeclared entity never reaches the database.
 *
 * <pre>{@code
 * static final EntityDescriptor<Product, Long> DESCRIPTOR =
 *     EntityDescriptor.serial(Product.class, "products")
 *         .required("name", ColumnType.STRING)
 *         .required("price", ColumnType.DOUBLE)
 *         .withTimestamps()
 *         .withSoftDelete()
 *         .mapper(Product::fromRow)
 *         .build();
 * }</pre>
 *
 * @param <T> entity type
 * @param <ID> identifier type, fixed by {@link #serial} or {@link #uuid}
 */
public final class EntityDescriptor<T extends Identified<ID>, ID> {

  public static final String ID_COLUMN = "id";

  private final Class<T> entityType;
  private final Class<ID> idType;
  private final String entityName;
  private final String tableName;
  private final IdKind idKind;
  private final ImmutableList<Column> columns;
  private final ImmutableMap<String, Column> columnsByName;
  private final Set<Capability> capabilities;
  private final Function<Row, T> mapper;

  private EntityDescriptor(Builder<T, ID> builder) {
    this.entityType = builder.entityType;
    this.idType = builder.idType;
    this.entityName = builder.entityName;
    this.tableName = builder.tableName;
    this.idKind = builder.idKind;
    this.capabilities = Sets.immutableEnumSet(builder.capabilities);
    this.mapper = builder.mapper;

    List<Column> all = new ArrayList<>();
    all.add(Column.managed(ID_COLUMN, idKind.columnType()));
    all.addAll(builder.columns);
    for (Capability capability : Capability.values()) {
      if (builder.capabilities.contains(capability)) {
        all.addAll(capability.columns());
      }
    }
    Map<String, Column> byName = new LinkedHashMap<>();
    for (Column column : all) {
      if (byName.put(column.name(), column) != null) {
        throw new IllegalArgumentException(
            "Duplicate column '" + column.name() + "' on " + entityName);
      }
    }
    this.columns = ImmutableList.copyOf(all);
    this.columnsByName = ImmutableMap.copyOf(byName);
  }

  /** Starts a descriptor for an entity whose id is assigned by an auto-incrementing column. */
  public static <T extends Identified<Long>> Builder<T, Long> serial(
      Class<T> entityType, String tableName) {
    return new Builder<>(entityType, Long.class, IdKind.SERIAL, tableName);
  }

  /** Starts a descriptor for an entity whose id is a random UUID generated on create. */
  public static <T extends Identified<UUID>> Builder<T, UUID> uuid(
      Class<T> entityType, String tableName) {
    return new Builder<>(entityType, UUID.class, IdKind.UUID, tableName);
  }

  public Class<T> entityType() {
    return entityType;
  }

  public Class<ID> idType() {
    return idType;
  }

  /** Name used in error messages and logs, the entity's simple class name unless overridden. */
  public String entityName() {
    return entityName;
  }

  public String tableName() {
    return tableName;
  }

  public IdKind idKind() {
    return idKind;
  }

  /** All columns in table order: {@code id}, declared columns, then capability columns. */
  public ImmutableList<Column> columns() {
    return columns;
  }

  public Optional<Column> column(String name) {
    return Optional.ofNullable(columnsByName.get(name));
  }

  public boolean has(Capability capability) {
    return capabilities.contains(capability);
  }

  public Set<Capability> capabilities() {
    return capabilities;
  }

  /** Converts a stored row into an entity value. */
  @Nonnull
  public T map(Row row) {
    return Objects.requireNonNull(mapper.apply(row), "mapper returned null");
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("entity", entityName)
        .add("table", tableName)
        .add("idKind", idKind)
        .add("capabilities", capabilities)
        .toString();
  }

  public static final class Builder<T extends Identified<ID>, ID> {
    private final Class<T> entityType;
    private final Class<ID> idType;
    private final IdKind idKind;
    private final String tableName;
    private final List<Column> columns = new ArrayList<>();
    private final EnumSet<Capability> capabilities = EnumSet.noneOf(Capability.class);
    private String entityName;
    private Function<Row, T> mapper;

    private Builder(Class<T> entityType, Class<ID> idType, IdKind idKind, String tableName) {
      this.entityType = Objects.requireNonNull(entityType, "entityType");
      this.idType = idType;
      this.idKind = idKind;
      this.tableName = tableName;
      this.entityName = entityType.getSimpleName();
    }

    public Builder<T, ID> entityName(String entityName) {
      this.entityName = entityName;
      return this;
    }

    public Builder<T, ID> column(Column column) {
      columns.add(Objects.requireNonNull(column, "column"));
      return this;
    }

    public Builder<T, ID> required(String name, ColumnType type) {
      return column(Column.required(name, type));
    }

    public Builder<T, ID> optional(String name, ColumnType type) {
      return column(Column.optional(name, type));
    }

    public Builder<T, ID> withDefault(String name, ColumnType type, Object defaultValue) {
      return column(Column.withDefault(name, type, defaultValue));
    }

    /**
     * Adds {@code created_at} and {@code updated_at}; the entity must implement {@link
     * Timestamped}.
     */
    public Builder<T, ID> withTimestamps() {
      capabilities.add(Capability.TIMESTAMPS);
      return this;
    }

    /**
     * Adds {@code is_deleted} and {@code deleted_at}; the entity must implement {@link
     * SoftDeletable}.
     */
    public Builder<T, ID> withSoftDelete() {
      capabilities.add(Capability.SOFT_DELETE);
      return this;
    }

    /**
     * Adds {@code email}, {@code hashed_password} and {@code is_active}; the entity must implement
     * {@link HasCredentials}.
     */
    public Builder<T, ID> withCredentials() {
      capabilities.add(Capability.CREDENTIALS);
      return this;
    }

    public Builder<T, ID> mapper(Function<Row, T> mapper) {
      this.mapper = mapper;
      return this;
    }

    public EntityDescriptor<T, ID> build() {
      if (!Column.isIdentifier(tableName)) {
        throw new IllegalArgumentException("Invalid table name: " + tableName);
      }
      if (Strings.isNullOrEmpty(entityName)) {
        throw new IllegalArgumentException("entityName must not be empty");
      }
      if (mapper == null) {
        throw new IllegalArgumentException("No row mapper declared for " + entityName);
      }
      for (Capability capability : Capability.values()) {
        boolean declared = capabilities.contains(capability);
        boolean implemented = capability.traitInterface().isAssignableFrom(entityType);
        if (declared && !implemented) {
          throw new IllegalArgumentException(
              entityName
                  + " declares "
                  + capability
                  + " but does not implement "
                  + capability.traitInterface().getSimpleName());
        }
        if (implemented && !declared) {
          throw new IllegalArgumentException(
              entityName
                  + " implements "
                  + capability.traitInterface().getSimpleName()
                  + " but does not declare "
                  + capability);
        }
      }
      return new EntityDescriptor<>(this);
    }
  }
}
