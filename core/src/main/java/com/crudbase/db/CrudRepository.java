package com.crudbase.db;

import com.crudbase.common.status.Status;
import com.crudbase.common.status.StatusOr;
import com.crudbase.config.BackendKind;
import com.crudbase.db.util.DbUtil;
import com.crudbase.db.util.UuidUtil;
import com.crudbase.model.Capability;
import com.crudbase.model.Column;
import com.crudbase.model.ColumnType;
import com.crudbase.model.EntityDescriptor;
import com.crudbase.model.EntityInput;
import com.crudbase.model.IdKind;
import com.crudbase.model.Identified;
import com.crudbase.model.Row;
import com.crudbase.model.SoftDeletable;
import com.crudbase.model.SoftDeleteState;
import com.crudbase.model.Timestamped;
import com.crudbase.model.Timestamps;
import com.google.common.collect.ImmutableList;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import org.tinylog.Logger;

/**
 * Generic create/read/update/delete operations for one entity type.
 *
 * <p>Each operation runs on the caller's {@link Session} and returns a {@link StatusOr}: expected
 * failures (missing rows, bad input, uniqueness conflicts) come back as statuses, and storage
 * failures as {@code INTERNAL} statuses carrying the {@link SQLException}. Writes commit before
 * returning and the entity is re-read so callers see stored values; a write that fails is rolled
 * back before its status is returned, so the session stays usable. A repository holds no
 * per-call state and may be shared across threads; sessions may not.
 *
 * <p>Engine-written instants are truncated to milliseconds, the precision the embedded backend
 * stores. An update always moves {@code updated_at} forward, by one millisecond if the clock has
 * not advanced since the previous write.
 *
 * @param <T> entity type
 * @param <ID> identifier type
 */
public final class CrudRepository<T extends Identified<ID>, ID> {

    public static final int DEFAULT_SKIP = 0;
    public static final int DEFAULT_LIMIT = 100;

    private final EntityDescriptor<T, ID> descriptor;
    private final EntityStatements statements;
    private final InputResolver resolver;
    private final Clock clock;

    /**
     * Creates a repository that stamps rows with the system UTC clock.
     *
     * @param descriptor the entity's table, columns and capabilities
     */
    public CrudRepository(EntityDescriptor<T, ID> descriptor) {
        this(descriptor, Clock.systemUTC());
    }

    /**
     * Creates a repository that stamps rows with {@code clock}.
     *
     * @param descriptor the entity's table, columns and capabilities
     * @param clock source of {@code created_at}, {@code updated_at} and {@code deleted_at}
     */
    public CrudRepository(EntityDescriptor<T, ID> descriptor, Clock clock) {
        this.descriptor = Objects.requireNonNull(descriptor, "descriptor");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.statements = new EntityStatements(descriptor);
        this.resolver = new InputResolver(descriptor);
    }

    public EntityDescriptor<T, ID> descriptor() {
        return descriptor;
    }

    /**
     * Loads a single entity by id. Soft-deleted rows are returned like any other.
     *
     * @param session an open session
     * @param id the id to look up
     * @return StatusOr containing the entity, or NOT_FOUND if there is none
     */
    @Nonnull
    public StatusOr<T> get(Session session, ID id) {
        Objects.requireNonNull(id, "id");
        StatusOr<Optional<T>> entityOr = findById(session, id);
        if (entityOr.isNotOk()) {
            return entityOr.propagate();
        }
        if (entityOr.getValue().isEmpty()) {
            Logger.debug("{} {} not found", descriptor.entityName(), id);
            return StatusOr.ofStatus(CrudErrors.notFound(descriptor.entityName(), id));
        }
        return StatusOr.ofValue(entityOr.getValue().get());
    }

    /**
     * Loads the first page of {@link #DEFAULT_LIMIT} entities.
     *
     * @param session an open session
     * @return StatusOr containing the entities in ascending id order or an error
     */
    @Nonnull
    public StatusOr<ImmutableList<T>> getMulti(Session session) {
        return getMulti(session, DEFAULT_SKIP, DEFAULT_LIMIT);
    }

    /**
     * Loads one page of entities in ascending id order. Soft-deleted rows are included.
     *
     * @param session an open session
     * @param skip number of rows to skip, at least zero
     * @param limit maximum number of rows to return, at least one
     * @return StatusOr containing the page, or INVALID_ARGUMENT for a bad skip or limit
     */
    @Nonnull
    public StatusOr<ImmutableList<T>> getMulti(Session session, int skip, int limit) {
        if (skip < 0) {
            return fail("getMulti", CrudErrors.invalidArgument(descriptor.entityName(),
                    "skip must be non-negative, got: " + skip));
        }
        if (limit <= 0) {
            return fail("getMulti", CrudErrors.invalidArgument(descriptor.entityName(),
                    "limit must be positive, got: " + limit));
        }
        try (PreparedStatement stmt = session.prepare(statements.selectPage())) {
            stmt.setInt(1, limit);
            stmt.setInt(2, skip);
            return readAll(stmt, session.backend());
        } catch (SQLException e) {
            return storageFailure("getMulti", e);
        }
    }

    /**
     * Counts all rows, soft-deleted ones included.
     *
     * @param session an open session
     * @return StatusOr containing the row count or an error
     */
    @Nonnull
    public StatusOr<Long> count(Session session) {
        try (PreparedStatement stmt = session.prepare(statements.count());
             ResultSet rs = stmt.executeQuery()) {
            rs.next();
            return StatusOr.ofValue(rs.getLong(1));
        } catch (SQLException e) {
            return storageFailure("count", e);
        }
    }

    /**
     * Inserts a new row built from a create-input object.
     *
     * @see #create(Session, Map)
     */
    @Nonnull
    public StatusOr<T> create(Session session, EntityInput input) {
        return create(session, input.fieldValues());
    }

    /**
     * Inserts a new row and commits. The id and timestamps are assigned here; omitted columns take
     * their declared defaults.
     *
     * @param session an open session
     * @param input column values keyed by column name
     * @return StatusOr containing the stored entity; UNKNOWN_FIELD or INVALID_ARGUMENT for bad
     *     input, ALREADY_EXISTS if a unique constraint rejects the row
     */
    @Nonnull
    public StatusOr<T> create(Session session, Map<String, ?> input) {
        StatusOr<Map<String, Object>> valuesOr = resolver.forCreate(input);
        if (valuesOr.isNotOk()) {
            return fail("create", valuesOr.getStatus());
        }
        Map<String, Object> values = valuesOr.getValue();
        if (descriptor.idKind() == IdKind.UUID) {
            values.put(EntityDescriptor.ID_COLUMN, UuidUtil.newId());
        }
        if (descriptor.has(Capability.TIMESTAMPS)) {
            Instant now = now();
            values.put(Timestamps.CREATED_AT, now);
            values.put(Timestamps.UPDATED_AT, now);
        }

        ID id;
        try {
            session.beginWrite();
            id = insert(session, values);
            session.commit();
        } catch (SQLException e) {
            return writeFailure(session, "create", null, e);
        }
        Logger.debug("Created {} {}", descriptor.entityName(), id);
        return get(session, id);
    }

    /**
     * Looks up a row by filters, creating it from a create-input object if none matches.
     *
     * @see #getOrCreate(Session, Map, Map)
     */
    @Nonnull
    public StatusOr<GetOrCreateResult<T>> getOrCreate(
            Session session, EntityInput input, Map<String, ?> filters) {
        return getOrCreate(session, input.fieldValues(), filters);
    }

    /**
     * Returns the lowest-id row matching every filter, creating one from {@code input} if none
     * matches.
     *
     * <p>The lookup and insert are not atomic. When two sessions race, the loser's insert is
     * rejected by the table's unique constraint and this returns ALREADY_EXISTS; tables used this
     * way must constrain the filtered columns.
     *
     * @param session an open session
     * @param input column values for the row to create
     * @param filters column equalities, AND-combined; a null value matches {@code IS NULL}
     * @return StatusOr containing the found or created entity and whether it was created;
     *     INVALID_ARGUMENT for empty filters, UNKNOWN_FIELD for an undeclared filter key
     */
    @Nonnull
    public StatusOr<GetOrCreateResult<T>> getOrCreate(
            Session session, Map<String, ?> input, Map<String, ?> filters) {
        if (filters.isEmpty()) {
            return fail("getOrCreate", CrudErrors.invalidArgument(descriptor.entityName(),
                    "At least one filter must be provided for getOrCreate"));
        }
        StatusOr<Map<String, Object>> filtersOr = resolver.forFilters(filters);
        if (filtersOr.isNotOk()) {
            return fail("getOrCreate", filtersOr.getStatus());
        }
        Map<String, Object> resolved = filtersOr.getValue();
        StatusOr<Optional<T>> existingOr;
        try (PreparedStatement stmt = session.prepare(statements.selectFirstMatching(resolved))) {
            bindFilters(stmt, 1, resolved, session.backend());
            existingOr = readFirst(stmt, session.backend());
        } catch (SQLException e) {
            return storageFailure("getOrCreate", e);
        }
        if (existingOr.isNotOk()) {
            return existingOr.propagate();
        }
        if (existingOr.getValue().isPresent()) {
            return StatusOr.ofValue(GetOrCreateResult.existing(existingOr.getValue().get()));
        }
        return create(session, input).map(GetOrCreateResult::created);
    }

    /**
     * Applies a partial update from an update-input object.
     *
     * @see #update(Session, Object, Map)
     */
    @Nonnull
    public StatusOr<T> update(Session session, ID id, EntityInput updates) {
        return update(session, id, updates.fieldValues());
    }

    /**
     * Applies a partial update and commits. Only the keys present in {@code updates} change; the
     * id and timestamps cannot be set. All checks run before the write, so a rejected update
     * leaves the row as it was.
     *
     * @param session an open session
     * @param id the id of the row to update
     * @param updates new column values keyed by column name
     * @return StatusOr containing the stored entity; NOT_FOUND, INVALID_ARGUMENT, UNKNOWN_FIELD, or
     *     ALREADY_EXISTS if the new values collide with another row
     */
    @Nonnull
    public StatusOr<T> update(Session session, ID id, Map<String, ?> updates) {
        StatusOr<T> currentOr = get(session, id);
        if (currentOr.isNotOk()) {
            return currentOr;
        }
        if (updates.isEmpty()) {
            return fail("update", CrudErrors.invalidArgument(descriptor.entityName(),
                    "No data provided for update"));
        }
        T current = currentOr.getValue();
        StatusOr<Map<String, Object>> valuesOr =
                resolver.forUpdate(updates, deletionState(current));
        if (valuesOr.isNotOk()) {
            return fail("update", valuesOr.getStatus());
        }
        Map<String, Object> values = valuesOr.getValue();
        if (descriptor.has(Capability.TIMESTAMPS)) {
            values.put(Timestamps.UPDATED_AT, nextUpdatedAt(current));
        }
        try {
            session.beginWrite();
            writeColumns(session, id, values);
            session.commit();
        } catch (SQLException e) {
            return writeFailure(session, "update", id, e);
        }
        Logger.debug("Updated {} {}: {}", descriptor.entityName(), id, values.keySet());
        return get(session, id);
    }

    /**
     * Reports whether any row matches every filter. An empty filter map matches any row, so this
     * then reports whether the table is non-empty.
     *
     * @param session an open session
     * @param filters column equalities, AND-combined; a null value matches {@code IS NULL}
     * @return StatusOr containing true if a row matches; UNKNOWN_FIELD for an undeclared key
     */
    @Nonnull
    public StatusOr<Boolean> exists(Session session, Map<String, ?> filters) {
        StatusOr<Map<String, Object>> filtersOr = resolver.forFilters(filters);
        if (filtersOr.isNotOk()) {
            return fail("exists", filtersOr.getStatus());
        }
        Map<String, Object> resolved = filtersOr.getValue();
        try (PreparedStatement stmt = session.prepare(statements.existsMatching(resolved))) {
            bindFilters(stmt, 1, resolved, session.backend());
            try (ResultSet rs = stmt.executeQuery()) {
                return StatusOr.ofValue(rs.next());
            }
        } catch (SQLException e) {
            return storageFailure("exists", e);
        }
    }

    /**
     * Removes the row with {@code id}.
     *
     * @see #delete(Session, Object, boolean)
     */
    @Nonnull
    public StatusOr<Boolean> delete(Session session, ID id) {
        return delete(session, id, false);
    }

    /**
     * Deletes the entity with {@code id} and commits.
     *
     * <p>With {@code soft} set on a soft-deletable entity, the row is kept and marked deleted; a
     * row that is already marked keeps its original {@code deleted_at}. Otherwise the row is
     * removed.
     *
     * @param session an open session
     * @param id the id of the row to delete
     * @param soft whether to mark the row deleted instead of removing it
     * @return StatusOr containing true, or NOT_FOUND if there is no such row
     */
    @Nonnull
    public StatusOr<Boolean> delete(Session session, ID id, boolean soft) {
        StatusOr<T> currentOr = get(session, id);
        if (currentOr.isNotOk()) {
            return currentOr.propagate();
        }
        T current = currentOr.getValue();
        try {
            if (soft && descriptor.has(Capability.SOFT_DELETE)) {
                SoftDeleteState state = deletionState(current);
                if (state.isDeleted()) {
                    Logger.debug("{} {} is already deleted", descriptor.entityName(), id);
                    return StatusOr.ofValue(true);
                }
                Instant deletedAt = nextUpdatedAt(current);
                Map<String, Object> values =
                        new LinkedHashMap<>(state.markDeleted(deletedAt).asFieldValues());
                if (descriptor.has(Capability.TIMESTAMPS)) {
                    values.put(Timestamps.UPDATED_AT, deletedAt);
                }
                session.beginWrite();
                writeColumns(session, id, values);
            } else {
                if (soft) {
                    Logger.debug("{} does not support soft delete, removing {}",
                            descriptor.entityName(), id);
                }
                session.beginWrite();
                try (PreparedStatement stmt = session.prepare(statements.deleteById())) {
                    bindId(stmt, 1, id, session.backend());
                    stmt.executeUpdate();
                }
            }
            session.commit();
        } catch (SQLException e) {
            return writeFailure(session, "delete", id, e);
        }
        Logger.debug("Deleted {} {} (soft={})", descriptor.entityName(), id, soft);
        return StatusOr.ofValue(true);
    }

    private StatusOr<Optional<T>> findById(Session session, ID id) {
        try (PreparedStatement stmt = session.prepare(statements.selectById())) {
            bindId(stmt, 1, id, session.backend());
            return readFirst(stmt, session.backend());
        } catch (SQLException e) {
            return storageFailure("get", e);
        }
    }

    private ID insert(Session session, Map<String, Object> values) throws SQLException {
        BackendKind backend = session.backend();
        try (PreparedStatement stmt = session.prepare(statements.insert(backend))) {
            int index = 1;
            for (Column column : statements.insertColumns()) {
                DbUtil.bind(stmt, index++, column.type(), values.get(column.name()), backend);
            }
            if (descriptor.idKind() == IdKind.UUID) {
                stmt.executeUpdate();
                return descriptor.idType().cast(values.get(EntityDescriptor.ID_COLUMN));
            }
            if (backend == BackendKind.CLIENT_SERVER) {
                try (ResultSet rs = stmt.executeQuery()) {
                    rs.next();
                    return descriptor.idType().cast(rs.getLong(1));
                }
            }
            stmt.executeUpdate();
        }
        try (PreparedStatement stmt = session.prepare(statements.lastInsertId());
             ResultSet rs = stmt.executeQuery()) {
            rs.next();
            return descriptor.idType().cast(rs.getLong(1));
        }
    }

    private void writeColumns(Session session, ID id, Map<String, Object> values)
            throws SQLException {
        try (PreparedStatement stmt = session.prepare(statements.update(values.keySet()))) {
            int index = 1;
            for (Map.Entry<String, Object> entry : values.entrySet()) {
                ColumnType type = descriptor.column(entry.getKey()).orElseThrow().type();
                DbUtil.bind(stmt, index++, type, entry.getValue(), session.backend());
            }
            bindId(stmt, index, id, session.backend());
            stmt.executeUpdate();
        }
    }

    private void bindId(PreparedStatement stmt, int index, ID id, BackendKind backend)
            throws SQLException {
        DbUtil.bind(stmt, index, descriptor.idKind().columnType(), id, backend);
    }

    /** Binds non-null filter values in order; null filters render as IS NULL and take no slot. */
    private void bindFilters(PreparedStatement stmt, int firstIndex,
                             Map<String, Object> filters, BackendKind backend)
            throws SQLException {
        int index = firstIndex;
        for (Map.Entry<String, Object> entry : filters.entrySet()) {
            if (entry.getValue() == null) {
                continue;
            }
            ColumnType type = descriptor.column(entry.getKey()).orElseThrow().type();
            DbUtil.bind(stmt, index++, type, entry.getValue(), backend);
        }
    }

    private StatusOr<Optional<T>> readFirst(PreparedStatement stmt, BackendKind backend)
            throws SQLException {
        try (ResultSet rs = stmt.executeQuery()) {
            if (!rs.next()) {
                return StatusOr.ofValue(Optional.empty());
            }
            return extract(rs, backend).map(Optional::of);
        }
    }

    private StatusOr<ImmutableList<T>> readAll(PreparedStatement stmt, BackendKind backend)
            throws SQLException {
        ImmutableList.Builder<T> entities = ImmutableList.builder();
        try (ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                StatusOr<T> entityOr = extract(rs, backend);
                if (entityOr.isNotOk()) {
                    return entityOr.propagate();
                }
                entities.add(entityOr.getValue());
            }
        }
        return StatusOr.ofValue(entities.build());
    }

    /**
     * Extracts an entity from the current row of a ResultSet.
     */
    private StatusOr<T> extract(ResultSet rs, BackendKind backend) {
        Map<String, Object> values = new HashMap<>();
        for (Column column : descriptor.columns()) {
            StatusOr<Optional<Object>> valueOr =
                    DbUtil.readColumn(rs, column.name(), column.type(), backend);
            if (valueOr.isNotOk()) {
                return valueOr.propagate();
            }
            values.put(column.name(), valueOr.getValue().orElse(null));
        }
        try {
            return StatusOr.ofValue(descriptor.map(new Row(descriptor.entityName(), values)));
        } catch (RuntimeException e) {
            Logger.error(e, "Failed to map {} row {}", descriptor.entityName(), values);
            return StatusOr.ofStatus(
                    Status.internal("Failed to map " + descriptor.entityName() + " row", e));
        }
    }

    @Nullable
    private SoftDeleteState deletionState(T entity) {
        if (entity instanceof SoftDeletable<?> softDeletable) {
            return softDeletable.deletion();
        }
        return null;
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }

    /**
     * The clock reading, or one millisecond past the stored {@code updated_at} when the clock has
     * not moved beyond it.
     */
    private Instant nextUpdatedAt(T current) {
        Instant now = now();
        if (current instanceof Timestamped timestamped && !now.isAfter(timestamped.updatedAt())) {
            return timestamped.updatedAt().plusMillis(1);
        }
        return now;
    }

    private <R> StatusOr<R> fail(String operation, Status status) {
        Logger.warn("{} {} failed: {}", descriptor.entityName(), operation, status);
        return StatusOr.ofStatus(status);
    }

    /**
     * Rolls back a failed write, then classifies it: a unique violation becomes ALREADY_EXISTS,
     * anything else INTERNAL. A failing rollback is attached to {@code e} as suppressed.
     */
    private <R> StatusOr<R> writeFailure(
            Session session, String operation, @Nullable ID id, SQLException e) {
        try {
            session.rollback();
        } catch (SQLException rollbackError) {
            e.addSuppressed(rollbackError);
            return storageFailure(operation, e);
        }
        if (DbUtil.isUniqueViolation(e)) {
            return fail(operation, CrudErrors.alreadyExists(descriptor.entityName(), id, e));
        }
        return storageFailure(operation, e);
    }

    private <R> StatusOr<R> storageFailure(String operation, SQLException e) {
        Logger.error(e, "{} {} failed", descriptor.entityName(), operation);
        return StatusOr.ofStatus(
                Status.internal("Database error during " + operation + ": " + e.getMessage(), e));
    }
}
