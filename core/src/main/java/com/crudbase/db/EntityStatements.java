package com.crudbase.db;

import static com.crudbase.db.util.DbUtil.quote;

import com.crudbase.config.BackendKind;
import com.crudbase.model.Column;
import com.crudbase.model.EntityDescriptor;
import com.crudbase.model.IdKind;
import com.google.common.collect.ImmutableList;
import java.util.Collection;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * SQL text for one entity table. Fixed statements are built once; filter and update statements
 * are assembled per call from column names already checked against the descriptor.
 */
final class EntityStatements {

    private static final String ID = quote(EntityDescriptor.ID_COLUMN);

    private final String table;
    private final String selectColumns;
    private final ImmutableList<Column> insertColumns;
    private final boolean serialId;
    private final String selectById;
    private final String selectPage;
    private final String count;
    private final String insert;
    private final String deleteById;

    EntityStatements(EntityDescriptor<?, ?> descriptor) {
        this.table = quote(descriptor.tableName());
        this.selectColumns = descriptor.columns().stream()
                .map(column -> quote(column.name()))
                .collect(Collectors.joining(", "));
        this.serialId = descriptor.idKind() == IdKind.SERIAL;
        this.insertColumns = descriptor.columns().stream()
                .filter(column -> !(serialId && column.name().equals(EntityDescriptor.ID_COLUMN)))
                .collect(ImmutableList.toImmutableList());

        this.selectById = """
                SELECT %s
                  FROM %s
                 WHERE %s = ?
                """.formatted(selectColumns, table, ID);
        this.selectPage = """
                SELECT %s
                  FROM %s
                 ORDER BY %s
                 LIMIT ? OFFSET ?
                """.formatted(selectColumns, table, ID);
        this.count = """
                SELECT COUNT(*)
                  FROM %s
                """.formatted(table);
        this.insert = """
                INSERT INTO %s
                       (%s)
                VALUES (%s)
                """.formatted(
                        table,
                        insertColumns.stream()
                                .map(column -> quote(column.name()))
                                .collect(Collectors.joining(", ")),
                        insertColumns.stream()
                                .map(column -> "?")
                                .collect(Collectors.joining(", ")));
        this.deleteById = """
                DELETE FROM %s
                 WHERE %s = ?
                """.formatted(table, ID);
    }

    String selectById() {
        return selectById;
    }

    String selectPage() {
        return selectPage;
    }

    String count() {
        return count;
    }

    /** Columns bound by {@link #insert}, in parameter order. */
    ImmutableList<Column> insertColumns() {
        return insertColumns;
    }

    /**
     * Insert statement. On PostgreSQL a serial insert returns the new id; on SQLite it is read
     * back with {@link #lastInsertId()}.
     */
    String insert(BackendKind backend) {
        if (serialId && backend == BackendKind.CLIENT_SERVER) {
            return insert + "RETURNING " + ID;
        }
        return insert;
    }

    String lastInsertId() {
        return "SELECT last_insert_rowid()";
    }

    /** First matching row by ascending id. A null filter value matches {@code IS NULL}. */
    String selectFirstMatching(Map<String, Object> filters) {
        return """
                SELECT %s
                  FROM %s%s
                 ORDER BY %s
                 LIMIT 1
                """.formatted(selectColumns, table, where(filters), ID);
    }

    String existsMatching(Map<String, Object> filters) {
        return """
                SELECT 1
                  FROM %s%s
                 LIMIT 1
                """.formatted(table, where(filters));
    }

    String update(Collection<String> columns) {
        return """
                UPDATE %s
                   SET %s
                 WHERE %s = ?
                """.formatted(
                        table,
                        columns.stream()
                                .map(column -> quote(column) + " = ?")
                                .collect(Collectors.joining(", ")),
                        ID);
    }

    String deleteById() {
        return deleteById;
    }

    private static String where(Map<String, Object> filters) {
        if (filters.isEmpty()) {
            return "";
        }
        return " WHERE " + filters.entrySet().stream()
                .map(e -> e.getValue() == null
                        ? quote(e.getKey()) + " IS NULL"
                        : quote(e.getKey()) + " = ?")
                .collect(Collectors.joining(" AND "));
    }
}
