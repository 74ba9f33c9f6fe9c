package com.jonathantong.WalShift.service;

import com.jonathantong.WalShift.model.TrackedTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Service for applying row changes to the replica database.
 * <p>
 * Each call is a single autocommit statement keyed on the {@code id} column, so
 * replaying the same change converges to the same row.
 */
@Service
public class DatabaseUpdateService {

    private static final Logger logger = LoggerFactory.getLogger(DatabaseUpdateService.class);

    private final JdbcTemplate targetJdbcTemplate;

    public DatabaseUpdateService(@Qualifier("targetJdbcTemplate") JdbcTemplate targetJdbcTemplate) {
        this.targetJdbcTemplate = targetJdbcTemplate;
    }

    /**
     * Insert the row, or on primary key conflict overwrite every non-key column present in {@code data}.
     */
    public int upsert(TrackedTable table, Map<String, Object> data) {
        if (data == null || data.isEmpty()) {
            throw new IllegalArgumentException("No data provided for UPSERT into table " + table.getQualifiedName());
        }

        List<String> columns = new ArrayList<>(data.keySet());
        List<Object> values = new ArrayList<>();
        for (String column : columns) {
            values.add(data.get(column));
        }

        String columnsList = columns.stream()
                .map(DatabaseUpdateService::quote)
                .collect(Collectors.joining(", "));

        String placeholders = columns.stream()
                .map(col -> "?")
                .collect(Collectors.joining(", "));

        String updateSetClause = columns.stream()
                .filter(col -> !TrackedTable.PRIMARY_KEY.equals(col))
                .map(col -> quote(col) + " = EXCLUDED." + quote(col))
                .collect(Collectors.joining(", "));

        // A key-only image has nothing to overwrite
        String conflictAction = updateSetClause.isEmpty()
                ? "DO NOTHING"
                : "DO UPDATE SET " + updateSetClause;

        String sql = String.format("INSERT INTO %s (%s) VALUES (%s) ON CONFLICT (%s) %s",
                qualifiedName(table), columnsList, placeholders, quote(TrackedTable.PRIMARY_KEY), conflictAction);

        logger.debug("Executing UPSERT: {} with values: {}", sql, values);

        try {
            int rowsAffected = targetJdbcTemplate.update(sql, values.toArray());
            logger.debug("UPSERT successful: {} rows affected in table {}", rowsAffected, table.getQualifiedName());
            return rowsAffected;
        } catch (DataAccessException e) {
            throw new ReplicaWriteException("Upsert failed for table " + table.getQualifiedName(), e);
        }
    }

    /**
     * Delete by primary key. Deleting a row that is already gone affects nothing and is not an error.
     */
    public int delete(TrackedTable table, Object id) {
        if (id == null) {
            throw new IllegalArgumentException("Primary key required for DELETE from table " + table.getQualifiedName());
        }

        String sql = String.format("DELETE FROM %s WHERE %s = ?",
                qualifiedName(table), quote(TrackedTable.PRIMARY_KEY));

        logger.debug("Executing DELETE: {} with id: {}", sql, id);

        try {
            int rowsAffected = targetJdbcTemplate.update(sql, id);
            if (rowsAffected == 0) {
                logger.debug("DELETE affected 0 rows in table {} - id {} already absent", table.getQualifiedName(), id);
            }
            return rowsAffected;
        } catch (DataAccessException e) {
            throw new ReplicaWriteException("Delete failed for table " + table.getQualifiedName(), e);
        }
    }

    static String qualifiedName(TrackedTable table) {
        return quote(table.getSchema()) + "." + quote(table.getTableName());
    }

    static String quote(String identifier) {
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }
}
