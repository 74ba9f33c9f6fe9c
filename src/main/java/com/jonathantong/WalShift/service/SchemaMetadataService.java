package com.jonathantong.WalShift.service;

import com.jonathantong.WalShift.model.TableMetadata;
import com.jonathantong.WalShift.model.TemporalType;
import com.jonathantong.WalShift.model.TrackedTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Looks up which replica columns are temporal, once per table.
 * <p>
 * The schema is assumed static for the lifetime of the process, so entries are never evicted.
 */
@Service
public class SchemaMetadataService {

    private static final Logger logger = LoggerFactory.getLogger(SchemaMetadataService.class);

    private static final String TEMPORAL_COLUMNS_SQL = """
            SELECT column_name, data_type
            FROM information_schema.columns
            WHERE table_schema = ? AND table_name = ?
              AND data_type IN ('timestamp without time zone', 'timestamp with time zone', 'date')
            """;

    private final JdbcTemplate targetJdbcTemplate;

    // computeIfAbsent blocks concurrent callers for the same table until the first lookup finishes
    private final Map<String, TableMetadata> tableMetadataCache = new ConcurrentHashMap<>();

    public SchemaMetadataService(@Qualifier("targetJdbcTemplate") JdbcTemplate targetJdbcTemplate) {
        this.targetJdbcTemplate = targetJdbcTemplate;
    }

    public TableMetadata getTableMetadata(TrackedTable table) {
        return tableMetadataCache.computeIfAbsent(table.getQualifiedName(), key -> loadTableMetadata(table));
    }

    private TableMetadata loadTableMetadata(TrackedTable table) {
        try {
            List<Map<String, Object>> rows = targetJdbcTemplate.queryForList(
                    TEMPORAL_COLUMNS_SQL, table.getSchema(), table.getTableName());
            Map<String, TemporalType> columns = new HashMap<>();
            for (Map<String, Object> row : rows) {
                TemporalType type = TemporalType.fromDataType((String) row.get("data_type"));
                if (type != null) {
                    columns.put((String) row.get("column_name"), type);
                }
            }
            TableMetadata metadata = new TableMetadata(table.getTableName(), columns);
            logger.info("Temporal columns for {}: {}", table.getQualifiedName(), columns);
            return metadata;
        } catch (DataAccessException e) {
            // Cached as empty: values for this table are written without conversion
            logger.warn("Could not read column types for {}, temporal conversion disabled: {}",
                    table.getQualifiedName(), e.getMessage());
            return TableMetadata.empty(table.getTableName());
        }
    }
}
