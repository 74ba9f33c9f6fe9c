package com.jonathantong.WalShift.verify;

import com.jonathantong.WalShift.config.WalShiftProperties;
import com.jonathantong.WalShift.model.TrackedTable;
import com.jonathantong.WalShift.model.VerificationReport;
import com.jonathantong.WalShift.service.SchemaMetadataService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import java.sql.Date;
import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Compares the replica against the source: row counts per table, and temporal values
 * on a sample of rows. Differences are reported, never fatal.
 */
@Service
public class ReplicationVerifier {

    private static final Logger logger = LoggerFactory.getLogger(ReplicationVerifier.class);

    private final JdbcTemplate sourceJdbcTemplate;
    private final JdbcTemplate targetJdbcTemplate;
    private final SchemaMetadataService schemaMetadataService;
    private final WalShiftProperties properties;

    public ReplicationVerifier(
            @Qualifier("sourceJdbcTemplate") JdbcTemplate sourceJdbcTemplate,
            @Qualifier("targetJdbcTemplate") JdbcTemplate targetJdbcTemplate,
            SchemaMetadataService schemaMetadataService,
            WalShiftProperties properties) {
        this.sourceJdbcTemplate = sourceJdbcTemplate;
        this.targetJdbcTemplate = targetJdbcTemplate;
        this.schemaMetadataService = schemaMetadataService;
        this.properties = properties;
    }

    public VerificationReport verify() {
        VerificationReport report = new VerificationReport();
        logger.info("[verify] Checking replica:");

        for (TrackedTable table : properties.trackedTables()) {
            compareCounts(table, report);
            compareTemporalValues(table, report);
        }

        if (report.getTemporalValuesChecked() > 0) {
            logger.info("  Timestamps: {}/{} matched", report.getTemporalValuesMatched(),
                    report.getTemporalValuesChecked());
        }
        if (report.isClean()) {
            logger.info("  PASS: replica matches source");
        } else {
            report.getDiscrepancies().forEach(discrepancy -> logger.warn("  MISMATCH {}", discrepancy));
        }
        return report;
    }

    /**
     * Row counts of every tracked table in the given database, in configuration order.
     */
    public Map<String, Long> countRows(JdbcTemplate jdbcTemplate) {
        Map<String, Long> counts = new LinkedHashMap<>();
        for (TrackedTable table : properties.trackedTables()) {
            counts.put(table.getTableName(), count(jdbcTemplate, table));
        }
        return counts;
    }

    public void logCounts(String label, JdbcTemplate jdbcTemplate) {
        logger.info("[{}]:", label);
        long total = 0;
        for (Map.Entry<String, Long> entry : countRows(jdbcTemplate).entrySet()) {
            total += Math.max(entry.getValue(), 0);
            logger.info(String.format("  %-25s %d", entry.getKey(), entry.getValue()));
        }
        logger.info(String.format("  %-25s %d", "TOTAL", total));
    }

    private void compareCounts(TrackedTable table, VerificationReport report) {
        long source = count(sourceJdbcTemplate, table);
        long replica = count(targetJdbcTemplate, table);
        if (source < 0 || replica < 0) {
            report.addDiscrepancy(table.getTableName() + " could not be counted");
            return;
        }
        report.addTableCount(table.getTableName(), source, replica);
    }

    private void compareTemporalValues(TrackedTable table, VerificationReport report) {
        List<String> columns = new ArrayList<>(schemaMetadataService.getTableMetadata(table).getTemporalColumns());
        if (columns.isEmpty()) {
            return;
        }
        columns.sort(String::compareTo);

        String sql = String.format("SELECT %s, %s FROM %s ORDER BY %s LIMIT ?",
                quote(TrackedTable.PRIMARY_KEY),
                columns.stream().map(ReplicationVerifier::quote).collect(Collectors.joining(", ")),
                quote(table.getSchema()) + "." + quote(table.getTableName()),
                quote(TrackedTable.PRIMARY_KEY));
        int sampleSize = properties.getVerification().getSampleSize();

        Map<Object, Map<String, Object>> sourceRows;
        Map<Object, Map<String, Object>> replicaRows;
        try {
            sourceRows = byId(sourceJdbcTemplate.queryForList(sql, sampleSize));
            replicaRows = byId(targetJdbcTemplate.queryForList(sql, sampleSize));
        } catch (DataAccessException e) {
            logger.warn("  SKIP {}: {}", table.getTableName(), e.getMessage());
            return;
        }

        Duration tolerance = properties.getVerification().getTolerance();
        for (Map.Entry<Object, Map<String, Object>> entry : sourceRows.entrySet()) {
            Map<String, Object> replicaRow = replicaRows.get(entry.getKey());
            if (replicaRow == null) {
                report.addDiscrepancy(String.format("%s id=%s missing from replica", table.getTableName(), entry.getKey()));
                continue;
            }
            for (String column : columns) {
                Instant expected = toInstant(entry.getValue().get(column));
                Instant actual = toInstant(replicaRow.get(column));
                if (expected == null && actual == null) {
                    continue;
                }
                boolean matched = expected != null && actual != null
                        && Duration.between(expected, actual).abs().compareTo(tolerance) <= 0;
                report.recordTemporalComparison(matched);
                if (!matched) {
                    report.addDiscrepancy(String.format("%s id=%s col=%s: src=%s dst=%s",
                            table.getTableName(), entry.getKey(), column, expected, actual));
                }
            }
        }
    }

    private long count(JdbcTemplate jdbcTemplate, TrackedTable table) {
        try {
            Long rows = jdbcTemplate.queryForObject(
                    "SELECT COUNT(*) FROM " + quote(table.getSchema()) + "." + quote(table.getTableName()), Long.class);
            return rows != null ? rows : 0;
        } catch (DataAccessException e) {
            logger.warn("  Could not count {}: {}", table.getQualifiedName(), e.getMessage());
            return -1;
        }
    }

    private static Map<Object, Map<String, Object>> byId(List<Map<String, Object>> rows) {
        Map<Object, Map<String, Object>> result = new HashMap<>();
        for (Map<String, Object> row : rows) {
            result.put(row.get(TrackedTable.PRIMARY_KEY), row);
        }
        return result;
    }

    static Instant toInstant(Object value) {
        if (value instanceof Timestamp) {
            return ((Timestamp) value).toInstant();
        }
        if (value instanceof Date) {
            return ((Date) value).toLocalDate().atStartOfDay(ZoneOffset.UTC).toInstant();
        }
        if (value instanceof OffsetDateTime) {
            return ((OffsetDateTime) value).toInstant();
        }
        return null;
    }

    private static String quote(String identifier) {
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }
}
