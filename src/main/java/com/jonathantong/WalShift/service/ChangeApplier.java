package com.jonathantong.WalShift.service;

import com.jonathantong.WalShift.model.ApplyOutcome;
import com.jonathantong.WalShift.model.ChangeEvent;
import com.jonathantong.WalShift.model.TableMetadata;
import com.jonathantong.WalShift.model.TrackedTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Turns one change record into one idempotent replica write.
 * <p>
 * Records that cannot be decoded, lack the image they need, or are rejected by the
 * replica are logged and dropped; nothing here stops the calling consumer.
 */
@Service
public class ChangeApplier {

    private static final Logger logger = LoggerFactory.getLogger(ChangeApplier.class);

    private final ChangeEventParser changeEventParser;
    private final SchemaMetadataService schemaMetadataService;
    private final TemporalValueConverter temporalValueConverter;
    private final DatabaseUpdateService databaseUpdateService;
    private final AppliedEventCounter appliedEventCounter;

    public ChangeApplier(
            ChangeEventParser changeEventParser,
            SchemaMetadataService schemaMetadataService,
            TemporalValueConverter temporalValueConverter,
            DatabaseUpdateService databaseUpdateService,
            AppliedEventCounter appliedEventCounter) {
        this.changeEventParser = changeEventParser;
        this.schemaMetadataService = schemaMetadataService;
        this.temporalValueConverter = temporalValueConverter;
        this.databaseUpdateService = databaseUpdateService;
        this.appliedEventCounter = appliedEventCounter;
    }

    public ApplyOutcome apply(TrackedTable table, String message) {
        // Tombstones carry no value
        if (message == null || message.isEmpty()) {
            logger.debug("[writer] {} skipping tombstone record", table.getTableName());
            return ApplyOutcome.SKIPPED;
        }

        ChangeEvent changeEvent;
        try {
            changeEvent = changeEventParser.parse(message);
        } catch (ChangeEventParseException e) {
            logger.warn("[writer] {} dropping undecodable record: {}", table.getTableName(), e.getMessage());
            return ApplyOutcome.MALFORMED;
        }
        return apply(table, changeEvent);
    }

    public ApplyOutcome apply(TrackedTable table, ChangeEvent changeEvent) {
        ApplyOutcome outcome;
        try {
            outcome = changeEvent.getOperation().isUpsert()
                    ? handleUpsert(table, changeEvent)
                    : handleDelete(table, changeEvent);
        } catch (ReplicaWriteException e) {
            logger.error("[writer] {} {} id={} failed: {}", changeEvent.getOperation(), table.getTableName(),
                    changeEvent.getPrimaryKey(), rootMessage(e), e);
            return ApplyOutcome.FAILED;
        }

        if (outcome.isApplied()) {
            appliedEventCounter.increment();
        }
        return outcome;
    }

    private ApplyOutcome handleUpsert(TrackedTable table, ChangeEvent changeEvent) {
        if (!changeEvent.hasAfter()) {
            logger.warn("[writer] {} {} event without after-image, dropped", table.getTableName(),
                    changeEvent.getOperation());
            return ApplyOutcome.SKIPPED;
        }
        Object id = changeEvent.getPrimaryKey();
        if (id == null) {
            logger.warn("[writer] {} after-image has no {} column, dropped", table.getTableName(),
                    TrackedTable.PRIMARY_KEY);
            return ApplyOutcome.SKIPPED;
        }

        databaseUpdateService.upsert(table, normalize(table, changeEvent.getAfter()));
        logger.info("[writer] synced {} id={}", table.getTableName(), id);
        return ApplyOutcome.UPSERTED;
    }

    private ApplyOutcome handleDelete(TrackedTable table, ChangeEvent changeEvent) {
        Object id = changeEvent.getPrimaryKey();
        if (id == null) {
            logger.warn("[writer] {} delete event without before-image key, dropped", table.getTableName());
            return ApplyOutcome.SKIPPED;
        }

        databaseUpdateService.delete(table, id);
        logger.info("[writer] deleted {} id={}", table.getTableName(), id);
        return ApplyOutcome.DELETED;
    }

    private Map<String, Object> normalize(TrackedTable table, Map<String, Object> row) {
        TableMetadata metadata = schemaMetadataService.getTableMetadata(table);
        Map<String, Object> normalized = new LinkedHashMap<>();
        row.forEach((column, value) -> normalized.put(column,
                metadata.isTemporal(column)
                        ? temporalValueConverter.convert(value, metadata.getTemporalType(column))
                        : value));
        return normalized;
    }

    private static String rootMessage(Throwable e) {
        Throwable root = e;
        while (root.getCause() != null) {
            root = root.getCause();
        }
        return root.getMessage();
    }
}
