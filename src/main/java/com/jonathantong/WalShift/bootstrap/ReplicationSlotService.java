package com.jonathantong.WalShift.bootstrap;

import com.jonathantong.WalShift.config.WalShiftProperties;
import com.jonathantong.WalShift.model.ReplicationBookmark;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Creates the logical replication slot on the source that bookmarks the WAL.
 * Every change committed after the returned LSN is retained for the connector.
 */
@Service
public class ReplicationSlotService {

    private static final Logger logger = LoggerFactory.getLogger(ReplicationSlotService.class);

    private static final String DROP_SLOT_SQL = """
            SELECT pg_drop_replication_slot(slot_name)
            FROM pg_replication_slots
            WHERE slot_name = ?
            """;

    private static final String CREATE_SLOT_SQL =
            "SELECT slot_name, lsn::TEXT AS lsn FROM pg_create_logical_replication_slot(?, ?)";

    private final JdbcTemplate sourceJdbcTemplate;
    private final WalShiftProperties properties;

    public ReplicationSlotService(
            @Qualifier("sourceJdbcTemplate") JdbcTemplate sourceJdbcTemplate,
            WalShiftProperties properties) {
        this.sourceJdbcTemplate = sourceJdbcTemplate;
        this.properties = properties;
    }

    /**
     * Drop any slot left by a previous run, then create a fresh one.
     *
     * @throws BootstrapException if the source is unreachable or rejects either statement
     */
    public ReplicationBookmark createBookmark() {
        String slotName = properties.getSlot().getName();
        String plugin = properties.getSlot().getPlugin();

        try {
            List<Map<String, Object>> dropped = sourceJdbcTemplate.queryForList(DROP_SLOT_SQL, slotName);
            if (!dropped.isEmpty()) {
                logger.info("  Dropped stale slot '{}'", slotName);
            }

            ReplicationBookmark bookmark = sourceJdbcTemplate.queryForObject(CREATE_SLOT_SQL,
                    (rs, rowNum) -> new ReplicationBookmark(rs.getString("slot_name"), rs.getString("lsn")),
                    slotName, plugin);
            if (bookmark == null) {
                throw new BootstrapException("Slot creation returned no row for '" + slotName + "'");
            }

            logger.info("  Slot '{}' at LSN {}", bookmark.getSlotName(), bookmark.getLsn());
            return bookmark;
        } catch (DataAccessException e) {
            throw new BootstrapException("Replication slot '" + slotName + "' could not be created", e);
        }
    }
}
