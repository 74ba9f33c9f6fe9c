package com.jonathantong.WalShift.bootstrap;

import com.jonathantong.WalShift.model.BootstrapReport;
import com.jonathantong.WalShift.model.BulkTransferResult;
import com.jonathantong.WalShift.model.ReplicationBookmark;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Bookmark first, then copy.
 * <p>
 * The slot must exist before pg_dump takes its snapshot: a change committed in between
 * would otherwise be in neither the dump nor the stream. Changes committed after the
 * slot but before the snapshot show up in both, which idempotent application absorbs.
 */
@Service
public class BootstrapSequencer {

    private static final Logger logger = LoggerFactory.getLogger(BootstrapSequencer.class);

    private final ReplicationSlotService replicationSlotService;
    private final BulkTransferService bulkTransferService;

    public BootstrapSequencer(ReplicationSlotService replicationSlotService, BulkTransferService bulkTransferService) {
        this.replicationSlotService = replicationSlotService;
        this.bulkTransferService = bulkTransferService;
    }

    /**
     * @throws BootstrapException on any failure; nothing is retried
     */
    public BootstrapReport run() {
        logger.info("Creating replication slot on source (everything after this point is captured)");
        ReplicationBookmark bookmark = replicationSlotService.createBookmark();

        logger.info("Dumping source");
        BulkTransferResult export = bulkTransferService.bulkExport();

        logger.info("Restoring into replica");
        BulkTransferResult restore = bulkTransferService.bulkImport(export);

        return new BootstrapReport(bookmark, export, restore);
    }
}
