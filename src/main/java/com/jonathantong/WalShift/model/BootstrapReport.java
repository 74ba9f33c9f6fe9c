package com.jonathantong.WalShift.model;

/**
 * Outcome of the bookmark + bulk copy phase
 */
public class BootstrapReport {

    private final ReplicationBookmark bookmark;
    private final BulkTransferResult export;
    private final BulkTransferResult restore;

    public BootstrapReport(ReplicationBookmark bookmark, BulkTransferResult export, BulkTransferResult restore) {
        this.bookmark = bookmark;
        this.export = export;
        this.restore = restore;
    }

    public ReplicationBookmark getBookmark() { return bookmark; }

    public BulkTransferResult getExport() { return export; }

    public BulkTransferResult getRestore() { return restore; }

    @Override
    public String toString() {
        return "BootstrapReport{" +
                "bookmark=" + bookmark +
                ", export=" + export +
                ", restore=" + restore +
                '}';
    }
}
