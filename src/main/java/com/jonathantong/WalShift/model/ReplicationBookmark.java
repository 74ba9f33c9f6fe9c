package com.jonathantong.WalShift.model;

/**
 * A logical replication slot and the WAL position it was created at.
 * Every change committed after {@code lsn} is retained for the slot's reader.
 */
public class ReplicationBookmark {

    private final String slotName;
    private final String lsn;

    public ReplicationBookmark(String slotName, String lsn) {
        this.slotName = slotName;
        this.lsn = lsn;
    }

    public String getSlotName() {
        return slotName;
    }

    public String getLsn() {
        return lsn;
    }

    @Override
    public String toString() {
        return "ReplicationBookmark{" +
                "slotName='" + slotName + '\'' +
                ", lsn='" + lsn + '\'' +
                '}';
    }
}
