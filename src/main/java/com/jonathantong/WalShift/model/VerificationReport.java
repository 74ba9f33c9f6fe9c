package com.jonathantong.WalShift.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Source vs replica reconciliation result. Discrepancies are informational only.
 */
public class VerificationReport {

    private final List<TableCount> tableCounts = new ArrayList<>();
    private final List<String> discrepancies = new ArrayList<>();
    private int temporalValuesChecked;
    private int temporalValuesMatched;

    public void addTableCount(String tableName, long sourceRows, long replicaRows) {
        TableCount count = new TableCount(tableName, sourceRows, replicaRows);
        tableCounts.add(count);
        if (!count.matches()) {
            addDiscrepancy(String.format("%s row count: source=%d replica=%d", tableName, sourceRows, replicaRows));
        }
    }

    public void recordTemporalComparison(boolean matched) {
        temporalValuesChecked++;
        if (matched) {
            temporalValuesMatched++;
        }
    }

    public void addDiscrepancy(String discrepancy) {
        discrepancies.add(discrepancy);
    }

    public List<TableCount> getTableCounts() {
        return Collections.unmodifiableList(tableCounts);
    }

    public List<String> getDiscrepancies() {
        return Collections.unmodifiableList(discrepancies);
    }

    public int getTemporalValuesChecked() {
        return temporalValuesChecked;
    }

    public int getTemporalValuesMatched() {
        return temporalValuesMatched;
    }

    public boolean isClean() {
        return discrepancies.isEmpty();
    }

    public static class TableCount {
        private final String tableName;
        private final long sourceRows;
        private final long replicaRows;

        public TableCount(String tableName, long sourceRows, long replicaRows) {
            this.tableName = tableName;
            this.sourceRows = sourceRows;
            this.replicaRows = replicaRows;
        }

        public String getTableName() { return tableName; }
        public long getSourceRows() { return sourceRows; }
        public long getReplicaRows() { return replicaRows; }

        public boolean matches() {
            return sourceRows == replicaRows;
        }
    }
}
