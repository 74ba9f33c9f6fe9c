package com.jonathantong.WalShift.model;

import java.util.Map;
import java.util.Set;

/**
 * Replica-side metadata for a table: the columns holding temporal values and their types
 */
public class TableMetadata {

    private final String tableName;
    private final Map<String, TemporalType> temporalColumns;

    public TableMetadata(String tableName, Map<String, TemporalType> temporalColumns) {
        this.tableName = tableName;
        this.temporalColumns = Map.copyOf(temporalColumns);
    }

    public static TableMetadata empty(String tableName) {
        return new TableMetadata(tableName, Map.of());
    }

    public String getTableName() {
        return tableName;
    }

    public Set<String> getTemporalColumns() {
        return temporalColumns.keySet();
    }

    public boolean isTemporal(String column) {
        return temporalColumns.containsKey(column);
    }

    /**
     * @return the column's temporal type, or null if the column is not temporal
     */
    public TemporalType getTemporalType(String column) {
        return temporalColumns.get(column);
    }

    @Override
    public String toString() {
        return "TableMetadata{" +
                "tableName='" + tableName + '\'' +
                ", temporalColumns=" + temporalColumns +
                '}';
    }
}
