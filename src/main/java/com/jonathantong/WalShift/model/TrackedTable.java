package com.jonathantong.WalShift.model;

import java.util.Objects;

/**
 * A replicated table and the change stream topic Debezium publishes it to
 */
public class TrackedTable {

    public static final String PRIMARY_KEY = "id";

    private final String schema;
    private final String tableName;
    private final String topicPrefix;

    public TrackedTable(String schema, String tableName, String topicPrefix) {
        this.schema = Objects.requireNonNull(schema, "schema");
        this.tableName = Objects.requireNonNull(tableName, "tableName");
        this.topicPrefix = Objects.requireNonNull(topicPrefix, "topicPrefix");
    }

    public String getSchema() {
        return schema;
    }

    public String getTableName() {
        return tableName;
    }

    public String getQualifiedName() {
        return schema + "." + tableName;
    }

    /**
     * Debezium topic naming: prefix.schema.table
     */
    public String getTopic() {
        return topicPrefix + "." + schema + "." + tableName;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TrackedTable)) return false;
        TrackedTable that = (TrackedTable) o;
        return schema.equals(that.schema)
                && tableName.equals(that.tableName)
                && topicPrefix.equals(that.topicPrefix);
    }

    @Override
    public int hashCode() {
        return Objects.hash(schema, tableName, topicPrefix);
    }

    @Override
    public String toString() {
        return "TrackedTable{" +
                "table='" + getQualifiedName() + '\'' +
                ", topic='" + getTopic() + '\'' +
                '}';
    }
}
