package com.jonathantong.WalShift.model;

/**
 * PostgreSQL column types that receive temporal normalization, keyed by
 * their information_schema.columns data_type.
 */
public enum TemporalType {
    TIMESTAMP("timestamp without time zone"),
    TIMESTAMPTZ("timestamp with time zone"),
    DATE("date");

    private final String dataType;

    TemporalType(String dataType) {
        this.dataType = dataType;
    }

    public String getDataType() {
        return dataType;
    }

    /**
     * @return the matching type, or null for a non-temporal data_type
     */
    public static TemporalType fromDataType(String dataType) {
        for (TemporalType type : values()) {
            if (type.dataType.equals(dataType)) {
                return type;
            }
        }
        return null;
    }
}
