package com.jonathantong.WalShift.model;

/**
 * Debezium operation codes
 */
public enum Operation {
    CREATE("c"),
    SNAPSHOT_READ("r"),
    UPDATE("u"),
    DELETE("d");

    private final String code;

    Operation(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    /**
     * Create, snapshot read and update all carry a full after-image and are applied as upserts.
     */
    public boolean isUpsert() {
        return this != DELETE;
    }

    public static Operation fromCode(String code) {
        for (Operation operation : values()) {
            if (operation.code.equals(code)) {
                return operation;
            }
        }
        throw new IllegalArgumentException("Unknown operation code: " + code);
    }
}
