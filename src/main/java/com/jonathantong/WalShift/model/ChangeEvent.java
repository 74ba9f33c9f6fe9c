package com.jonathantong.WalShift.model;

import java.util.Collections;
import java.util.Map;

/**
 * One decoded Debezium change record.
 * <p>
 * Row images keep column order and hold only null, Boolean, Number or String values.
 */
public class ChangeEvent {

    private final Operation operation;
    private final Map<String, Object> before;
    private final Map<String, Object> after;

    public ChangeEvent(Operation operation, Map<String, Object> before, Map<String, Object> after) {
        this.operation = operation;
        this.before = before != null ? Collections.unmodifiableMap(before) : null;
        this.after = after != null ? Collections.unmodifiableMap(after) : null;
    }

    public Operation getOperation() { return operation; }

    public Map<String, Object> getBefore() { return before; }

    public Map<String, Object> getAfter() { return after; }

    public boolean hasBefore() { return before != null; }

    public boolean hasAfter() { return after != null; }

    /**
     * Primary key from the image the operation is keyed on, or null if it is missing.
     */
    public Object getPrimaryKey() {
        Map<String, Object> image = operation.isUpsert() ? after : before;
        return image != null ? image.get(TrackedTable.PRIMARY_KEY) : null;
    }

    @Override
    public String toString() {
        return "ChangeEvent{" +
                "operation=" + operation +
                ", id=" + getPrimaryKey() +
                '}';
    }
}
