package com.jonathantong.WalShift;

/**
 * Base class for failures that abort the migration at startup
 */
public class MigrationException extends RuntimeException {

    public MigrationException(String message) {
        super(message);
    }

    public MigrationException(String message, Throwable cause) {
        super(message, cause);
    }
}
