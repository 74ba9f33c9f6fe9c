package com.jonathantong.WalShift.bootstrap;

import com.jonathantong.WalShift.MigrationException;

/**
 * Slot creation or bulk copy failed. The migration cannot continue.
 */
public class BootstrapException extends MigrationException {

    public BootstrapException(String message) {
        super(message);
    }

    public BootstrapException(String message, Throwable cause) {
        super(message, cause);
    }
}
