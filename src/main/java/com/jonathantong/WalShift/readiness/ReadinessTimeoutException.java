package com.jonathantong.WalShift.readiness;

import com.jonathantong.WalShift.MigrationException;

public class ReadinessTimeoutException extends MigrationException {

    public ReadinessTimeoutException(String message) {
        super(message);
    }
}
