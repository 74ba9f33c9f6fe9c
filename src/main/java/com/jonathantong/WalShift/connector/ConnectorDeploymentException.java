package com.jonathantong.WalShift.connector;

import com.jonathantong.WalShift.MigrationException;

public class ConnectorDeploymentException extends MigrationException {

    public ConnectorDeploymentException(String message) {
        super(message);
    }

    public ConnectorDeploymentException(String message, Throwable cause) {
        super(message, cause);
    }
}
