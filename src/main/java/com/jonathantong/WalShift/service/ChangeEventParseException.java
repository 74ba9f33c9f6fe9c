package com.jonathantong.WalShift.service;

/**
 * Raised when a stream record is not a decodable Debezium change event
 */
public class ChangeEventParseException extends RuntimeException {

    public ChangeEventParseException(String message) {
        super(message);
    }

    public ChangeEventParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
