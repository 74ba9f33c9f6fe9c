package com.jonathantong.WalShift.service;

public class ReplicaWriteException extends RuntimeException {

    public ReplicaWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
