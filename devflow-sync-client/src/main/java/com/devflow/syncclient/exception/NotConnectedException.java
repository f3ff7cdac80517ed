package com.devflow.syncclient.exception;

public class NotConnectedException extends SyncException {

    public NotConnectedException(String message) {
        super(message);
    }
}
