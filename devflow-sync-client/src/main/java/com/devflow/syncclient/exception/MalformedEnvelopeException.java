package com.devflow.syncclient.exception;

public class MalformedEnvelopeException extends SyncException {

    public MalformedEnvelopeException(String message) {
        super(message);
    }

    public MalformedEnvelopeException(String message, Throwable cause) {
        super(message, cause);
    }
}
