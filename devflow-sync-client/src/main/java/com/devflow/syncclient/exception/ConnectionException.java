package com.devflow.syncclient.exception;

/**
 * Transport failure: the socket errored, or closed before reaching the open state.
 */
public class ConnectionException extends SyncException {

    /** Close code reported by the transport, or -1 when the failure was not a closure. */
    private final int closeCode;

    public ConnectionException(String message) {
        this(message, -1, null);
    }

    public ConnectionException(String message, Throwable cause) {
        this(message, -1, cause);
    }

    public ConnectionException(String message, int closeCode) {
        this(message, closeCode, null);
    }

    public ConnectionException(String message, int closeCode, Throwable cause) {
        super(message, cause);
        this.closeCode = closeCode;
    }

    public int getCloseCode() {
        return closeCode;
    }
}
