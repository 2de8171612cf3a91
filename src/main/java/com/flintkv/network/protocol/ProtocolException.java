package com.flintkv.network.protocol;

/**
 * Exception thrown when RESP framing is malformed.
 * The byte stream can no longer be trusted once this is raised.
 */
public class ProtocolException extends RuntimeException {

    public ProtocolException(String message) {
        super(message);
    }

    public ProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
