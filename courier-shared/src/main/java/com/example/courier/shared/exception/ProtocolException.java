package com.example.courier.shared.exception;

import lombok.Getter;

/**
 * Raised for an inbound frame that cannot be parsed. Fatal to the connection
 * that sent it, never to the process.
 */
@Getter
public class ProtocolException extends RuntimeException {

    private final String connectionId;

    public ProtocolException(String message, String connectionId, Throwable cause) {
        super(message, cause);
        this.connectionId = connectionId;
    }

    public ProtocolException(String message, String connectionId) {
        this(message, connectionId, null);
    }
}
