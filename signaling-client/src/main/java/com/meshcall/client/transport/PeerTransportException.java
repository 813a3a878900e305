package com.meshcall.client.transport;

public class PeerTransportException extends RuntimeException {

    public PeerTransportException(String message) {
        super(message);
    }

    public PeerTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
