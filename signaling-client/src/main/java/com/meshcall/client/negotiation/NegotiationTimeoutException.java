package com.meshcall.client.negotiation;

public class NegotiationTimeoutException extends RuntimeException {

    public NegotiationTimeoutException(String message) {
        super(message);
    }
}
