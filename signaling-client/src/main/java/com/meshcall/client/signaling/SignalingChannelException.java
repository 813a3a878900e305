package com.meshcall.client.signaling;

public class SignalingChannelException extends RuntimeException {

    public SignalingChannelException(String message) {
        super(message);
    }

    public SignalingChannelException(String message, Throwable cause) {
        super(message, cause);
    }
}
