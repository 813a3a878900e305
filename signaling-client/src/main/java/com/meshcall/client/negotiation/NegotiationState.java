package com.meshcall.client.negotiation;

public enum NegotiationState {
    ABSENT,
    OFFERING,
    ANSWERING,
    CONNECTED,
    CLOSED
}
