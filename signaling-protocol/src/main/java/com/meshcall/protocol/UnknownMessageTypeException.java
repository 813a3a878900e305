package com.meshcall.protocol;

/**
 * JSON은 올바르지만 {@code type}이 없거나 알 수 없는 값인 경우.
 */
public class UnknownMessageTypeException extends SignalCodecException {

    private final String typeId;

    public UnknownMessageTypeException(String typeId, Throwable cause) {
        super(typeId == null ? "Missing message type" : "Unknown message type: " + typeId, cause);
        this.typeId = typeId;
    }

    public String getTypeId() {
        return typeId;
    }
}
