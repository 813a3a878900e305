package com.meshcall.protocol;

/**
 * JSON으로 해석할 수 없는 프레임.
 */
public class MalformedMessageException extends SignalCodecException {

    public MalformedMessageException(String message, Throwable cause) {
        super(message, cause);
    }
}
