package com.meshcall.protocol;

/**
 * 시그널링 메시지 직렬화/역직렬화 실패를 표현하는 런타임 예외.
 */
public class SignalCodecException extends RuntimeException {

    public SignalCodecException(String message) {
        super(message);
    }

    public SignalCodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
