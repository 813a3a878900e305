package com.meshcall.signaling.service;

/**
 * 중계 대상(송신자, 방, 수신자)을 찾지 못했을 때 던지는 런타임 예외.
 * 라우터가 잡아서 송신자에게 error 메시지로 돌려준다.
 */
public class RelayException extends RuntimeException {

    public RelayException(String message) {
        super(message);
    }
}
