package com.meshcall.client;

/**
 * 통화 시작(장치 획득, 시그널링 연결) 실패. 해당 시도에서 얻은 자원은 이미 반납된 상태다.
 */
public class CallStartException extends Exception {

    public CallStartException(String message, Throwable cause) {
        super(message, cause);
    }
}
