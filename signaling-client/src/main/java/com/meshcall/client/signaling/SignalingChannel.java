package com.meshcall.client.signaling;

/**
 * 시그널링 서버와의 연결 하나. 여러 스레드에서 동시에 send 를 호출할 수 있어야 한다.
 */
public interface SignalingChannel extends SignalSender {

    boolean isOpen();

    void close();
}
