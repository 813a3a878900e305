package com.meshcall.signaling.websocket;

import com.meshcall.protocol.SignalMessage;

/**
 * 참가자 한 명과의 양방향 메시지 채널.
 */
public interface ParticipantTransport {

    /**
     * 연결 단위로 고유한 식별자.
     */
    String getId();

    /**
     * 메시지를 전송한다. 전송 실패는 구현체가 기록하고 호출자에게 던지지 않는다.
     */
    void send(SignalMessage message);
}
