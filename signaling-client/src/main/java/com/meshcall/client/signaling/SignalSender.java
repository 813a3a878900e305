package com.meshcall.client.signaling;

import com.meshcall.protocol.SignalMessage;

@FunctionalInterface
public interface SignalSender {

    /**
     * @throws SignalingChannelException 메시지를 보낼 수 없을 때
     */
    void send(SignalMessage message);
}
