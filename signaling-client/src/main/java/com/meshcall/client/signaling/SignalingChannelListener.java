package com.meshcall.client.signaling;

import com.meshcall.protocol.SignalMessage;

public interface SignalingChannelListener {

    /**
     * 서버 메시지를 수신 순서대로 전달한다.
     */
    void onMessage(SignalMessage message);

    void onClosed(String reason);
}
