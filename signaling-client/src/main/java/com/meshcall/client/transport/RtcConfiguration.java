package com.meshcall.client.transport;

import java.util.List;

/**
 * 피어 연결 생성 시 전달하는 ICE 서버 구성. TURN 은 기본 구성에 포함하지 않는다.
 */
public class RtcConfiguration {

    private final List<IceServer> iceServers;

    public RtcConfiguration(List<IceServer> iceServers) {
        this.iceServers = List.copyOf(iceServers);
    }

    public static RtcConfiguration defaults() {
        return new RtcConfiguration(List.of(
                IceServer.stun("stun:stun.l.google.com:19302"),
                IceServer.stun("stun:stun1.l.google.com:19302")));
    }

    public List<IceServer> getIceServers() {
        return iceServers;
    }
}
