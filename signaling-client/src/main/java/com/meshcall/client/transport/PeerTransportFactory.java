package com.meshcall.client.transport;

@FunctionalInterface
public interface PeerTransportFactory {

    /**
     * @throws PeerTransportException 연결 핸들을 만들 수 없을 때
     */
    PeerTransport create(String peerId, RtcConfiguration configuration, PeerTransportListener listener);
}
