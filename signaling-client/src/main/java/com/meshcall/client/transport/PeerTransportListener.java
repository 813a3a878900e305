package com.meshcall.client.transport;

import com.meshcall.client.media.RemoteMedia;

/**
 * 피어 연결이 발생시키는 이벤트. 구현체의 내부 스레드에서 호출될 수 있다.
 */
public interface PeerTransportListener {

    void onLocalCandidate(IceCandidate candidate);

    void onRemoteMedia(RemoteMedia media);

    void onConnectionStateChange(PeerConnectionState state);
}
