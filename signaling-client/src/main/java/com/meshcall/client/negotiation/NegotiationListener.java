package com.meshcall.client.negotiation;

import com.meshcall.client.media.RemoteMedia;

/**
 * {@link NegotiationController} 가 소유자에게 알리는 이벤트.
 * 컨트롤러 잠금을 잡지 않은 상태에서 호출된다.
 */
public interface NegotiationListener {

    void onRemoteMedia(String peerId, RemoteMedia media);

    void onStateChanged(String peerId, NegotiationState state);

    void onNegotiationFailed(String peerId, Throwable cause);
}
