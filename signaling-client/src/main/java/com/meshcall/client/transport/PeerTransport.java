package com.meshcall.client.transport;

import com.meshcall.client.media.MediaTrack;
import java.util.concurrent.CompletableFuture;

/**
 * 상대 참가자 한 명과의 미디어 연결 핸들.
 * <p>
 * 비동기 작업은 {@link CompletableFuture} 로 결과를 돌려주며,
 * 실패는 예외적으로 완료된 future 로 전달한다.
 */
public interface PeerTransport {

    void addTrack(MediaTrack track);

    CompletableFuture<SessionDescription> createOffer();

    CompletableFuture<SessionDescription> createAnswer();

    CompletableFuture<Void> setLocalDescription(SessionDescription description);

    CompletableFuture<Void> setRemoteDescription(SessionDescription description);

    CompletableFuture<Void> addRemoteCandidate(IceCandidate candidate);

    /**
     * 연결을 닫는다. 이미 닫힌 핸들에 대해 호출해도 안전해야 한다.
     */
    void close();
}
