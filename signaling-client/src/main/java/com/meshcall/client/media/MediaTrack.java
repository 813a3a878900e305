package com.meshcall.client.media;

/**
 * 캡처 장치나 피어 연결이 제공하는 미디어 트랙 참조.
 */
public interface MediaTrack {

    String getId();

    TrackKind getKind();

    /**
     * 트랙을 중지하고 장치 자원을 반납한다. 여러 번 호출해도 안전해야 한다.
     */
    void stop();
}
