package com.meshcall.client;

import com.meshcall.client.negotiation.PeerSetListener;

/**
 * 통화 상태 변화를 받는 UI 측 콜백.
 */
public interface CallListener extends PeerSetListener {

    /**
     * 사용자가 통화를 끊었거나 서버 연결이 닫혀 자원 정리가 끝났을 때 호출된다.
     */
    default void onCallEnded(String reason) {
    }
}
