package com.meshcall.client.negotiation;

import com.meshcall.protocol.ParticipantInfo;
import java.util.List;

/**
 * 메시 구성 변화를 UI 에 전달하는 콜백. 전달되는 목록은 변경할 수 없는 스냅샷이다.
 */
public interface PeerSetListener {

    default void onJoined(String roomId, String participantId, int participantCount) {
    }

    default void onRosterChanged(List<ParticipantInfo> roster) {
    }

    default void onRemoteStreamsChanged(List<RemoteStream> streams) {
    }

    default void onPeerStateChanged(String participantId, NegotiationState state) {
    }

    /**
     * 사용자에게 보여 줄 한 줄짜리 오류 알림.
     */
    default void onError(String message) {
    }
}
