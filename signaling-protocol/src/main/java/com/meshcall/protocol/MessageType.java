package com.meshcall.protocol;

/**
 * 시그널링 메시지의 종류. 와이어 상의 {@code type} 값과 1:1로 대응한다.
 */
public enum MessageType {
    JOIN_ROOM("join-room"),
    JOINED_ROOM("joined-room"),
    EXISTING_PARTICIPANTS("existing-participants"),
    PARTICIPANT_JOINED("participant-joined"),
    PARTICIPANT_LEFT("participant-left"),
    OFFER("offer"),
    ANSWER("answer"),
    ICE_CANDIDATE("ice-candidate"),
    LEAVE_ROOM("leave-room"),
    ERROR("error");

    private final String value;

    MessageType(String value) {
        this.value = value;
    }

    public String toValue() {
        return value;
    }
}
