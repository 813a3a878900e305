package com.meshcall.protocol;

/**
 * 명시적인 퇴장 요청. 참가자 식별은 연결 자체로 한다.
 */
public class LeaveRoomMessage extends SignalMessage {

    @Override
    public MessageType getType() {
        return MessageType.LEAVE_ROOM;
    }
}
