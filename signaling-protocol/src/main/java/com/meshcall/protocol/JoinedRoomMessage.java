package com.meshcall.protocol;

/**
 * 참여 성공 응답. 참여자 본인에게만 전송된다.
 */
public class JoinedRoomMessage extends SignalMessage {

    private String roomId;
    private String participantId;
    private int participantCount;

    public JoinedRoomMessage() {
    }

    public JoinedRoomMessage(String roomId, String participantId, int participantCount) {
        this.roomId = roomId;
        this.participantId = participantId;
        this.participantCount = participantCount;
    }

    @Override
    public MessageType getType() {
        return MessageType.JOINED_ROOM;
    }

    public String getRoomId() {
        return roomId;
    }

    public void setRoomId(String roomId) {
        this.roomId = roomId;
    }

    public String getParticipantId() {
        return participantId;
    }

    public void setParticipantId(String participantId) {
        this.participantId = participantId;
    }

    public int getParticipantCount() {
        return participantCount;
    }

    public void setParticipantCount(int participantCount) {
        this.participantCount = participantCount;
    }
}
