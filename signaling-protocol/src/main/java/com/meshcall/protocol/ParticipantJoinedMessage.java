package com.meshcall.protocol;

/**
 * 다른 참가자가 방에 들어왔음을 기존 구성원에게 알린다.
 */
public class ParticipantJoinedMessage extends SignalMessage {

    private String participantId;
    private String name;
    private int participantCount;

    public ParticipantJoinedMessage() {
    }

    public ParticipantJoinedMessage(String participantId, String name, int participantCount) {
        this.participantId = participantId;
        this.name = name;
        this.participantCount = participantCount;
    }

    @Override
    public MessageType getType() {
        return MessageType.PARTICIPANT_JOINED;
    }

    public String getParticipantId() {
        return participantId;
    }

    public void setParticipantId(String participantId) {
        this.participantId = participantId;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public int getParticipantCount() {
        return participantCount;
    }

    public void setParticipantCount(int participantCount) {
        this.participantCount = participantCount;
    }
}
