package com.meshcall.protocol;

/**
 * 참가자가 떠났음을 남은 구성원에게 알린다. participantCount는 퇴장 이후의 인원 수다.
 */
public class ParticipantLeftMessage extends SignalMessage {

    private String participantId;
    private int participantCount;

    public ParticipantLeftMessage() {
    }

    public ParticipantLeftMessage(String participantId, int participantCount) {
        this.participantId = participantId;
        this.participantCount = participantCount;
    }

    @Override
    public MessageType getType() {
        return MessageType.PARTICIPANT_LEFT;
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
