package com.meshcall.protocol;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 새 참여자에게 보내는 기존 구성원 목록. 본인은 포함되지 않는다.
 */
public class ExistingParticipantsMessage extends SignalMessage {

    private List<ParticipantInfo> participants = new ArrayList<>();

    public ExistingParticipantsMessage() {
    }

    public ExistingParticipantsMessage(List<ParticipantInfo> participants) {
        setParticipants(participants);
    }

    @Override
    public MessageType getType() {
        return MessageType.EXISTING_PARTICIPANTS;
    }

    public List<ParticipantInfo> getParticipants() {
        return Collections.unmodifiableList(participants);
    }

    public void setParticipants(List<ParticipantInfo> participants) {
        this.participants = participants == null ? new ArrayList<>() : new ArrayList<>(participants);
    }
}
