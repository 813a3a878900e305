package com.meshcall.signaling.service;

import com.meshcall.protocol.ParticipantInfo;
import com.meshcall.signaling.model.Participant;
import java.util.List;

/**
 * join 처리 결과. 참가 시점에 이미 방에 있던 다른 구성원 목록을 담는다.
 */
public class JoinResult {

    private final Participant participant;
    private final List<ParticipantInfo> existingParticipants;
    private final int participantCount;
    private final boolean replacedExisting;

    public JoinResult(Participant participant, List<ParticipantInfo> existingParticipants, int participantCount,
            boolean replacedExisting) {
        this.participant = participant;
        this.existingParticipants = List.copyOf(existingParticipants);
        this.participantCount = participantCount;
        this.replacedExisting = replacedExisting;
    }

    public Participant getParticipant() {
        return participant;
    }

    public List<ParticipantInfo> getExistingParticipants() {
        return existingParticipants;
    }

    public int getParticipantCount() {
        return participantCount;
    }

    /**
     * 같은 ID의 참가자를 덮어썼는지 여부.
     */
    public boolean isReplacedExisting() {
        return replacedExisting;
    }
}
