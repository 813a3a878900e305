package com.meshcall.protocol;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * 연결 경로 후보(ICE candidate)를 상대 참가자에게 전달한다.
 */
public class IceCandidateMessage extends RelayMessage {

    private JsonNode candidate;

    public IceCandidateMessage() {
    }

    public IceCandidateMessage(String targetParticipantId, JsonNode candidate) {
        super(targetParticipantId, null);
        this.candidate = candidate;
    }

    @Override
    public MessageType getType() {
        return MessageType.ICE_CANDIDATE;
    }

    public JsonNode getCandidate() {
        return candidate;
    }

    public void setCandidate(JsonNode candidate) {
        this.candidate = candidate;
    }

    @Override
    public JsonNode getPayload() {
        return candidate;
    }

    @Override
    public IceCandidateMessage forwardFrom(String senderId) {
        IceCandidateMessage forwarded = new IceCandidateMessage();
        forwarded.setFromParticipantId(senderId);
        forwarded.setCandidate(candidate);
        return forwarded;
    }
}
