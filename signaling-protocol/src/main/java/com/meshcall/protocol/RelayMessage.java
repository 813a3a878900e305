package com.meshcall.protocol;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.NotBlank;

/**
 * 서버가 내용을 해석하지 않고 대상 참가자에게 중계하는 메시지(offer/answer/ice-candidate)의 공통 부분.
 *
 * <p>클라이언트가 보낼 때는 {@code targetParticipantId}를 채우고, 서버가 전달할 때는
 * {@code fromParticipantId}만 채워서 보낸다. 페이로드는 그대로 유지된다.
 */
public abstract class RelayMessage extends SignalMessage {

    @NotBlank(message = "targetParticipantId is required")
    private String targetParticipantId;

    private String fromParticipantId;

    protected RelayMessage() {
    }

    protected RelayMessage(String targetParticipantId, String fromParticipantId) {
        this.targetParticipantId = targetParticipantId;
        this.fromParticipantId = fromParticipantId;
    }

    public String getTargetParticipantId() {
        return targetParticipantId;
    }

    public void setTargetParticipantId(String targetParticipantId) {
        this.targetParticipantId = targetParticipantId;
    }

    public String getFromParticipantId() {
        return fromParticipantId;
    }

    public void setFromParticipantId(String fromParticipantId) {
        this.fromParticipantId = fromParticipantId;
    }

    /**
     * 중계 대상인 불투명 페이로드(SDP 또는 ICE 후보).
     */
    @JsonIgnore
    public abstract JsonNode getPayload();

    /**
     * 송신자 ID를 붙이고 대상 ID를 비운 전달용 사본을 만든다.
     */
    public abstract RelayMessage forwardFrom(String senderId);
}
