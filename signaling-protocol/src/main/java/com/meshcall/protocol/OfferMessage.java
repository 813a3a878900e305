package com.meshcall.protocol;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * 세션 협상을 시작하는 offer SDP를 상대 참가자에게 전달한다.
 */
public class OfferMessage extends RelayMessage {

    private JsonNode offer;

    public OfferMessage() {
    }

    public OfferMessage(String targetParticipantId, JsonNode offer) {
        super(targetParticipantId, null);
        this.offer = offer;
    }

    @Override
    public MessageType getType() {
        return MessageType.OFFER;
    }

    public JsonNode getOffer() {
        return offer;
    }

    public void setOffer(JsonNode offer) {
        this.offer = offer;
    }

    @Override
    public JsonNode getPayload() {
        return offer;
    }

    @Override
    public OfferMessage forwardFrom(String senderId) {
        OfferMessage forwarded = new OfferMessage();
        forwarded.setFromParticipantId(senderId);
        forwarded.setOffer(offer);
        return forwarded;
    }
}
