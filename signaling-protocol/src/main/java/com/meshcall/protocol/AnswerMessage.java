package com.meshcall.protocol;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * offer에 대한 answer SDP.
 */
public class AnswerMessage extends RelayMessage {

    private JsonNode answer;

    public AnswerMessage() {
    }

    public AnswerMessage(String targetParticipantId, JsonNode answer) {
        super(targetParticipantId, null);
        this.answer = answer;
    }

    @Override
    public MessageType getType() {
        return MessageType.ANSWER;
    }

    public JsonNode getAnswer() {
        return answer;
    }

    public void setAnswer(JsonNode answer) {
        this.answer = answer;
    }

    @Override
    public JsonNode getPayload() {
        return answer;
    }

    @Override
    public AnswerMessage forwardFrom(String senderId) {
        AnswerMessage forwarded = new AnswerMessage();
        forwarded.setFromParticipantId(senderId);
        forwarded.setAnswer(answer);
        return forwarded;
    }
}
