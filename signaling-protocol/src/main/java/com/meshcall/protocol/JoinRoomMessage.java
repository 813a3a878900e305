package com.meshcall.protocol;

import jakarta.validation.constraints.NotBlank;

/**
 * 클라이언트가 방에 참여할 때 보내는 요청.
 */
public class JoinRoomMessage extends SignalMessage {

    @NotBlank(message = "roomId is required")
    private String roomId;

    @NotBlank(message = "participantId is required")
    private String participantId;

    private String name;

    public JoinRoomMessage() {
    }

    public JoinRoomMessage(String roomId, String participantId, String name) {
        this.roomId = roomId;
        this.participantId = participantId;
        this.name = name;
    }

    @Override
    public MessageType getType() {
        return MessageType.JOIN_ROOM;
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

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }
}
