package com.meshcall.signaling.model;

import com.meshcall.protocol.ParticipantInfo;
import com.meshcall.signaling.websocket.ParticipantTransport;
import java.time.Instant;
import java.util.Objects;

/**
 * 하나의 연결(브라우저 탭)에 대응하는 참가자. 연결이 끊기면 이 레코드 단위로 정리한다.
 * transport는 이 참가자만 소유하며 다른 참가자와 공유하지 않는다.
 */
public class Participant {

    private final String id;
    private final String roomId;
    private final String name;
    private final Instant joinedAt;
    private final ParticipantTransport transport;

    public Participant(String id, String roomId, String name, Instant joinedAt, ParticipantTransport transport) {
        this.id = Objects.requireNonNull(id, "participant id must not be null");
        this.roomId = Objects.requireNonNull(roomId, "room id must not be null");
        this.name = name;
        this.joinedAt = joinedAt == null ? Instant.now() : joinedAt;
        this.transport = Objects.requireNonNull(transport, "transport must not be null");
    }

    public String getId() {
        return id;
    }

    public String getRoomId() {
        return roomId;
    }

    public String getName() {
        return name;
    }

    public Instant getJoinedAt() {
        return joinedAt;
    }

    public ParticipantTransport getTransport() {
        return transport;
    }

    public ParticipantInfo toInfo() {
        return new ParticipantInfo(id, name);
    }

    @Override
    public String toString() {
        return "Participant[" + id + "@" + roomId + ", transport=" + transport.getId() + "]";
    }
}
