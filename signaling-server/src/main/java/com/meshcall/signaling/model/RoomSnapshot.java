package com.meshcall.signaling.model;

import com.meshcall.protocol.ParticipantInfo;
import java.time.Instant;
import java.util.List;

/**
 * 특정 시점의 방 상태를 복사해 둔 읽기 전용 뷰.
 */
public class RoomSnapshot {

    private final String id;
    private final Instant createdAt;
    private final Instant lastActivityAt;
    private final List<ParticipantInfo> participants;

    public RoomSnapshot(String id, Instant createdAt, Instant lastActivityAt, List<ParticipantInfo> participants) {
        this.id = id;
        this.createdAt = createdAt;
        this.lastActivityAt = lastActivityAt;
        this.participants = List.copyOf(participants);
    }

    public static RoomSnapshot of(Room room) {
        return new RoomSnapshot(room.getId(), room.getCreatedAt(), room.getLastActivityAt(),
                room.getParticipants().stream().map(Participant::toInfo).toList());
    }

    public String getId() {
        return id;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getLastActivityAt() {
        return lastActivityAt;
    }

    public List<ParticipantInfo> getParticipants() {
        return participants;
    }

    public int getParticipantCount() {
        return participants.size();
    }
}
