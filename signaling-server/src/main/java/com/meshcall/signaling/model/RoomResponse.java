package com.meshcall.signaling.model;

import com.meshcall.protocol.ParticipantInfo;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 방 조회 API 응답에 사용되는 DTO.
 */
public class RoomResponse {

    private String id;
    private Instant createdAt;
    private Instant lastActivityAt;
    private int participantCount;
    private List<ParticipantInfo> participants = new ArrayList<>();

    public static RoomResponse from(RoomSnapshot snapshot) {
        RoomResponse response = new RoomResponse();
        response.setId(snapshot.getId());
        response.setCreatedAt(snapshot.getCreatedAt());
        response.setLastActivityAt(snapshot.getLastActivityAt());
        response.setParticipantCount(snapshot.getParticipantCount());
        response.setParticipants(snapshot.getParticipants());
        return response;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getLastActivityAt() {
        return lastActivityAt;
    }

    public void setLastActivityAt(Instant lastActivityAt) {
        this.lastActivityAt = lastActivityAt;
    }

    public int getParticipantCount() {
        return participantCount;
    }

    public void setParticipantCount(int participantCount) {
        this.participantCount = participantCount;
    }

    public List<ParticipantInfo> getParticipants() {
        return Collections.unmodifiableList(participants);
    }

    public void setParticipants(List<ParticipantInfo> participants) {
        this.participants = participants == null ? new ArrayList<>() : new ArrayList<>(participants);
    }
}
