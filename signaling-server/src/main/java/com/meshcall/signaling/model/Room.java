package com.meshcall.signaling.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 참가자들이 서로 메시 연결을 맺는 방.
 *
 * <p>이 클래스는 스스로 동기화하지 않는다. 변경과 조회는 RoomRegistry가 방 객체의
 * 모니터를 잡은 상태에서 수행한다.
 */
public class Room {

    private final String id;
    private final Instant createdAt;
    private final Map<String, Participant> participants = new LinkedHashMap<>();
    private Instant lastActivityAt;
    private boolean retired;

    public Room(String id, Instant createdAt) {
        this.id = Objects.requireNonNull(id, "room id must not be null");
        this.createdAt = createdAt == null ? Instant.now() : createdAt;
        this.lastActivityAt = this.createdAt;
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

    /**
     * 참가자를 추가한다. 같은 ID가 이미 있으면 교체하고 이전 참가자를 반환한다.
     */
    public Participant putParticipant(Participant participant, Instant now) {
        lastActivityAt = now;
        return participants.put(participant.getId(), participant);
    }

    /**
     * 방에 등록된 참가자가 정확히 이 객체일 때만 제거한다.
     * 같은 ID로 교체된 새 참가자를 이전 연결이 지우지 못하게 한다.
     */
    public boolean removeParticipant(Participant participant, Instant now) {
        boolean removed = participants.remove(participant.getId(), participant);
        if (removed) {
            lastActivityAt = now;
        }
        return removed;
    }

    public Participant getParticipant(String participantId) {
        return participants.get(participantId);
    }

    /**
     * 입장 순서대로 참가자 목록을 복사해 반환한다.
     */
    public List<Participant> getParticipants() {
        return new ArrayList<>(participants.values());
    }

    public List<Participant> getParticipantsExcept(String participantId) {
        List<Participant> others = new ArrayList<>(participants.size());
        for (Participant participant : participants.values()) {
            if (!participant.getId().equals(participantId)) {
                others.add(participant);
            }
        }
        return others;
    }

    public int size() {
        return participants.size();
    }

    public boolean isEmpty() {
        return participants.isEmpty();
    }

    public boolean isIdleSince(Instant cutoff) {
        return isEmpty() && lastActivityAt.isBefore(cutoff);
    }

    /**
     * 정리 작업으로 레지스트리에서 빠진 방은 더 이상 참가를 받지 않는다.
     */
    public void retire() {
        this.retired = true;
    }

    public boolean isRetired() {
        return retired;
    }
}
