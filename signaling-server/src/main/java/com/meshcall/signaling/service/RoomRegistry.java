package com.meshcall.signaling.service;

import com.meshcall.protocol.ExistingParticipantsMessage;
import com.meshcall.protocol.JoinedRoomMessage;
import com.meshcall.protocol.ParticipantInfo;
import com.meshcall.protocol.ParticipantJoinedMessage;
import com.meshcall.protocol.ParticipantLeftMessage;
import com.meshcall.protocol.RelayMessage;
import com.meshcall.protocol.SignalMessage;
import com.meshcall.signaling.config.RoomRegistryProperties;
import com.meshcall.signaling.model.Participant;
import com.meshcall.signaling.model.Room;
import com.meshcall.signaling.model.RoomSnapshot;
import com.meshcall.signaling.websocket.ParticipantTransport;
import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * 방과 참가자 목록을 인메모리로 관리하고, 구성원 변경 알림과 1:1 중계를 수행한다.
 *
 * <p>방 목록은 {@link ConcurrentHashMap}으로 관리한다. 각 방의 구성원 변경과 그에 따른 알림 전송은
 * 해당 방 객체의 모니터 안에서 함께 처리하므로, 한 수신자는 구성원이 바뀐 순서대로 메시지를 받는다.
 * 전송은 {@code ConcurrentWebSocketSessionDecorator} 버퍼에 쌓이므로 모니터를 오래 잡지 않는다.
 */
@Service
public class RoomRegistry {

    private static final Logger log = LoggerFactory.getLogger(RoomRegistry.class);

    private final Clock clock;
    private final RoomRegistryProperties properties;

    private final Map<String, Room> rooms = new ConcurrentHashMap<>(); // 방 ID -> 방
    private final Map<String, Participant> participantsByTransport = new ConcurrentHashMap<>(); // 연결 ID -> 참가자

    public RoomRegistry(Clock clock, RoomRegistryProperties properties) {
        this.clock = clock;
        this.properties = properties;
    }

    /**
     * 참가자를 방에 등록한다. 방이 없으면 만든다.
     *
     * <p>참여자 본인에게는 joined-room과 existing-participants를, 기존 구성원에게는
     * participant-joined를 보낸다. 같은 방에 같은 ID가 이미 있으면 새 연결로 교체한다.
     */
    public JoinResult join(String roomId, String participantId, String name, ParticipantTransport transport) {
        Objects.requireNonNull(roomId, "roomId must not be null");
        Objects.requireNonNull(participantId, "participantId must not be null");
        Objects.requireNonNull(transport, "transport must not be null");

        // 같은 연결로 다시 join하면 이전 방에서 먼저 내보낸다.
        if (participantsByTransport.containsKey(transport.getId())) {
            log.debug("Transport {} re-joined, leaving previous room first", transport.getId());
            leave(transport);
        }

        Instant now = clock.instant();
        Participant participant = new Participant(participantId, roomId, name, now, transport);
        while (true) {
            Room room = rooms.computeIfAbsent(roomId, id -> {
                log.info("Room {} created", id);
                return new Room(id, now);
            });

            Participant replaced;
            List<ParticipantInfo> existing;
            int count;
            synchronized (room) {
                if (room.isRetired()) {
                    // 정리 작업이 방금 제거한 방이다. 새 방으로 다시 시도한다.
                    continue;
                }
                replaced = room.putParticipant(participant, now);
                List<Participant> others = room.getParticipantsExcept(participantId);
                count = room.size();
                participantsByTransport.put(transport.getId(), participant);
                if (replaced != null && !replaced.getTransport().getId().equals(transport.getId())) {
                    participantsByTransport.remove(replaced.getTransport().getId(), replaced);
                }

                existing = others.stream().map(Participant::toInfo).toList();
                transport.send(new JoinedRoomMessage(roomId, participantId, count));
                transport.send(new ExistingParticipantsMessage(existing));
                broadcast(others, new ParticipantJoinedMessage(participantId, name, count));
            }

            if (replaced != null) {
                log.warn("Participant {} in room {} replaced by a new connection (old transport {})",
                        participantId, roomId, replaced.getTransport().getId());
            }

            log.info("Participant {} joined room {} ({} participants)", participantId, roomId, count);
            return new JoinResult(participant, existing, count, replaced != null);
        }
    }

    /**
     * 연결에 묶인 참가자를 방에서 제거하고 남은 구성원에게 participant-left를 보낸다.
     * join 전에 끊긴 연결처럼 묶인 참가자가 없으면 아무것도 하지 않는다.
     */
    public Optional<Participant> leave(ParticipantTransport transport) {
        Participant participant = participantsByTransport.remove(transport.getId());
        if (participant == null) {
            return Optional.empty();
        }
        Room room = rooms.get(participant.getRoomId());
        if (room == null) {
            return Optional.of(participant);
        }

        int count;
        synchronized (room) {
            if (!room.removeParticipant(participant, clock.instant())) {
                // 같은 ID의 새 연결로 이미 교체되었다.
                log.debug("Stale participant {} ignored on leave", participant);
                return Optional.of(participant);
            }
            count = room.size();
            broadcast(room.getParticipants(), new ParticipantLeftMessage(participant.getId(), count));
        }

        log.info("Participant {} left room {} ({} participants)", participant.getId(), room.getId(), count);
        return Optional.of(participant);
    }

    /**
     * 송신자와 같은 방에 있는 대상에게 메시지를 그대로 전달한다. 페이로드는 해석하지 않는다.
     *
     * @throws RelayException 송신자, 방, 대상 중 하나를 찾지 못한 경우
     */
    public void relay(ParticipantTransport from, RelayMessage message) {
        Participant sender = participantsByTransport.get(from.getId());
        if (sender == null) {
            throw new RelayException("Participant not found");
        }
        Room room = rooms.get(sender.getRoomId());
        if (room == null) {
            throw new RelayException("Room not found");
        }
        synchronized (room) {
            Participant target = room.getParticipant(message.getTargetParticipantId());
            if (target == null) {
                throw new RelayException("Target participant not found");
            }
            log.debug("Relaying {} from {} to {} in room {}", message.getType().toValue(), sender.getId(),
                    target.getId(), room.getId());
            target.getTransport().send(message.forwardFrom(sender.getId()));
        }
    }

    /**
     * 참가자가 없고 유휴 기준 시간이 지난 방을 제거한다. 참가자가 있는 방은 제거하지 않는다.
     *
     * @return 제거한 방의 수
     */
    public int sweep() {
        Instant cutoff = clock.instant().minus(properties.getIdleThreshold());
        int removed = 0;
        for (Room room : rooms.values()) {
            synchronized (room) {
                if (!room.isIdleSince(cutoff)) {
                    continue;
                }
                room.retire();
                rooms.remove(room.getId(), room);
            }
            removed++;
            log.info("Removing inactive room {} (idle since {})", room.getId(), room.getLastActivityAt());
        }
        return removed;
    }

    public List<RoomSnapshot> listRooms() {
        return rooms.values().stream()
                .map(this::snapshot)
                .sorted(Comparator.comparing(RoomSnapshot::getCreatedAt).thenComparing(RoomSnapshot::getId))
                .toList();
    }

    public Optional<RoomSnapshot> findRoom(String roomId) {
        return Optional.ofNullable(rooms.get(roomId)).map(this::snapshot);
    }

    public Optional<Participant> findParticipant(ParticipantTransport transport) {
        return Optional.ofNullable(participantsByTransport.get(transport.getId()));
    }

    private RoomSnapshot snapshot(Room room) {
        synchronized (room) {
            return RoomSnapshot.of(room);
        }
    }

    private void broadcast(List<Participant> recipients, SignalMessage message) {
        for (Participant recipient : recipients) {
            recipient.getTransport().send(message);
        }
    }
}
