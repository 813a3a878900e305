package com.meshcall.client.negotiation;

import com.meshcall.client.media.RemoteMedia;
import com.meshcall.protocol.ParticipantInfo;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * 참가자 ID 별 원격 스트림 표. 참가자당 항목은 최대 하나다.
 * <p>
 * 미디어가 이름보다 먼저 도착할 수 있으므로 이름은 {@link #reconcile(Map)} 으로 나중에 붙인다.
 */
public class RemoteStreamTable {

    private final Map<String, RemoteStream> streams = new LinkedHashMap<>();

    /**
     * 새 항목을 만들거나 기존 항목의 미디어를 바꾼다. 이미 붙은 이름은 유지한다.
     */
    public synchronized RemoteStream upsert(String participantId, RemoteMedia media, String knownName) {
        RemoteStream existing = streams.get(participantId);
        RemoteStream updated;
        if (existing == null) {
            updated = new RemoteStream(participantId, media, knownName);
        } else {
            updated = existing.withMedia(media);
            if (knownName != null) {
                updated = updated.withName(knownName);
            }
        }
        streams.put(participantId, updated);
        return updated;
    }

    /**
     * 명단에 이름이 있는 참가자의 항목에 이름을 붙인다. 바뀐 항목이 있으면 true.
     */
    public synchronized boolean reconcile(Map<String, ParticipantInfo> roster) {
        boolean changed = false;
        for (Map.Entry<String, RemoteStream> entry : streams.entrySet()) {
            ParticipantInfo info = roster.get(entry.getKey());
            if (info == null || info.getName() == null) {
                continue;
            }
            RemoteStream stream = entry.getValue();
            if (!Objects.equals(stream.getName(), info.getName())) {
                entry.setValue(stream.withName(info.getName()));
                changed = true;
            }
        }
        return changed;
    }

    public synchronized boolean remove(String participantId) {
        return streams.remove(participantId) != null;
    }

    public synchronized Optional<RemoteStream> get(String participantId) {
        return Optional.ofNullable(streams.get(participantId));
    }

    public synchronized List<RemoteStream> snapshot() {
        return List.copyOf(new ArrayList<>(streams.values()));
    }

    public synchronized int size() {
        return streams.size();
    }

    public synchronized void clear() {
        streams.clear();
    }
}
