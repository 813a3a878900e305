package com.meshcall.client.negotiation;

import com.meshcall.client.media.RemoteMedia;
import java.util.Objects;

/**
 * 화면에 표시할 원격 참가자 스트림. 이름은 아직 모르면 null 이다.
 */
public class RemoteStream {

    private final String participantId;
    private final RemoteMedia media;
    private final String name;

    public RemoteStream(String participantId, RemoteMedia media, String name) {
        this.participantId = Objects.requireNonNull(participantId, "participantId must not be null");
        this.media = Objects.requireNonNull(media, "media must not be null");
        this.name = name;
    }

    public String getParticipantId() {
        return participantId;
    }

    public RemoteMedia getMedia() {
        return media;
    }

    public String getName() {
        return name;
    }

    RemoteStream withMedia(RemoteMedia replacement) {
        return new RemoteStream(participantId, replacement, name);
    }

    RemoteStream withName(String newName) {
        return new RemoteStream(participantId, media, newName);
    }

    @Override
    public String toString() {
        return "RemoteStream[" + participantId + ", " + name + "]";
    }
}
