package com.meshcall.client.media;

import java.util.List;
import java.util.Objects;

/**
 * 상대 참가자로부터 수신한 미디어 소스.
 */
public class RemoteMedia {

    private final String streamId;
    private final List<MediaTrack> tracks;

    public RemoteMedia(String streamId, List<MediaTrack> tracks) {
        this.streamId = Objects.requireNonNull(streamId, "streamId must not be null");
        this.tracks = tracks == null ? List.of() : List.copyOf(tracks);
    }

    public String getStreamId() {
        return streamId;
    }

    public List<MediaTrack> getTracks() {
        return tracks;
    }

    @Override
    public String toString() {
        return "RemoteMedia[" + streamId + ", " + tracks.size() + " tracks]";
    }
}
