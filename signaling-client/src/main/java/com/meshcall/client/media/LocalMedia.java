package com.meshcall.client.media;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 캡처 장치에서 얻은 로컬 트랙 묶음. 모든 피어 연결에 같은 트랙을 붙인다.
 */
public class LocalMedia {

    private static final Logger log = LoggerFactory.getLogger(LocalMedia.class);

    private final List<MediaTrack> tracks;
    private final AtomicBoolean stopped = new AtomicBoolean();

    public LocalMedia(List<MediaTrack> tracks) {
        this.tracks = List.copyOf(tracks);
    }

    public List<MediaTrack> getTracks() {
        return tracks;
    }

    /**
     * 모든 트랙을 중지한다. 한 트랙의 실패가 나머지 트랙 해제를 막지 않는다.
     */
    public void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        for (MediaTrack track : tracks) {
            try {
                track.stop();
            } catch (RuntimeException ex) {
                log.warn("Failed to stop {} track {}", track.getKind(), track.getId(), ex);
            }
        }
    }

    public boolean isStopped() {
        return stopped.get();
    }
}
