package com.meshcall.client.support;

import com.meshcall.client.media.CaptureDevice;
import com.meshcall.client.media.LocalMedia;
import com.meshcall.client.media.MediaAcquisitionException;
import com.meshcall.client.media.MediaConstraints;
import com.meshcall.client.media.TrackKind;
import java.util.ArrayList;
import java.util.List;

public class FakeCaptureDevice implements CaptureDevice {

    private final List<FakeTrack> issuedTracks = new ArrayList<>();
    private MediaAcquisitionException failure;
    private MediaConstraints lastConstraints;

    public void failWith(MediaAcquisitionException failure) {
        this.failure = failure;
    }

    @Override
    public synchronized LocalMedia acquire(MediaConstraints constraints) {
        lastConstraints = constraints;
        if (failure != null) {
            throw failure;
        }
        FakeTrack audio = new FakeTrack("audio-" + issuedTracks.size(), TrackKind.AUDIO);
        FakeTrack video = new FakeTrack("video-" + issuedTracks.size(), TrackKind.VIDEO);
        issuedTracks.add(audio);
        issuedTracks.add(video);
        return new LocalMedia(List.of(audio, video));
    }

    public synchronized List<FakeTrack> getIssuedTracks() {
        return List.copyOf(issuedTracks);
    }

    public MediaConstraints getLastConstraints() {
        return lastConstraints;
    }
}
