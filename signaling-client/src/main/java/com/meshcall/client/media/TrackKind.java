package com.meshcall.client.media;

public enum TrackKind {
    AUDIO,
    VIDEO
}
