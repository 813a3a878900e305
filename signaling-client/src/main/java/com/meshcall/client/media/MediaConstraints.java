package com.meshcall.client.media;

/**
 * 캡처 장치에 요청할 미디어 조건. 기본값은 640x480 영상과 음성이다.
 */
public class MediaConstraints {

    private boolean audio = true;
    private boolean video = true;
    private int width = 640;
    private int height = 480;

    public static MediaConstraints defaults() {
        return new MediaConstraints();
    }

    public boolean isAudio() {
        return audio;
    }

    public void setAudio(boolean audio) {
        this.audio = audio;
    }

    public boolean isVideo() {
        return video;
    }

    public void setVideo(boolean video) {
        this.video = video;
    }

    public int getWidth() {
        return width;
    }

    public void setWidth(int width) {
        this.width = width;
    }

    public int getHeight() {
        return height;
    }

    public void setHeight(int height) {
        this.height = height;
    }
}
