package com.meshcall.client.media;

/**
 * 로컬 음성/영상 소스를 제공하는 플랫폼 장치.
 */
public interface CaptureDevice {

    /**
     * 장치를 열고 로컬 트랙을 얻는다. 통화 시작 시 한 번 호출된다.
     *
     * @throws MediaAcquisitionException 권한 거부 또는 장치 없음
     */
    LocalMedia acquire(MediaConstraints constraints);
}
