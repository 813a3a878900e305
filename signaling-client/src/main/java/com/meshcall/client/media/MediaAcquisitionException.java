package com.meshcall.client.media;

/**
 * 카메라/마이크 권한이 거부되었거나 장치를 사용할 수 없을 때 던진다.
 */
public class MediaAcquisitionException extends RuntimeException {

    public MediaAcquisitionException(String message) {
        super(message);
    }

    public MediaAcquisitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
