package com.meshcall.signaling.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * application.yml의 signaling.rooms 설정 값을 바인딩하기 위한 POJO.
 */
@ConfigurationProperties(prefix = "signaling.rooms")
public class RoomRegistryProperties {

    /**
     * 참가자가 0명인 방이 이 시간 이상 활동이 없으면 정리 대상이 된다.
     */
    private Duration idleThreshold = Duration.ofMinutes(30);

    public Duration getIdleThreshold() {
        return idleThreshold;
    }

    public void setIdleThreshold(Duration idleThreshold) {
        if (idleThreshold == null || idleThreshold.isNegative()) {
            throw new IllegalArgumentException("signaling.rooms.idle-threshold must be a non-negative duration");
        }
        this.idleThreshold = idleThreshold;
    }
}
