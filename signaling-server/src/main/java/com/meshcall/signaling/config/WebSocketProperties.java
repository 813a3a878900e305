package com.meshcall.signaling.config;

import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * signaling.websocket 설정. 엔드포인트 경로와 세션별 송신 버퍼 한도를 담는다.
 */
@ConfigurationProperties(prefix = "signaling.websocket")
public class WebSocketProperties {

    private String path = "/ws";
    private List<String> allowedOriginPatterns = new ArrayList<>(List.of("*"));
    private int sendTimeLimitMillis = 10_000;
    private int sendBufferSizeLimit = 512 * 1024;

    public String getPath() {
        return path;
    }

    public void setPath(String path) {
        this.path = path;
    }

    public List<String> getAllowedOriginPatterns() {
        return allowedOriginPatterns;
    }

    public void setAllowedOriginPatterns(List<String> allowedOriginPatterns) {
        this.allowedOriginPatterns = allowedOriginPatterns == null ? new ArrayList<>() : new ArrayList<>(allowedOriginPatterns);
    }

    public int getSendTimeLimitMillis() {
        return sendTimeLimitMillis;
    }

    public void setSendTimeLimitMillis(int sendTimeLimitMillis) {
        this.sendTimeLimitMillis = sendTimeLimitMillis;
    }

    public int getSendBufferSizeLimit() {
        return sendBufferSizeLimit;
    }

    public void setSendBufferSizeLimit(int sendBufferSizeLimit) {
        this.sendBufferSizeLimit = sendBufferSizeLimit;
    }
}
