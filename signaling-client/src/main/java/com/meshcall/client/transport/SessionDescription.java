package com.meshcall.client.transport;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * offer/answer 세션 기술. 시그널링 메시지 안에 {type, sdp} 형태로 실린다.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class SessionDescription {

    public static final String OFFER = "offer";
    public static final String ANSWER = "answer";

    private String type;
    private String sdp;

    public SessionDescription() {
    }

    public SessionDescription(String type, String sdp) {
        this.type = type;
        this.sdp = sdp;
    }

    public static SessionDescription offer(String sdp) {
        return new SessionDescription(OFFER, sdp);
    }

    public static SessionDescription answer(String sdp) {
        return new SessionDescription(ANSWER, sdp);
    }

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    public String getSdp() {
        return sdp;
    }

    public void setSdp(String sdp) {
        this.sdp = sdp;
    }

    @Override
    public String toString() {
        return "SessionDescription[" + type + "]";
    }
}
