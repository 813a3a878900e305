package com.meshcall.client.negotiation;

import java.time.Duration;

/**
 * offer 응답 대기 시간과 재시도 횟수.
 * offerTimeout 이 0 이면 타임아웃을 적용하지 않는다.
 */
public class NegotiationPolicy {

    private final Duration offerTimeout;
    private final int maxOfferAttempts;

    public NegotiationPolicy(Duration offerTimeout, int maxOfferAttempts) {
        if (offerTimeout == null || offerTimeout.isNegative()) {
            throw new IllegalArgumentException("offerTimeout must not be negative");
        }
        if (maxOfferAttempts < 1) {
            throw new IllegalArgumentException("maxOfferAttempts must be at least 1");
        }
        this.offerTimeout = offerTimeout;
        this.maxOfferAttempts = maxOfferAttempts;
    }

    public static NegotiationPolicy defaults() {
        return new NegotiationPolicy(Duration.ofSeconds(15), 3);
    }

    public static NegotiationPolicy withoutTimeout() {
        return new NegotiationPolicy(Duration.ZERO, 1);
    }

    public Duration getOfferTimeout() {
        return offerTimeout;
    }

    public int getMaxOfferAttempts() {
        return maxOfferAttempts;
    }

    public boolean hasOfferTimeout() {
        return !offerTimeout.isZero();
    }
}
