package com.meshcall.client.negotiation;

import java.util.Objects;

/**
 * 두 참가자 중 누가 offer 를 만들지 정하는 규칙.
 */
public final class OfferRoles {

    private OfferRoles() {
    }

    /**
     * ID 를 사전순으로 비교해 작은 쪽이 offer 를 만든다. 양쪽이 같은 규칙을 적용하므로
     * 한 쌍에 대해 정확히 한 쪽만 true 를 얻는다.
     */
    public static boolean shouldOffer(String selfId, String peerId) {
        Objects.requireNonNull(selfId, "selfId must not be null");
        Objects.requireNonNull(peerId, "peerId must not be null");
        if (selfId.equals(peerId)) {
            throw new IllegalArgumentException("Cannot negotiate with self: " + selfId);
        }
        return selfId.compareTo(peerId) < 0;
    }
}
