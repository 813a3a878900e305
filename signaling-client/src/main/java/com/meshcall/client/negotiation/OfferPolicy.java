package com.meshcall.client.negotiation;

/**
 * 방에 새로 들어온 쪽과 기존 참가자 사이에서 offer 를 만들 쪽을 고르는 정책.
 */
public enum OfferPolicy {

    /**
     * 참가 순서와 상관없이 ID 가 작은 쪽이 offer 한다.
     */
    ID_ORDERED {
        @Override
        public boolean offersToExisting(String selfId, String peerId) {
            return OfferRoles.shouldOffer(selfId, peerId);
        }

        @Override
        public boolean offersToNewcomer(String selfId, String peerId) {
            return OfferRoles.shouldOffer(selfId, peerId);
        }
    },

    /**
     * 새로 들어온 쪽이 기존 참가자 모두에게 offer 하고, 기존 참가자는 기다린다.
     */
    JOINER_OFFERS {
        @Override
        public boolean offersToExisting(String selfId, String peerId) {
            return true;
        }

        @Override
        public boolean offersToNewcomer(String selfId, String peerId) {
            return false;
        }
    };

    /**
     * existing-participants 목록의 참가자에게 offer 할지 여부.
     */
    public abstract boolean offersToExisting(String selfId, String peerId);

    /**
     * participant-joined 로 알게 된 참가자에게 offer 할지 여부.
     */
    public abstract boolean offersToNewcomer(String selfId, String peerId);
}
