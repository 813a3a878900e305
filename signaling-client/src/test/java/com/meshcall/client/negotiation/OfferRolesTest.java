package com.meshcall.client.negotiation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class OfferRolesTest {

    @Test
    void lowerIdOffers() {
        assertThat(OfferRoles.shouldOffer("p1", "p2")).isTrue();
        assertThat(OfferRoles.shouldOffer("p2", "p1")).isFalse();
    }

    @Test
    void exactlyOneSideOffersForAnyPair() {
        String[][] pairs = {{"abc", "abd"}, {"0zz", "a00"}, {"user10", "user9"}, {"k3j9x0aa", "k3j9x0a"}};
        for (String[] pair : pairs) {
            assertThat(OfferRoles.shouldOffer(pair[0], pair[1]))
                    .as("%s vs %s", pair[0], pair[1])
                    .isNotEqualTo(OfferRoles.shouldOffer(pair[1], pair[0]));
        }
    }

    @Test
    void comparisonIsLexicographicNotNumeric() {
        assertThat(OfferRoles.shouldOffer("user10", "user9")).isTrue();
    }

    @Test
    void rejectsNegotiationWithSelf() {
        assertThatThrownBy(() -> OfferRoles.shouldOffer("p1", "p1"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void joinerOffersPolicyLeavesExistingMembersWaiting() {
        assertThat(OfferPolicy.JOINER_OFFERS.offersToExisting("zz", "aa")).isTrue();
        assertThat(OfferPolicy.JOINER_OFFERS.offersToNewcomer("aa", "zz")).isFalse();
    }

    @Test
    void idOrderedPolicyAppliesSameRuleInBothDirections() {
        assertThat(OfferPolicy.ID_ORDERED.offersToExisting("p2", "p1")).isFalse();
        assertThat(OfferPolicy.ID_ORDERED.offersToNewcomer("p1", "p2")).isTrue();
    }
}
