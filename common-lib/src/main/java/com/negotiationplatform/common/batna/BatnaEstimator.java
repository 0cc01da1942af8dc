package com.negotiationplatform.common.batna;

import com.negotiationplatform.common.model.Batna;
import com.negotiationplatform.common.model.PartyProfile;

/**
 * Estimates a party's walk-away option from the breadth of what it can offer elsewhere.
 *
 * <p><b>Availability step function</b>:
 * <pre>
 *   offerings &gt; 3  → 0.7   (ceiling; untested alternatives are never certain)
 *   otherwise       → 0.4
 * </pre>
 * Value equals availability in this model. Both stay in [0.0, 1.0].
 *
 * <p>Stateless, pure and thread-safe. Never throws; a {@code null} or sparse profile
 * yields the moderate default.
 */
public final class BatnaEstimator {

    static final int    RICH_OFFERING_COUNT   = 3;
    static final double HIGH_AVAILABILITY     = 0.7;
    static final double DEFAULT_AVAILABILITY  = 0.4;
    static final double GOOD_ALTERNATIVE_MARK = 0.6;

    static final String ALTERNATIVE = "Pursue other partnership opportunities";

    private BatnaEstimator() {}

    /**
     * @param profile      the party whose fallback is estimated
     * @param counterparty the other side; reserved for richer models, may be {@code null}
     * @return a fresh {@link Batna}; never {@code null}
     */
    public static Batna estimate(PartyProfile profile, PartyProfile counterparty) {
        int offeringCount = profile == null ? 0 : profile.offerings().size();
        long criticalNeeds = profile == null ? 0 : profile.criticalNeedCount();

        double availability = offeringCount > RICH_OFFERING_COUNT ? HIGH_AVAILABILITY : DEFAULT_AVAILABILITY;

        String description = String.format(
            "Agent has %d offerings and %d critical needs, suggesting %s alternatives exist",
            offeringCount, criticalNeeds, availability > GOOD_ALTERNATIVE_MARK ? "good" : "moderate");

        return new Batna(ALTERNATIVE, availability, availability, description);
    }
}
