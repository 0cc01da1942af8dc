package com.negotiationplatform.common.zopa;

import com.negotiationplatform.common.model.Offering;
import com.negotiationplatform.common.model.PartyProfile;
import com.negotiationplatform.common.model.ProposedTerms;
import com.negotiationplatform.common.model.Zopa;

import java.util.List;
import java.util.Locale;

/**
 * Computes the Zone Of Possible Agreement between two parties.
 *
 * <h3>Algorithm</h3>
 * <ol>
 *   <li>lower bound = party A's minimum acceptable score (0.6 when unset)</li>
 *   <li>upper bound = min(0.9, mean capacity of party B's offerings + 0.2)</li>
 *   <li>exists = upper ≥ lower</li>
 *   <li>midpoint = (lower + upper) / 2, regardless of existence</li>
 *   <li>range = max(0, upper − lower)</li>
 * </ol>
 *
 * <h3>Recommendation</h3>
 * <pre>
 *   !exists       → no-overlap message
 *   range &lt; 0.2   → narrow zone
 *   otherwise     → good zone, aim for midpoint
 * </pre>
 *
 * <p>Pure and deterministic. The proposal is accepted for future proposal-aware
 * estimates and is not read today.
 */
public final class ZopaCalculator {

    static final double OFFERING_UPLIFT   = 0.2;
    static final double MAX_OFFERING_CAP  = 0.9;
    static final double NARROW_RANGE      = 0.2;

    private ZopaCalculator() {}

    public static Zopa compute(PartyProfile partyA, PartyProfile partyB, ProposedTerms proposal) {
        double lower = estimateMinimumAcceptable(partyA);
        double upper = estimateMaximumOffering(partyB);

        boolean exists   = upper >= lower;
        double  midpoint = (lower + upper) / 2.0;
        double  range    = Math.max(0.0, upper - lower);

        return new Zopa(exists, lower, upper, midpoint, range, recommend(exists, lower, upper, midpoint, range));
    }

    static double estimateMinimumAcceptable(PartyProfile party) {
        return party == null ? 0.6 : party.config().effectiveMinAcceptable();
    }

    static double estimateMaximumOffering(PartyProfile party) {
        List<Offering> offerings = party == null ? List.of() : party.offerings();
        double total = offerings.stream().mapToDouble(Offering::capacity).sum();
        double meanCapacity = total / Math.max(offerings.size(), 1);
        return Math.min(MAX_OFFERING_CAP, meanCapacity + OFFERING_UPLIFT);
    }

    private static String recommend(boolean exists, double lower, double upper,
                                     double midpoint, double range) {
        if (!exists) {
            return String.format(Locale.ROOT,
                "No ZOPA exists. Minimum acceptable (%.0f%%) exceeds maximum offering (%.0f%%). "
                    + "Consider expanding the pie or finding alternative value sources.",
                lower * 100, upper * 100);
        }
        if (range < NARROW_RANGE) {
            return String.format(Locale.ROOT,
                "Narrow ZOPA (%.0f%%). Negotiate carefully, small concessions can close gap.",
                range * 100);
        }
        return String.format(Locale.ROOT,
            "Good ZOPA exists (%.0f%% range). Aim for midpoint around %.0f%% satisfaction.",
            range * 100, midpoint * 100);
    }
}
