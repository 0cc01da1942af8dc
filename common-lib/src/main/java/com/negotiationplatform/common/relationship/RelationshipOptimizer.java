package com.negotiationplatform.common.relationship;

import com.negotiationplatform.common.model.Offering;
import com.negotiationplatform.common.model.PartyProfile;
import com.negotiationplatform.common.model.ProposedTerms;
import com.negotiationplatform.common.model.RelationshipDecision;

import java.util.Locale;
import java.util.Optional;

/**
 * Weighs the long-term value of the relationship against the deal currently on the table.
 *
 * <pre>
 *   relationshipValue = min(1.0, 0.4 + min(priorAgreements × 0.15, 0.3))
 *   transactionValue  = clamp(|gets| × 0.15 − |gives| × 0.10 + 0.5, 0, 1)
 *   prioritize        = relationshipValue &gt; 1.5 × transactionValue
 * </pre>
 *
 * <p>When the relationship wins, the first offering with capacity &gt; 0.3 that party A
 * does not already give is added to party A's "gives" and party B's "gets".
 * Negative agreement counts are treated as zero. Pure and thread-safe.
 */
public final class RelationshipOptimizer {

    static final double BASE_RELATIONSHIP_VALUE  = 0.4;
    static final double PER_AGREEMENT_BONUS      = 0.15;
    static final double MAX_AGREEMENT_BONUS      = 0.3;
    static final double GET_WEIGHT              = 0.15;
    static final double GIVE_WEIGHT             = 0.10;
    static final double TRANSACTION_BASELINE    = 0.5;
    static final double PRIORITIZE_FACTOR       = 1.5;
    static final double MIN_ENRICHING_CAPACITY  = 0.3;

    private RelationshipOptimizer() {}

    public static RelationshipDecision optimize(PartyProfile profile, PartyProfile counterparty,
                                                ProposedTerms offer, int priorAgreements) {
        double relationshipValue = relationshipValue(priorAgreements);
        double transactionValue  = transactionValue(offer);
        boolean prioritize = relationshipValue > transactionValue * PRIORITIZE_FACTOR;

        if (!prioritize) {
            String reasoning = String.format(Locale.ROOT,
                "Transaction value (%.0f%%) is primary focus. Optimize for current deal terms.",
                transactionValue * 100);
            return new RelationshipDecision(false, relationshipValue, transactionValue, null, reasoning);
        }

        String reasoning = String.format(Locale.ROOT,
            "Long-term relationship value (%.0f%%) exceeds transaction value (%.0f%%). "
                + "Recommend prioritizing relationship with more generous terms.",
            relationshipValue * 100, transactionValue * 100);

        ProposedTerms adjusted = additionalOffering(profile, offer)
            .map(offering -> offer.withAdditionalOffering(offering.description()))
            .orElse(offer);

        return new RelationshipDecision(true, relationshipValue, transactionValue, adjusted, reasoning);
    }

    public static double relationshipValue(int priorAgreements) {
        double bonus = Math.min(Math.max(priorAgreements, 0) * PER_AGREEMENT_BONUS, MAX_AGREEMENT_BONUS);
        return Math.min(1.0, BASE_RELATIONSHIP_VALUE + bonus);
    }

    public static double transactionValue(ProposedTerms offer) {
        if (offer == null) return TRANSACTION_BASELINE;
        double getsValue  = offer.partyAGets().size() * GET_WEIGHT;
        double givesValue = offer.partyAGives().size() * GIVE_WEIGHT;
        return Math.max(0.0, Math.min(1.0, getsValue - givesValue + TRANSACTION_BASELINE));
    }

    private static Optional<Offering> additionalOffering(PartyProfile profile, ProposedTerms offer) {
        if (profile == null || offer == null) return Optional.empty();
        return profile.offerings().stream()
            .filter(o -> o.capacity() > MIN_ENRICHING_CAPACITY)
            .filter(o -> o.description() != null && !offer.partyAGives().contains(o.description()))
            .findFirst();
    }
}
