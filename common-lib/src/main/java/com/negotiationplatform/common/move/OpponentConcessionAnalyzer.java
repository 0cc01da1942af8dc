package com.negotiationplatform.common.move;

import com.negotiationplatform.common.model.ProposedTerms;

/**
 * Quantifies how far the opponent moved between its previous and current proposal.
 *
 * <pre>
 *   net        = |partyAGets| − |partyAGives|
 *   concession = max(0, (net_previous − net_current) / max(net_previous, 1))
 * </pre>
 *
 * <p>Proposals are oriented with the proposer as party A, so a shrinking net
 * position for party A is a concession. Missing proposals count as no movement.
 */
public final class OpponentConcessionAnalyzer {

    private OpponentConcessionAnalyzer() {}

    public static double magnitude(ProposedTerms current, ProposedTerms previous) {
        if (current == null || previous == null) return 0.0;

        int currentValue  = current.netPositionA();
        int previousValue = previous.netPositionA();

        double concession = previousValue - currentValue;
        return Math.max(0.0, concession / Math.max(previousValue, 1));
    }
}
