package com.negotiationplatform.common.move;

import com.negotiationplatform.common.concession.ConcessionStepGenerator;
import com.negotiationplatform.common.model.ConcessionPlan;
import com.negotiationplatform.common.model.MoveAction;
import com.negotiationplatform.common.model.MoveDecision;
import com.negotiationplatform.common.model.PartyProfile;
import com.negotiationplatform.common.model.ProposedTerms;
import com.negotiationplatform.common.model.Zopa;
import com.negotiationplatform.common.zopa.ZopaCalculator;

/**
 * Per-round tactical state machine. Every call receives the whole round context, so a
 * decision can be re-derived from recorded history at any time.
 *
 * <h3>Rules (per strategy, first match wins)</h3>
 * <pre>
 *   tit-for-tat  opponent conceded &gt; 0.10            → make_concession (plan rate)
 *                opponent conceded &lt; 0.05, round &gt; 3 → hold_firm
 *   firm         ZOPA exists, score ≥ own minimum     → accept
 *                round &gt; 8                          → counter with final position
 *                otherwise                          → hold_firm
 *   gradual      even round                         → make_concession (plan rate)
 *                odd round                          → hold_firm
 *   flexible     ZOPA exists                        → make_concession (1.5 × plan rate)
 *   default                                         → counter (plan rate)
 * </pre>
 *
 * <p>Stateless and thread-safe given a thread-safe scorer and step generator. Rounds
 * must be supplied in increasing order by the caller; the selector does not check.
 */
public class MoveSelector {

    static final double RECIPROCATE_THRESHOLD   = 0.10;
    static final double STALL_THRESHOLD         = 0.05;
    static final int    STALL_ROUND_AFTER       = 3;
    static final int    FINAL_OFFER_ROUND_AFTER = 8;
    static final double FLEXIBLE_RATE_FACTOR    = 1.5;

    private final ProposalScorer scorer;
    private final ConcessionStepGenerator stepGenerator;

    public MoveSelector(ProposalScorer scorer, ConcessionStepGenerator stepGenerator) {
        this.scorer = scorer;
        this.stepGenerator = stepGenerator;
    }

    /**
     * @param own                  acting party (party A in the proposals)
     * @param counterparty         the other side
     * @param currentProposal      proposal on the table this round
     * @param opponentLastProposal opponent's previous proposal ({@code null} in the opening round)
     * @param plan                 acting party's concession plan
     * @param round                1-based round number
     * @return a fresh {@link MoveDecision}; never {@code null}
     */
    public MoveDecision select(PartyProfile own, PartyProfile counterparty,
                               ProposedTerms currentProposal, ProposedTerms opponentLastProposal,
                               ConcessionPlan plan, int round) {

        double opponentConceded = OpponentConcessionAnalyzer.magnitude(currentProposal, opponentLastProposal);
        Zopa zopa = ZopaCalculator.compute(own, counterparty, currentProposal);

        switch (plan.strategy()) {
            case TIT_FOR_TAT -> {
                if (opponentConceded > RECIPROCATE_THRESHOLD) {
                    return MoveDecision.withOffer(MoveAction.MAKE_CONCESSION,
                        "Tit-for-tat: Reciprocating their concession to build trust",
                        concede(currentProposal, plan, plan.concessionRate(), round));
                }
                if (opponentConceded < STALL_THRESHOLD && round > STALL_ROUND_AFTER) {
                    return MoveDecision.of(MoveAction.HOLD_FIRM,
                        "Tit-for-tat: They haven't conceded, maintaining our position");
                }
            }
            case FIRM -> {
                if (zopa.exists() && evaluate(own, currentProposal) >= own.config().effectiveMinAcceptable()) {
                    return MoveDecision.of(MoveAction.ACCEPT, "Within ZOPA and meets minimum threshold");
                }
                if (round > FINAL_OFFER_ROUND_AFTER) {
                    return MoveDecision.withOffer(MoveAction.COUNTER,
                        "Final position - take it or leave it", plan.finalPosition());
                }
                return MoveDecision.of(MoveAction.HOLD_FIRM, "Maintaining firm position to signal strength");
            }
            case GRADUAL -> {
                if (round % 2 == 0) {
                    return MoveDecision.withOffer(MoveAction.MAKE_CONCESSION,
                        "Gradual concession to show flexibility while maintaining value",
                        concede(currentProposal, plan, plan.concessionRate(), round));
                }
                return MoveDecision.of(MoveAction.HOLD_FIRM, "Maintaining position this round");
            }
            case FLEXIBLE -> {
                if (zopa.exists()) {
                    return MoveDecision.withOffer(MoveAction.MAKE_CONCESSION,
                        "Flexible approach - moving toward midpoint",
                        concede(currentProposal, plan, plan.concessionRate() * FLEXIBLE_RATE_FACTOR, round));
                }
            }
        }

        return MoveDecision.withOffer(MoveAction.COUNTER, "Standard negotiation move",
            concede(currentProposal, plan, plan.concessionRate(), round));
    }

    /** Proposal score from the pluggable scorer, clamped to [0.0, 1.0]. */
    double evaluate(PartyProfile own, ProposedTerms proposal) {
        return Math.max(0.0, Math.min(1.0, scorer.score(own, proposal)));
    }

    private ProposedTerms concede(ProposedTerms current, ConcessionPlan plan, double rate, int round) {
        return stepGenerator.step(current, rate, plan.redLines(), round);
    }
}
