package com.negotiationplatform.common.engine;

import com.negotiationplatform.common.batna.BatnaEstimator;
import com.negotiationplatform.common.concession.ConcessionDecider;
import com.negotiationplatform.common.concession.ConcessionPlanner;
import com.negotiationplatform.common.concession.ConcessionStepGenerator;
import com.negotiationplatform.common.model.Batna;
import com.negotiationplatform.common.model.ConcessionPlan;
import com.negotiationplatform.common.model.MoveDecision;
import com.negotiationplatform.common.model.PartyProfile;
import com.negotiationplatform.common.model.ProposedTerms;
import com.negotiationplatform.common.model.RelationshipDecision;
import com.negotiationplatform.common.model.Zopa;
import com.negotiationplatform.common.move.MoveSelector;
import com.negotiationplatform.common.move.ProposalScorer;
import com.negotiationplatform.common.relationship.RelationshipOptimizer;
import com.negotiationplatform.common.strategy.NegotiationStrategy;
import com.negotiationplatform.common.strategy.NegotiationStrategyAdvisor;
import com.negotiationplatform.common.zopa.ZopaCalculator;

/**
 * Single entry point used by the session orchestrator, once per round.
 *
 * <p>Data flows one way: profile → BATNA → ZOPA → concession plan → move selection, with
 * the relationship optimizer consulted whenever an offer is finalized.
 *
 * <p>The engine holds only its pluggable scorer and concession decider. It keeps no
 * session state and may be shared by any number of concurrent sessions.
 */
public class NegotiationEngine {

    private final MoveSelector moveSelector;

    public NegotiationEngine(ProposalScorer scorer, ConcessionDecider concessionDecider) {
        this.moveSelector = new MoveSelector(scorer, new ConcessionStepGenerator(concessionDecider));
    }

    public Batna estimateBatna(PartyProfile profile, PartyProfile counterparty) {
        return BatnaEstimator.estimate(profile, counterparty);
    }

    public Zopa computeZopa(PartyProfile partyA, PartyProfile partyB, ProposedTerms proposal) {
        return ZopaCalculator.compute(partyA, partyB, proposal);
    }

    public ConcessionPlan buildConcessionPlan(PartyProfile profile, PartyProfile counterparty,
                                              ProposedTerms initialProposal) {
        return ConcessionPlanner.build(profile, counterparty, initialProposal);
    }

    public MoveDecision selectMove(PartyProfile profile, PartyProfile counterparty,
                                   ProposedTerms currentProposal, ProposedTerms opponentLastProposal,
                                   ConcessionPlan plan, int round) {
        return moveSelector.select(profile, counterparty, currentProposal, opponentLastProposal, plan, round);
    }

    public RelationshipDecision optimizeForRelationship(PartyProfile profile, PartyProfile counterparty,
                                                        ProposedTerms offer, int priorAgreements) {
        return RelationshipOptimizer.optimize(profile, counterparty, offer, priorAgreements);
    }

    public NegotiationStrategy developStrategy(PartyProfile profile, PartyProfile counterparty, int round) {
        return NegotiationStrategyAdvisor.develop(profile, counterparty, round);
    }
}
