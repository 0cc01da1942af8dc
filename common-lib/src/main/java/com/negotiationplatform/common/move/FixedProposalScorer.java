package com.negotiationplatform.common.move;

import com.negotiationplatform.common.model.PartyProfile;
import com.negotiationplatform.common.model.ProposedTerms;

/** {@link ProposalScorer} that returns the same score for every proposal. */
public final class FixedProposalScorer implements ProposalScorer {

    public static final double DEFAULT_SCORE = 0.65;

    private final double fixedScore;

    public FixedProposalScorer() {
        this(DEFAULT_SCORE);
    }

    public FixedProposalScorer(double fixedScore) {
        this.fixedScore = fixedScore;
    }

    @Override
    public double score(PartyProfile own, ProposedTerms proposal) {
        return fixedScore;
    }
}
