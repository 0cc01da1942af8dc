package com.negotiationplatform.common.move;

import com.negotiationplatform.common.model.PartyProfile;
import com.negotiationplatform.common.model.ProposedTerms;

/**
 * Scores how acceptable a proposal is to its own party.
 *
 * <p>Implementations must be stateless and return a value in [0.0, 1.0]; the move
 * selector clamps anything outside that range. Register a richer model as a Spring
 * {@code @Bean} in the service configuration to replace {@link FixedProposalScorer}
 * without touching the move selector.
 */
@FunctionalInterface
public interface ProposalScorer {

    double score(PartyProfile own, ProposedTerms proposal);
}
