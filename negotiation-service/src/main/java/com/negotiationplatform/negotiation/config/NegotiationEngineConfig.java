package com.negotiationplatform.negotiation.config;

import com.negotiationplatform.common.concession.ConcessionDecider;
import com.negotiationplatform.common.concession.RoundSeededConcessionDecider;
import com.negotiationplatform.common.concession.ThresholdConcessionDecider;
import com.negotiationplatform.common.engine.NegotiationEngine;
import com.negotiationplatform.common.move.FixedProposalScorer;
import com.negotiationplatform.common.move.ProposalScorer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class NegotiationEngineConfig {

    private static final Logger log = LoggerFactory.getLogger(NegotiationEngineConfig.class);

    @Value("${negotiation.scoring.fixed-score:0.65}")
    private double fixedScore;

    @Value("${negotiation.concession.mode:seeded}")
    private String concessionMode;

    @Value("${negotiation.concession.seed:42}")
    private long concessionSeed;

    @Value("${negotiation.concession.threshold:0.1}")
    private double concessionThreshold;

    @Bean
    public ProposalScorer proposalScorer() {
        return new FixedProposalScorer(fixedScore);
    }

    @Bean
    public ConcessionDecider concessionDecider() {
        if ("threshold".equalsIgnoreCase(concessionMode)) {
            log.info("Concession decider: threshold={}", concessionThreshold);
            return new ThresholdConcessionDecider(concessionThreshold);
        }
        if (!"seeded".equalsIgnoreCase(concessionMode)) {
            log.warn("Unknown negotiation.concession.mode={}, falling back to seeded", concessionMode);
        }
        log.info("Concession decider: round-seeded seed={}", concessionSeed);
        return new RoundSeededConcessionDecider(concessionSeed);
    }

    @Bean
    public NegotiationEngine negotiationEngine(ProposalScorer proposalScorer,
                                               ConcessionDecider concessionDecider) {
        return new NegotiationEngine(proposalScorer, concessionDecider);
    }
}
