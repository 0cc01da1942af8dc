package com.negotiationplatform.common.concession;

import com.negotiationplatform.common.model.ConcessionPlan;
import com.negotiationplatform.common.model.ConcessionStrategy;
import com.negotiationplatform.common.model.Need;
import com.negotiationplatform.common.model.PartyProfile;
import com.negotiationplatform.common.model.ProposedTerms;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Builds a {@link ConcessionPlan} once per session from a party's profile and style.
 *
 * <ul>
 *   <li><b>Red lines</b>: descriptions of CRITICAL needs</li>
 *   <li><b>Tradables</b>: non-CRITICAL needs with flexibility &gt; 0.5</li>
 *   <li><b>Fallback ladder</b>: {@value #FALLBACK_COUNT} snapshots of the initial proposal
 *       at concession depth 1, 2, 3 (see {@link ConcessionSteps#concede})</li>
 *   <li><b>Strategy / rate</b>: {@link ConcessionStrategy#forStyle}</li>
 * </ul>
 *
 * <p>Pure; rebuild the plan if the party's style changes mid-session.
 */
public final class ConcessionPlanner {

    static final int    FALLBACK_COUNT        = 3;
    static final double TRADABLE_FLEXIBILITY  = 0.5;

    private ConcessionPlanner() {}

    public static ConcessionPlan build(PartyProfile profile, PartyProfile counterparty,
                                       ProposedTerms initialProposal) {
        ProposedTerms initial = initialProposal == null
            ? ProposedTerms.of(List.of(), List.of(), List.of(), List.of())
            : initialProposal;

        Set<String> redLines  = redLines(profile);
        Set<String> tradables = tradables(profile, redLines);

        List<ProposedTerms> fallbacks = new ArrayList<>(FALLBACK_COUNT);
        for (int depth = 1; depth <= FALLBACK_COUNT; depth++) {
            fallbacks.add(ConcessionSteps.concede(initial, depth, redLines));
        }

        ConcessionStrategy strategy = ConcessionStrategy.forStyle(profile == null ? null : profile.style());
        return new ConcessionPlan(initial, fallbacks, redLines, tradables, strategy.defaultRate(), strategy);
    }

    static Set<String> redLines(PartyProfile profile) {
        Set<String> redLines = new LinkedHashSet<>();
        if (profile == null) return redLines;
        for (Need need : profile.needs()) {
            if (need.isCritical() && need.description() != null) {
                redLines.add(need.description());
            }
        }
        return redLines;
    }

    static Set<String> tradables(PartyProfile profile, Set<String> redLines) {
        Set<String> tradables = new LinkedHashSet<>();
        if (profile == null) return tradables;
        for (Need need : profile.needs()) {
            if (need.isCritical() || need.description() == null) continue;
            // a description shared with a critical need stays a red line
            if (redLines.contains(need.description())) continue;
            if (need.flexibility() != null && need.flexibility() > TRADABLE_FLEXIBILITY) {
                tradables.add(need.description());
            }
        }
        return tradables;
    }
}
