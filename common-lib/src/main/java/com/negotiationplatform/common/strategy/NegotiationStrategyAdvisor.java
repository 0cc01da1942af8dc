package com.negotiationplatform.common.strategy;

import com.negotiationplatform.common.batna.BatnaEstimator;
import com.negotiationplatform.common.model.Batna;
import com.negotiationplatform.common.model.NegotiationStyle;
import com.negotiationplatform.common.model.PartyProfile;

import java.util.List;

/**
 * Picks a high-level playbook for a party from its style and BATNA strength.
 *
 * <pre>
 *   COMPETITIVE and BATNA value &gt; 0.6 → Competitive/Win-Lose
 *   COLLABORATIVE                     → Collaborative/Win-Win
 *   COMPROMISING                      → Compromising/Split-the-Difference
 *   ACCOMMODATING                     → Accommodating/Relationship-First
 *   otherwise                         → Balanced/Adaptive
 * </pre>
 *
 * <p>A competitive party without leverage is steered to the balanced playbook.
 */
public final class NegotiationStrategyAdvisor {

    static final double STRONG_BATNA = 0.6;

    static final NegotiationStrategy COMPETITIVE = new NegotiationStrategy(
        "Competitive/Win-Lose",
        "Maximize own gains, strong BATNA gives leverage",
        List.of(
            new NegotiationTactic("High Anchor", "Start with aggressive initial offer",
                TacticTiming.EARLY, 0.75, 0.6),
            new NegotiationTactic("Limited Concessions", "Make small, infrequent concessions",
                TacticTiming.MIDDLE, 0.7, 0.5),
            new NegotiationTactic("Deadline Pressure", "Create time pressure for decision",
                TacticTiming.LATE, 0.65, 0.7)),
        "Strong BATNA, one-time transaction, competitive market",
        "Favorable terms, may strain relationship");

    static final NegotiationStrategy COLLABORATIVE = new NegotiationStrategy(
        "Collaborative/Win-Win",
        "Create mutual value, expand the pie",
        List.of(
            new NegotiationTactic("Information Sharing", "Share interests and priorities openly",
                TacticTiming.EARLY, 0.8, 0.3),
            new NegotiationTactic("Value Creation", "Identify new sources of value for both parties",
                TacticTiming.MIDDLE, 0.85, 0.2),
            new NegotiationTactic("Package Deals", "Bundle multiple items for greater value",
                TacticTiming.ANY, 0.8, 0.3)),
        "Long-term relationship, complex deal, mutual dependency",
        "High mutual value, strong relationship foundation");

    static final NegotiationStrategy COMPROMISING = new NegotiationStrategy(
        "Compromising/Split-the-Difference",
        "Meet in the middle, balanced approach",
        List.of(
            new NegotiationTactic("Moderate Opening", "Start with reasonable offer",
                TacticTiming.EARLY, 0.7, 0.4),
            new NegotiationTactic("Gradual Concessions", "Make steady, predictable concessions",
                TacticTiming.MIDDLE, 0.75, 0.3),
            new NegotiationTactic("Midpoint Focus", "Aim for 50/50 split",
                TacticTiming.LATE, 0.7, 0.3)),
        "Time pressure, equal power, moderate stakes",
        "Fair compromise, acceptable to both parties");

    static final NegotiationStrategy ACCOMMODATING = new NegotiationStrategy(
        "Accommodating/Relationship-First",
        "Prioritize relationship and goodwill",
        List.of(
            new NegotiationTactic("Generous Opening", "Start with favorable offer to other party",
                TacticTiming.EARLY, 0.65, 0.5),
            new NegotiationTactic("Quick Concessions", "Readily make concessions",
                TacticTiming.ANY, 0.6, 0.6),
            new NegotiationTactic("Long-term Focus", "Emphasize future collaboration value",
                TacticTiming.ANY, 0.75, 0.4)),
        "Building new relationship, low stakes, goodwill needed",
        "Strong relationship, may leave value on table");

    static final NegotiationStrategy BALANCED = new NegotiationStrategy(
        "Balanced/Adaptive",
        "Adapt based on situation and opponent moves",
        List.of(
            new NegotiationTactic("Responsive Positioning", "Adjust based on opponent behavior",
                TacticTiming.ANY, 0.75, 0.4),
            new NegotiationTactic("Principled Negotiation", "Focus on objective criteria and fairness",
                TacticTiming.ANY, 0.8, 0.3),
            new NegotiationTactic("Strategic Concessions", "Trade on items of different value to each party",
                TacticTiming.MIDDLE, 0.85, 0.3)),
        "Most situations, flexible approach",
        "Good balance of value and relationship");

    private NegotiationStrategyAdvisor() {}

    /**
     * @param round current round; the playbook itself does not depend on it, see
     *              {@link #tacticsFor(NegotiationStrategy, int)} for round-specific tactics
     */
    public static NegotiationStrategy develop(PartyProfile profile, PartyProfile counterparty, int round) {
        NegotiationStyle style = profile == null ? NegotiationStyle.BALANCED : profile.style();
        Batna batna = BatnaEstimator.estimate(profile, counterparty);

        if (style == NegotiationStyle.COMPETITIVE && batna.value() > STRONG_BATNA) {
            return COMPETITIVE;
        }
        return switch (style) {
            case COLLABORATIVE -> COLLABORATIVE;
            case COMPROMISING  -> COMPROMISING;
            case ACCOMMODATING -> ACCOMMODATING;
            default            -> BALANCED;
        };
    }

    /** Tactics of {@code strategy} that apply in {@code round}, in playbook order. */
    public static List<NegotiationTactic> tacticsFor(NegotiationStrategy strategy, int round) {
        return strategy.tactics().stream()
            .filter(t -> t.timing().appliesTo(round))
            .toList();
    }
}
