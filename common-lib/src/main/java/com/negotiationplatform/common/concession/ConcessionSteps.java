package com.negotiationplatform.common.concession;

import com.negotiationplatform.common.model.ProposedTerms;

import java.util.Set;

/**
 * Pure helpers that remove exchanges from the tail of party A's "gets".
 *
 * <p>Rules shared by the fallback ladder and per-round concessions:
 * <ul>
 *   <li>only the tail is touched, walking backwards past red-line items</li>
 *   <li>party B's index-aligned "give" goes with each removed "get"</li>
 *   <li>at least one "get" always remains</li>
 *   <li>the input is never mutated</li>
 * </ul>
 */
public final class ConcessionSteps {

    private ConcessionSteps() {}

    /**
     * Removes up to {@code depth} tradable "gets" from the tail. Removes fewer when the
     * list would otherwise drop below one item or when only red lines remain.
     */
    public static ProposedTerms concede(ProposedTerms terms, int depth, Set<String> redLines) {
        Set<String> protectedItems = redLines == null ? Set.of() : redLines;
        ProposedTerms result = terms;
        int removed = 0;
        int index = terms.partyAGets().size() - 1;
        while (removed < depth && index >= 0 && result.partyAGets().size() > 1) {
            String item = result.partyAGets().get(index);
            if (!protectedItems.contains(item)) {
                result = result.withoutExchangeAt(index);
                removed++;
            }
            index--;
        }
        return result;
    }

    /** {@code true} if at least one tail exchange could be removed from {@code terms}. */
    public static boolean canConcede(ProposedTerms terms, Set<String> redLines) {
        return concede(terms, 1, redLines) != terms;
    }
}
