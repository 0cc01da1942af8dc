package com.negotiationplatform.negotiation.validation;

import com.negotiationplatform.common.exception.InvalidNegotiationInputException;
import com.negotiationplatform.common.model.ConcessionPlan;
import com.negotiationplatform.common.model.Need;
import com.negotiationplatform.common.model.Offering;
import com.negotiationplatform.common.model.PartyProfile;
import com.negotiationplatform.common.model.ProposedTerms;
import com.negotiationplatform.negotiation.dto.BatnaRequest;
import com.negotiationplatform.negotiation.dto.ConcessionPlanRequest;
import com.negotiationplatform.negotiation.dto.MoveRequest;
import com.negotiationplatform.negotiation.dto.RelationshipRequest;
import com.negotiationplatform.negotiation.dto.StrategyRequest;
import com.negotiationplatform.negotiation.dto.ZopaRequest;

import java.util.List;

/**
 * Fail-fast shape validation for engine requests. The engine assumes well-formed input;
 * everything it cannot default is rejected here with the offending field named.
 *
 * <p>Pure utility: no state, no logging, no Spring dependency.
 */
public final class NegotiationRequestValidator {

    private NegotiationRequestValidator() {}

    public static void validate(BatnaRequest request) {
        requireRequest(request);
        validateProfile("profile", request.profile());
        validateOptionalProfile("counterpartyProfile", request.counterpartyProfile());
    }

    public static void validate(ZopaRequest request) {
        requireRequest(request);
        validateProfile("profileA", request.profileA());
        validateProfile("profileB", request.profileB());
        validateTerms("proposal", request.proposal());
    }

    public static void validate(ConcessionPlanRequest request) {
        requireRequest(request);
        validateProfile("profile", request.profile());
        validateOptionalProfile("counterpartyProfile", request.counterpartyProfile());
        validateTerms("initialProposal", request.initialProposal());
    }

    public static void validate(MoveRequest request) {
        requireRequest(request);
        validateProfile("profile", request.profile());
        validateProfile("counterpartyProfile", request.counterpartyProfile());
        validateTerms("currentProposal", request.currentProposal());
        if (request.opponentLastProposal() != null) {
            validateTerms("opponentLastProposal", request.opponentLastProposal());
        }
        validatePlan("plan", request.plan());
        validateRound(request.round());
    }

    public static void validate(RelationshipRequest request) {
        requireRequest(request);
        validateProfile("profile", request.profile());
        validateOptionalProfile("counterpartyProfile", request.counterpartyProfile());
        validateTerms("offer", request.offer());
        if (request.priorAgreements() < 0) {
            throw new InvalidNegotiationInputException("priorAgreements",
                "must be >= 0 but was " + request.priorAgreements());
        }
    }

    public static void validate(StrategyRequest request) {
        requireRequest(request);
        validateProfile("profile", request.profile());
        validateOptionalProfile("counterpartyProfile", request.counterpartyProfile());
        validateRound(request.round());
    }

    // ── building blocks ─────────────────────────────────────────────

    static void validateProfile(String field, PartyProfile profile) {
        if (profile == null) {
            throw new InvalidNegotiationInputException(field, "profile is required");
        }
        List<Need> needs = profile.needs();
        for (int i = 0; i < needs.size(); i++) {
            Need need = needs.get(i);
            String needField = field + ".needs[" + i + "]";
            requireText(needField + ".description", need.description());
            if (need.flexibility() != null) {
                requireUnitInterval(needField + ".flexibility", need.flexibility());
            }
        }
        List<Offering> offerings = profile.offerings();
        for (int i = 0; i < offerings.size(); i++) {
            Offering offering = offerings.get(i);
            String offeringField = field + ".offerings[" + i + "]";
            requireText(offeringField + ".description", offering.description());
            requireUnitInterval(offeringField + ".capacity", offering.capacity());
        }
        Double minAcceptable = profile.config().minAcceptableScore();
        if (minAcceptable != null) {
            requireUnitInterval(field + ".config.minAcceptableScore", minAcceptable);
        }
    }

    static void validateOptionalProfile(String field, PartyProfile profile) {
        if (profile != null) {
            validateProfile(field, profile);
        }
    }

    static void validateTerms(String field, ProposedTerms terms) {
        if (terms == null) {
            throw new InvalidNegotiationInputException(field, "proposed terms are required");
        }
        requireItems(field + ".partyAGives", terms.partyAGives());
        requireItems(field + ".partyAGets", terms.partyAGets());
        requireItems(field + ".partyBGives", terms.partyBGives());
        requireItems(field + ".partyBGets", terms.partyBGets());
    }

    static void validatePlan(String field, ConcessionPlan plan) {
        if (plan == null) {
            throw new InvalidNegotiationInputException(field, "concession plan is required");
        }
        validateTerms(field + ".initialPosition", plan.initialPosition());
        for (int i = 0; i < plan.fallbackPositions().size(); i++) {
            validateTerms(field + ".fallbackPositions[" + i + "]", plan.fallbackPositions().get(i));
        }
        if (!(plan.concessionRate() > 0.0 && plan.concessionRate() <= 1.0)) {
            throw new InvalidNegotiationInputException(field + ".concessionRate",
                "must be in (0, 1] but was " + plan.concessionRate());
        }
        for (String redLine : plan.redLines()) {
            if (plan.tradables().contains(redLine)) {
                throw new InvalidNegotiationInputException(field + ".tradables",
                    "red line '" + redLine + "' cannot be tradable");
            }
        }
    }

    static void validateRound(int round) {
        if (round < 1) {
            throw new InvalidNegotiationInputException("round", "must be >= 1 but was " + round);
        }
    }

    private static void requireRequest(Object request) {
        if (request == null) {
            throw new InvalidNegotiationInputException("request", "request body is required");
        }
    }

    private static void requireItems(String field, List<String> items) {
        for (int i = 0; i < items.size(); i++) {
            requireText(field + "[" + i + "]", items.get(i));
        }
    }

    private static void requireText(String field, String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidNegotiationInputException(field, "description must not be blank");
        }
    }

    private static void requireUnitInterval(String field, double value) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new InvalidNegotiationInputException(field, "must be in [0, 1] but was " + value);
        }
    }
}
