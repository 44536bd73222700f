package com.pareview.app.core.engine.decision;

import com.pareview.app.integration.enumerations.DecisionGate;
import com.pareview.app.integration.enumerations.DecisionOutcome;
import com.pareview.app.integration.models.decision.Decision;
import com.pareview.app.integration.models.decision.DecisionGap;
import com.pareview.app.integration.models.verification.CodeValidationEntry;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Ordered gate sequence producing a candidate decision.
 *
 * <ol>
 *   <li>provider: found, active and specialty-appropriate</li>
 *   <li>codes: every submitted code valid</li>
 *   <li>policy: an applicable coverage policy located</li>
 *   <li>criteria: percentage met at or above the pass threshold</li>
 *   <li>confidence: only reached when every earlier gate passed</li>
 * </ol>
 *
 * <p>Evaluation stops at the first failing gate. Each failing gate adds one critical gap. The
 * resolver is deterministic and performs no I/O.</p>
 */
@Slf4j
public class DecisionResolver {

    public static final String FLAG_MEDIUM_CONFIDENCE = "medium-confidence";
    public static final String FLAG_STRICT_DENIAL = "strict-denial";

    private final DecisionResolverConfig config;

    public DecisionResolver(DecisionResolverConfig config) {
        this.config = config;
    }

    public DecisionResolver() {
        this(DecisionResolverConfig.defaults());
    }

    public Decision resolve(DecisionInput input) {
        List<DecisionGate> evaluated = new ArrayList<>();

        // 1. provider
        evaluated.add(DecisionGate.PROVIDER);
        String providerProblem = providerProblem(input);
        if (providerProblem != null) {
            return pend(input, evaluated, DecisionGate.PROVIDER, providerProblem,
                    List.of("Verify provider credentials and specialty for NPI " + input.getNpi()));
        }

        // 2. codes
        evaluated.add(DecisionGate.CODES);
        String codeProblem = codeProblem(input);
        if (codeProblem != null) {
            return pend(input, evaluated, DecisionGate.CODES, codeProblem,
                    List.of("Correct or clarify the submitted diagnosis and procedure codes"));
        }

        // 3. policy
        evaluated.add(DecisionGate.POLICY);
        if (!input.isPolicyLocated()) {
            return pend(input, evaluated, DecisionGate.POLICY, "No applicable coverage policy located",
                    List.of("Identify the applicable coverage policy by manual policy review"));
        }

        // 4. criteria
        evaluated.add(DecisionGate.CRITERIA);
        double percentMet = input.getPercentMet();
        if (percentMet < config.getCriteriaPassThreshold()) {
            List<String> actions = new ArrayList<>();
            input.getUnmetMustCriteria().forEach(c -> actions.add("Document required criterion " + c));
            if (percentMet >= config.getCriteriaBorderlineThreshold()) {
                actions.add("Request additional clinical documentation");
                return pend(input, evaluated, DecisionGate.CRITERIA,
                        "Borderline clinical criteria (" + percent(percentMet) + " met): additional documentation needed",
                        actions);
            }
            String description = "Significant gaps in clinical criteria (" + percent(percentMet) + " met)";
            if (strictDenialApplies(input)) {
                return deny(input, evaluated, description);
            }
            actions.add("Clinical reviewer to assess significant criteria gaps");
            return pend(input, evaluated, DecisionGate.CRITERIA, description, actions);
        }

        // 5. confidence
        evaluated.add(DecisionGate.CONFIDENCE);
        double confidence = input.getOverallConfidence();
        if (confidence < config.getConfidenceFlagThreshold()) {
            return pend(input, evaluated, DecisionGate.CONFIDENCE,
                    "Low confidence (" + percent(confidence) + ") in an otherwise passing case",
                    List.of("Clinical reviewer to verify low-confidence evidence"));
        }
        boolean flagged = confidence < config.getConfidenceApproveThreshold();
        return Decision.builder()
                .outcome(DecisionOutcome.APPROVE_CANDIDATE)
                .overallConfidence(confidence)
                .confidenceTier(input.getConfidenceTier())
                .gaps(List.of())
                .rationale(flagged
                        ? "All gates passed with medium confidence (" + percent(confidence) + "); approval flagged for closer review"
                        : "All gates passed with high confidence (" + percent(confidence) + ")")
                .flagged(flagged)
                .flags(flagged ? List.of(FLAG_MEDIUM_CONFIDENCE) : List.of())
                .requiredActions(flagged ? List.of("Reviewer to confirm medium-confidence approval") : List.of())
                .evaluatedGates(List.copyOf(evaluated))
                .build();
    }

    // ========================================================================
    // GATE CHECKS
    // ========================================================================

    private static String providerProblem(DecisionInput input) {
        if (!input.isProviderLookupCompleted()) {
            return "Provider verification could not be completed for NPI " + input.getNpi();
        }
        if (!input.isProviderFound()) {
            return "Provider NPI " + input.getNpi() + " not found in registry";
        }
        if (!input.isProviderActive()) {
            return "Provider NPI " + input.getNpi() + " is not active";
        }
        if (!input.isSpecialtyAppropriate()) {
            return "Provider specialty is not appropriate for the requested service";
        }
        return null;
    }

    private static String codeProblem(DecisionInput input) {
        if (!input.isCodeLookupCompleted()) {
            return "Code validation could not be completed";
        }
        if (input.getCodes().isEmpty()) {
            return "No diagnosis or procedure codes were validated";
        }
        List<String> invalid = input.getCodes().stream()
                .filter(code -> !code.isValid())
                .map(CodeValidationEntry::getCode)
                .toList();
        return invalid.isEmpty() ? null : "Invalid codes: " + String.join(", ", invalid);
    }

    private boolean strictDenialApplies(DecisionInput input) {
        return config.isStrictDenialEnabled()
                && config.isAllowed(DecisionOutcome.DENY_CANDIDATE)
                && input.isAllEvidenceGathered()
                && input.getOverallConfidence() >= config.getStrictDenialConfidenceThreshold();
    }

    // ========================================================================
    // OUTCOMES
    // ========================================================================

    private Decision pend(DecisionInput input, List<DecisionGate> evaluated, DecisionGate gate,
                          String description, List<String> gateActions) {
        log.debug("Gate {} failed: {}", gate.getGateId(), description);
        return Decision.builder()
                .outcome(DecisionOutcome.PEND)
                .overallConfidence(input.getOverallConfidence())
                .confidenceTier(input.getConfidenceTier())
                .gaps(List.of(DecisionGap.critical(gate, description)))
                .rationale("Pended for " + gate.getReason() + ": " + description)
                .flagged(false)
                .flags(List.of())
                .requiredActions(requiredActions(input, gateActions))
                .evaluatedGates(List.copyOf(evaluated))
                .build();
    }

    private Decision deny(DecisionInput input, List<DecisionGate> evaluated, String description) {
        log.debug("Strict denial path taken: {}", description);
        List<String> actions = new ArrayList<>();
        input.getUnmetMustCriteria().forEach(c -> actions.add("Document required criterion " + c));
        actions.add("Physician reviewer to confirm denial basis");
        return Decision.builder()
                .outcome(DecisionOutcome.DENY_CANDIDATE)
                .overallConfidence(input.getOverallConfidence())
                .confidenceTier(input.getConfidenceTier())
                .gaps(List.of(DecisionGap.critical(DecisionGate.CRITERIA, description)))
                .rationale("Denial candidate: " + description + " with all evidence gathered")
                .flagged(true)
                .flags(List.of(FLAG_STRICT_DENIAL))
                .requiredActions(requiredActions(input, actions))
                .evaluatedGates(List.copyOf(evaluated))
                .build();
    }

    private static List<String> requiredActions(DecisionInput input, List<String> gateActions) {
        List<String> actions = new ArrayList<>(gateActions);
        if (input.getMissingItems() != null) {
            input.getMissingItems().forEach(item -> actions.add("Provide missing documentation: " + item));
        }
        return List.copyOf(actions);
    }

    private static String percent(double value) {
        return String.format(Locale.ROOT, "%.1f%%", value);
    }
}
