package com.pareview.app.core.engine.evaluation;

import com.pareview.app.core.exception.CaseInputException;
import com.pareview.app.core.exception.codes.PaReviewInternalErrorCodes;
import com.pareview.app.integration.enumerations.CriterionGrouping;
import com.pareview.app.integration.enumerations.CriterionVerdict;
import com.pareview.app.integration.enumerations.EvidenceDirectness;
import com.pareview.app.integration.enumerations.FactPolarity;
import com.pareview.app.integration.enumerations.RequirementLevel;
import com.pareview.app.integration.models.evaluation.CriterionEvaluation;
import com.pareview.app.integration.models.evaluation.CriterionGroupResult;
import com.pareview.app.integration.models.evaluation.EvidenceReference;
import com.pareview.app.integration.models.policy.PolicyCriterion;
import com.pareview.app.integration.models.request.EvidenceFact;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Assigns a verdict to every policy criterion from the case's evidence facts.
 *
 * <h2>Verdict rules</h2>
 * <ul>
 *   <li>{@code MET}: at least one matching supporting fact with provenance</li>
 *   <li>{@code NOT_MET}: a matching contradicting fact or documented absence</li>
 *   <li>{@code INSUFFICIENT}: anything else, including "nothing found"</li>
 * </ul>
 * When both sides are present the side with the stronger fact wins; equal strength is
 * {@code INSUFFICIENT}.
 *
 * <h2>Confidence</h2>
 * <p>A fact's confidence comes from its directness band (90-100 direct, 70-89 strong inference,
 * 50-69 reasonable inference, below 50 weak). A verdict carries the confidence of its strongest
 * fact. An {@code INSUFFICIENT} verdict never exceeds 49 and is 0 when no fact matched.</p>
 *
 * <h2>Groups</h2>
 * <p>Criteria sharing a group id form one verdict unit ({@code ALL}: every member met;
 * {@code ANY}: one member met). Each ungrouped criterion is its own unit. The percentage met is
 * computed over units.</p>
 */
@Slf4j
public class CriterionEvaluator {

    private static final int INSUFFICIENT_CONFIDENCE_CEILING = 49;

    private final IEvidenceMatcher matcher;

    public CriterionEvaluator(IEvidenceMatcher matcher) {
        this.matcher = matcher;
    }

    /**
     * Evaluates the criteria in order. Duplicate criteria are evaluated independently.
     *
     * @throws CaseInputException if no criteria are supplied
     */
    public CriterionEvaluationSet evaluate(String policyId, List<PolicyCriterion> criteria, List<EvidenceFact> facts) {
        if (criteria == null || criteria.isEmpty()) {
            throw new CaseInputException(PaReviewInternalErrorCodes.POLICY_CRITERIA_EMPTY,
                    Map.of("policyId", String.valueOf(policyId)));
        }
        List<EvidenceFact> evidence = facts == null ? List.of() : facts;

        List<CriterionEvaluation> evaluations = new ArrayList<>();
        for (int i = 0; i < criteria.size(); i++) {
            evaluations.add(evaluateCriterion(criteria.get(i), i, evidence));
        }

        List<CriterionGroupResult> groupResults = resolveGroups(criteria, evaluations);
        double percentMet = percentMet(evaluations, groupResults);
        boolean allGathered = evaluations.stream().noneMatch(e -> e.getVerdict() == CriterionVerdict.INSUFFICIENT);

        log.debug("Evaluated policy {}: criteria={}, groups={}, percentMet={}, allEvidenceGathered={}",
                policyId, evaluations.size(), groupResults.size(), percentMet, allGathered);

        return CriterionEvaluationSet.builder()
                .evaluations(evaluations)
                .groupResults(groupResults)
                .percentMet(percentMet)
                .allEvidenceGathered(allGathered)
                .build();
    }

    // ========================================================================
    // PER-CRITERION
    // ========================================================================

    private CriterionEvaluation evaluateCriterion(PolicyCriterion criterion, int index, List<EvidenceFact> facts) {
        List<EvidenceFact> matched = facts.stream()
                .filter(fact -> matcher.matches(criterion, fact))
                .toList();

        List<EvidenceFact> supporting = matched.stream()
                .filter(fact -> fact.getPolarity() == FactPolarity.SUPPORTING && hasProvenance(fact))
                .toList();
        List<EvidenceFact> unsourced = matched.stream()
                .filter(fact -> fact.getPolarity() == FactPolarity.SUPPORTING && !hasProvenance(fact))
                .toList();
        List<EvidenceFact> negative = matched.stream()
                .filter(fact -> fact.getPolarity() == FactPolarity.CONTRADICTING
                        || fact.getPolarity() == FactPolarity.DOCUMENTED_ABSENCE)
                .toList();

        CriterionEvaluation.CriterionEvaluationBuilder builder = CriterionEvaluation.builder()
                .criterionId(criterion.getCriterionId() != null ? criterion.getCriterionId() : "C" + (index + 1))
                .text(criterion.getText())
                .requirementLevel(criterion.getRequirementLevel() != null
                        ? criterion.getRequirementLevel() : RequirementLevel.MUST)
                .groupId(criterion.getGroupId());

        int supportStrength = strongest(supporting);
        int negativeStrength = strongest(negative);

        if (!supporting.isEmpty() && (negative.isEmpty() || supportStrength > negativeStrength)) {
            return builder.verdict(CriterionVerdict.MET)
                    .confidence(supportStrength)
                    .supportingEvidence(references(supporting))
                    .notes(negative.isEmpty()
                            ? supporting.size() + " supporting fact(s)"
                            : "Supporting evidence outweighs " + negative.size() + " contradicting fact(s)")
                    .build();
        }
        if (!negative.isEmpty() && (supporting.isEmpty() || negativeStrength > supportStrength)) {
            return builder.verdict(CriterionVerdict.NOT_MET)
                    .confidence(negativeStrength)
                    .supportingEvidence(references(negative))
                    .notes(supporting.isEmpty()
                            ? describeNegative(negative)
                            : "Contradicting evidence outweighs " + supporting.size() + " supporting fact(s)")
                    .build();
        }
        if (!supporting.isEmpty()) {
            List<EvidenceFact> conflicting = new ArrayList<>(supporting);
            conflicting.addAll(negative);
            return builder.verdict(CriterionVerdict.INSUFFICIENT)
                    .confidence(Math.min(INSUFFICIENT_CONFIDENCE_CEILING, supportStrength))
                    .supportingEvidence(references(conflicting))
                    .notes("Conflicting evidence of equal strength")
                    .build();
        }
        if (!unsourced.isEmpty()) {
            return builder.verdict(CriterionVerdict.INSUFFICIENT)
                    .confidence(Math.min(INSUFFICIENT_CONFIDENCE_CEILING, strongest(unsourced)))
                    .supportingEvidence(references(unsourced))
                    .notes("Supporting evidence lacks provenance")
                    .build();
        }
        return builder.verdict(CriterionVerdict.INSUFFICIENT)
                .confidence(0)
                .supportingEvidence(List.of())
                .notes("No evidence found for criterion")
                .build();
    }

    private static String describeNegative(List<EvidenceFact> negative) {
        boolean documentedAbsence = negative.stream().anyMatch(f -> f.getPolarity() == FactPolarity.DOCUMENTED_ABSENCE);
        return documentedAbsence ? "Record documents absence of required finding" : "Contradicted by case evidence";
    }

    private static boolean hasProvenance(EvidenceFact fact) {
        return fact.getProvenance() != null && fact.getProvenance().isTraceable();
    }

    static int factConfidence(EvidenceFact fact) {
        if (fact.getDirectness() != null) {
            return fact.getDirectness().resolveConfidence(fact.getConfidence());
        }
        if (fact.getConfidence() != null) {
            return Math.max(0, Math.min(100, fact.getConfidence()));
        }
        return EvidenceDirectness.REASONABLE_INFERENCE.getDefaultConfidence();
    }

    private static int strongest(List<EvidenceFact> facts) {
        return facts.stream().mapToInt(CriterionEvaluator::factConfidence).max().orElse(0);
    }

    private static List<EvidenceReference> references(List<EvidenceFact> facts) {
        return facts.stream()
                .sorted(Comparator.comparingInt(CriterionEvaluator::factConfidence).reversed())
                .map(fact -> EvidenceReference.builder()
                        .factId(fact.getFactId())
                        .statement(fact.getStatement())
                        .polarity(fact.getPolarity())
                        .confidence(factConfidence(fact))
                        .provenance(fact.getProvenance())
                        .build())
                .toList();
    }

    // ========================================================================
    // GROUPS
    // ========================================================================

    private static List<CriterionGroupResult> resolveGroups(List<PolicyCriterion> criteria,
                                                            List<CriterionEvaluation> evaluations) {
        Map<String, CriterionGrouping> groupings = new LinkedHashMap<>();
        Map<String, List<CriterionEvaluation>> members = new LinkedHashMap<>();
        for (int i = 0; i < criteria.size(); i++) {
            PolicyCriterion criterion = criteria.get(i);
            String groupId = criterion.getGroupId();
            if (groupId == null || groupId.isBlank()) {
                continue;
            }
            if (criterion.getGrouping() != null) {
                groupings.putIfAbsent(groupId, criterion.getGrouping());
            }
            members.computeIfAbsent(groupId, key -> new ArrayList<>()).add(evaluations.get(i));
        }

        List<CriterionGroupResult> results = new ArrayList<>();
        for (Map.Entry<String, List<CriterionEvaluation>> group : members.entrySet()) {
            CriterionGrouping grouping = groupings.getOrDefault(group.getKey(), CriterionGrouping.ALL);
            results.add(CriterionGroupResult.builder()
                    .groupId(group.getKey())
                    .grouping(grouping)
                    .memberCriterionIds(group.getValue().stream().map(CriterionEvaluation::getCriterionId).toList())
                    .verdict(groupVerdict(grouping, group.getValue()))
                    .build());
        }
        return results;
    }

    static CriterionVerdict groupVerdict(CriterionGrouping grouping, List<CriterionEvaluation> members) {
        long met = members.stream().filter(m -> m.getVerdict() == CriterionVerdict.MET).count();
        long notMet = members.stream().filter(m -> m.getVerdict() == CriterionVerdict.NOT_MET).count();
        return switch (grouping) {
            case ALL -> met == members.size() ? CriterionVerdict.MET
                    : notMet > 0 ? CriterionVerdict.NOT_MET : CriterionVerdict.INSUFFICIENT;
            case ANY -> met > 0 ? CriterionVerdict.MET
                    : notMet == members.size() ? CriterionVerdict.NOT_MET : CriterionVerdict.INSUFFICIENT;
        };
    }

    private static double percentMet(List<CriterionEvaluation> evaluations, List<CriterionGroupResult> groups) {
        long ungrouped = evaluations.stream().filter(e -> e.getGroupId() == null || e.getGroupId().isBlank()).count();
        long ungroupedMet = evaluations.stream()
                .filter(e -> e.getGroupId() == null || e.getGroupId().isBlank())
                .filter(e -> e.getVerdict() == CriterionVerdict.MET)
                .count();
        long groupsMet = groups.stream().filter(g -> g.getVerdict() == CriterionVerdict.MET).count();
        long units = ungrouped + groups.size();
        return units == 0 ? 0.0 : (ungroupedMet + groupsMet) * 100.0 / units;
    }
}
