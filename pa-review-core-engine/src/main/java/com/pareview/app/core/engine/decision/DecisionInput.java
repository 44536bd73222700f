package com.pareview.app.core.engine.decision;

import com.pareview.app.integration.enumerations.ConfidenceTier;
import com.pareview.app.integration.enumerations.CriterionVerdict;
import com.pareview.app.integration.enumerations.RequirementLevel;
import com.pareview.app.integration.models.decision.ConfidenceAssessment;
import com.pareview.app.integration.models.evaluation.CriterionEvaluation;
import com.pareview.app.integration.models.task.ComplianceResult;
import com.pareview.app.integration.models.task.EvidenceMappingResult;
import com.pareview.app.integration.models.task.PolicyRetrievalResult;
import com.pareview.app.integration.models.verification.CodeValidationEntry;
import com.pareview.app.integration.models.verification.ProviderVerificationResult;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * Everything the resolver's gates look at, flattened from the earlier task checkpoints.
 */
@Getter
@Builder(toBuilder = true)
@ToString
public class DecisionInput {

    private final boolean providerLookupCompleted;
    private final boolean providerFound;
    private final boolean providerActive;
    private final boolean specialtyAppropriate;
    private final String npi;

    private final boolean codeLookupCompleted;
    @Builder.Default
    private final List<CodeValidationEntry> codes = List.of();

    private final boolean policyLocated;
    private final String policyId;

    private final double percentMet;
    private final boolean allEvidenceGathered;
    /** "id: text" of every MUST criterion not met. */
    @Builder.Default
    private final List<String> unmetMustCriteria = List.of();

    private final double overallConfidence;
    private final ConfidenceTier confidenceTier;

    @Builder.Default
    private final List<String> missingItems = List.of();

    public static DecisionInput from(ComplianceResult compliance,
                                     PolicyRetrievalResult policy,
                                     EvidenceMappingResult evidence,
                                     ConfidenceAssessment assessment) {
        ProviderVerificationResult provider = compliance.getProvider();
        boolean policyLocated = policy != null && policy.getSelectedPolicy() != null;
        boolean evaluated = evidence != null && !evidence.isSkipped();

        return DecisionInput.builder()
                .providerLookupCompleted(compliance.isProviderLookupCompleted())
                .providerFound(provider != null && provider.isFound())
                .providerActive(provider != null && provider.isActive())
                .specialtyAppropriate(compliance.isSpecialtyAppropriate())
                .npi(provider != null ? provider.getNpi() : null)
                .codeLookupCompleted(compliance.isCodeLookupCompleted())
                .codes(compliance.getCodes() == null ? List.of() : compliance.getCodes())
                .policyLocated(policyLocated)
                .policyId(policyLocated ? policy.getSelectedPolicy().getPolicyId() : null)
                .percentMet(evaluated ? evidence.getPercentMet() : 0.0)
                .allEvidenceGathered(evaluated && evidence.isAllEvidenceGathered())
                .unmetMustCriteria(evaluated ? unmetMust(evidence.getEvaluations()) : List.of())
                .overallConfidence(assessment.getOverall())
                .confidenceTier(assessment.getTier())
                .missingItems(compliance.getMissingItems() == null ? List.of() : compliance.getMissingItems())
                .build();
    }

    private static List<String> unmetMust(List<CriterionEvaluation> evaluations) {
        if (evaluations == null) {
            return List.of();
        }
        return evaluations.stream()
                .filter(e -> e.getRequirementLevel() == RequirementLevel.MUST)
                .filter(e -> e.getVerdict() != CriterionVerdict.MET)
                .map(e -> e.getCriterionId() + ": " + e.getText())
                .toList();
    }
}
