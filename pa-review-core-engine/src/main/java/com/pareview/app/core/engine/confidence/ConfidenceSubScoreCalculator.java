package com.pareview.app.core.engine.confidence;

import com.pareview.app.integration.models.decision.ConfidenceSubScores;
import com.pareview.app.integration.models.policy.PolicyCandidate;
import com.pareview.app.integration.models.task.ComplianceResult;
import com.pareview.app.integration.models.task.EvidenceMappingResult;
import com.pareview.app.integration.models.task.PolicyRetrievalResult;
import com.pareview.app.integration.models.verification.CodeValidationEntry;
import com.pareview.app.integration.models.verification.CodeValidationReport;
import com.pareview.app.integration.models.verification.ProviderVerificationResult;

import java.util.List;

/**
 * Derives the five sub-scores from the checkpoints of earlier tasks.
 */
public final class ConfidenceSubScoreCalculator {

    private ConfidenceSubScoreCalculator() {
    }

    public static ConfidenceSubScores calculate(ComplianceResult compliance,
                                                PolicyRetrievalResult policy,
                                                EvidenceMappingResult evidence) {
        return ConfidenceSubScores.builder()
                .provider(providerScore(compliance))
                .codes(codeScore(compliance))
                .policyMatch(policyScore(policy))
                .clinicalCriteria(clamp(evidence == null || evidence.isSkipped() ? 0.0 : evidence.getPercentMet()))
                .documentationQuality(clamp(compliance == null ? 0.0 : compliance.getDocumentationScore()))
                .build();
    }

    /**
     * 100 verified with a matching specialty, 50 active with a mismatch, 25 inactive, 0 not found
     * or not looked up.
     */
    static double providerScore(ComplianceResult compliance) {
        if (compliance == null || !compliance.isProviderLookupCompleted()) {
            return 0.0;
        }
        ProviderVerificationResult provider = compliance.getProvider();
        if (provider == null || !provider.isFound()) {
            return 0.0;
        }
        if (!provider.isActive()) {
            return 25.0;
        }
        return compliance.isSpecialtyAppropriate() ? 100.0 : 50.0;
    }

    static double codeScore(ComplianceResult compliance) {
        if (compliance == null || !compliance.isCodeLookupCompleted()) {
            return 0.0;
        }
        List<CodeValidationEntry> codes = compliance.getCodes();
        return codes == null ? 0.0 : CodeValidationReport.of(codes).percentValid();
    }

    static double policyScore(PolicyRetrievalResult policy) {
        if (policy == null) {
            return 0.0;
        }
        PolicyCandidate selected = policy.getSelectedPolicy();
        return selected == null ? 0.0 : clamp(selected.getRelevanceScore());
    }

    private static double clamp(double score) {
        return Math.max(0.0, Math.min(100.0, score));
    }
}
