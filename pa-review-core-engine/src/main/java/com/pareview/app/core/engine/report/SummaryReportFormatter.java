package com.pareview.app.core.engine.report;

import com.pareview.app.integration.collaborator.IReviewReportFormatter;
import com.pareview.app.integration.models.decision.Decision;
import com.pareview.app.integration.models.decision.DecisionGap;
import com.pareview.app.integration.models.decision.DecisionOverride;
import com.pareview.app.integration.models.evaluation.CriterionEvaluation;
import com.pareview.app.integration.models.evaluation.EvidenceReference;
import com.pareview.app.integration.models.task.EvidenceMappingResult;
import com.pareview.app.integration.models.task.HumanDecisionRecord;
import com.pareview.app.integration.models.task.RecommendationResult;

import java.util.List;
import java.util.Locale;

/**
 * Plain-text case summary. Used when no richer formatter is supplied.
 */
public class SummaryReportFormatter implements IReviewReportFormatter {

    private static final String RULE = "=".repeat(60);

    @Override
    public String format(String caseId,
                         RecommendationResult recommendation,
                         EvidenceMappingResult evidence,
                         HumanDecisionRecord humanDecision) {
        StringBuilder out = new StringBuilder();
        out.append(RULE).append('\n')
                .append("PRIOR AUTHORIZATION REVIEW: ").append(caseId).append('\n')
                .append(RULE).append('\n');

        if (humanDecision != null) {
            out.append("Final outcome: ").append(humanDecision.getFinalOutcome())
                    .append(" (decided by ").append(humanDecision.getDecidedBy()).append(")\n");
            DecisionOverride override = humanDecision.getOverride();
            if (override != null) {
                out.append("Override of ").append(override.getPriorOutcome())
                        .append(": ").append(override.getJustification()).append('\n');
                if (override.getClinicalBasis() != null) {
                    out.append("Clinical basis: ").append(override.getClinicalBasis()).append('\n');
                }
            }
        }

        Decision decision = recommendation == null ? null : recommendation.getDecision();
        if (decision != null) {
            out.append('\n').append("Candidate outcome: ").append(decision.getOutcome())
                    .append(String.format(Locale.ROOT, " (confidence %.1f, %s)",
                            decision.getOverallConfidence(), decision.getConfidenceTier()))
                    .append(decision.isFlagged() ? " [flagged: " + String.join(", ", decision.getFlags()) + "]" : "")
                    .append('\n')
                    .append("Rationale: ").append(decision.getRationale()).append('\n');
            appendGaps(out, decision.getGaps());
            appendList(out, "Required actions", decision.getRequiredActions());
        }

        if (evidence != null && !evidence.isSkipped() && evidence.getEvaluations() != null) {
            out.append('\n').append(String.format(Locale.ROOT, "Clinical criteria (%.1f%% met, policy %s)%n",
                    evidence.getPercentMet(), evidence.getPolicyId()));
            for (CriterionEvaluation evaluation : evidence.getEvaluations()) {
                out.append("  [").append(evaluation.getVerdict()).append("] ")
                        .append(evaluation.getCriterionId()).append(' ')
                        .append(evaluation.getText())
                        .append(" (").append(evaluation.getConfidence()).append(")\n");
                List<EvidenceReference> references = evaluation.getSupportingEvidence();
                if (references != null) {
                    for (EvidenceReference reference : references) {
                        out.append("      - ").append(reference.getStatement());
                        if (reference.getProvenance() != null && reference.getProvenance().getDocumentId() != null) {
                            out.append(" [").append(reference.getProvenance().getDocumentId());
                            if (reference.getProvenance().getLocation() != null) {
                                out.append(", ").append(reference.getProvenance().getLocation());
                            }
                            out.append(']');
                        }
                        out.append('\n');
                    }
                }
            }
        }
        return out.toString();
    }

    private static void appendGaps(StringBuilder out, List<DecisionGap> gaps) {
        if (gaps == null || gaps.isEmpty()) {
            return;
        }
        out.append("Gaps:\n");
        for (DecisionGap gap : gaps) {
            out.append("  - [").append(gap.getGate().getGateId())
                    .append(gap.isCritical() ? ", critical" : "")
                    .append("] ").append(gap.getDescription()).append('\n');
        }
    }

    private static void appendList(StringBuilder out, String title, List<String> items) {
        if (items == null || items.isEmpty()) {
            return;
        }
        out.append(title).append(":\n");
        items.forEach(item -> out.append("  - ").append(item).append('\n'));
    }
}
