package com.pareview.app.integration.collaborator;

import com.pareview.app.integration.models.task.EvidenceMappingResult;
import com.pareview.app.integration.models.task.HumanDecisionRecord;
import com.pareview.app.integration.models.task.RecommendationResult;

/**
 * Renders the human-readable report for a decided case. Works from read-only checkpoint data.
 */
public interface IReviewReportFormatter {

    String format(String caseId,
                  RecommendationResult recommendation,
                  EvidenceMappingResult evidence,
                  HumanDecisionRecord humanDecision);
}
