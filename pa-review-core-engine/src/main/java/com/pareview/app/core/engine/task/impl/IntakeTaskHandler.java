package com.pareview.app.core.engine.task.impl;

import com.pareview.app.core.engine.task.IReviewTaskContext;
import com.pareview.app.core.engine.task.IReviewTaskHandler;
import com.pareview.app.core.engine.validation.ReviewBeanValidator;
import com.pareview.app.core.exception.CaseInputException;
import com.pareview.app.core.exception.ReviewConstraintViolation;
import com.pareview.app.core.exception.codes.PaReviewInternalErrorCodes;
import com.pareview.app.integration.constant.ReviewTaskIds;
import com.pareview.app.integration.enumerations.CodeSystem;
import com.pareview.app.integration.models.request.EvidenceFact;
import com.pareview.app.integration.models.request.PriorAuthRequest;
import com.pareview.app.integration.models.request.SupportingDocument;
import com.pareview.app.integration.models.task.IntakeSummary;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Validates the submitted case and normalizes it into the summary every later task reads.
 */
@Slf4j
public class IntakeTaskHandler implements IReviewTaskHandler {

    @Override
    public String taskId() {
        return ReviewTaskIds.INTAKE;
    }

    @Override
    public boolean readsSubmission() {
        return true;
    }

    @Override
    public Mono<Object> execute(IReviewTaskContext context) {
        return context.readSubmission().map(request -> {
            List<ReviewConstraintViolation> violations = ReviewBeanValidator.getInstance().validate(request);
            if (!violations.isEmpty()) {
                log.warn("Case input rejected: runId={}, caseId={}, violations={}",
                        context.getRunId(), request.getCaseId(), violations);
                throw new CaseInputException(PaReviewInternalErrorCodes.CASE_INPUT_CONSTRAINT_VIOLATION,
                        Map.of("caseId", String.valueOf(request.getCaseId()),
                                "violations", violations.stream()
                                        .map(ReviewConstraintViolation::toString)
                                        .collect(Collectors.joining("; "))),
                        violations);
            }
            return summarize(request);
        });
    }

    static IntakeSummary summarize(PriorAuthRequest request) {
        List<EvidenceFact> facts = new ArrayList<>();
        List<EvidenceFact> submitted = request.getClinicalFacts() == null ? List.of() : request.getClinicalFacts();
        for (int i = 0; i < submitted.size(); i++) {
            EvidenceFact fact = submitted.get(i);
            facts.add(fact.getFactId() != null ? fact : fact.toBuilder().factId("F" + (i + 1)).build());
        }
        List<String> categories = request.getDocumentation() == null ? List.of()
                : request.getDocumentation().stream()
                .map(SupportingDocument::getCategory)
                .map(category -> category.trim().toLowerCase(Locale.ROOT))
                .distinct()
                .toList();

        return IntakeSummary.builder()
                .caseId(request.getCaseId())
                .memberId(request.getMember().getMemberId())
                .planId(request.getMember().getPlanId())
                .npi(request.getProvider().getNpi().trim())
                .providerName(request.getProvider().getName())
                .requiredSpecialty(request.getProvider().getSpecialty())
                .serviceDescription(request.getService().getDescription().trim())
                .cptCodes(request.getService().getCptCodes().stream().map(CodeSystem.CPT::normalize).toList())
                .icd10Codes(request.getDiagnosis().getIcd10Codes().stream().map(CodeSystem.ICD_10_CM::normalize).toList())
                .primaryDiagnosis(request.getDiagnosis().getPrimaryDescription())
                .urgent(request.getService().isUrgent())
                .clinicalFacts(facts)
                .documentationCategories(categories)
                .build();
    }
}
