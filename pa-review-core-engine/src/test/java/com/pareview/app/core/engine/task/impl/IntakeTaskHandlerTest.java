package com.pareview.app.core.engine.task.impl;

import com.pareview.app.core.engine.ReviewFixtures;
import com.pareview.app.core.exception.CaseInputException;
import com.pareview.app.core.exception.codes.PaReviewInternalErrorCodes;
import com.pareview.app.integration.constant.ReviewTaskIds;
import com.pareview.app.integration.enumerations.EvidenceDirectness;
import com.pareview.app.integration.enumerations.FactPolarity;
import com.pareview.app.integration.models.request.PriorAuthRequest;
import com.pareview.app.integration.models.request.ServiceRequest;
import com.pareview.app.integration.models.task.IntakeSummary;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class IntakeTaskHandlerTest {

    private final IntakeTaskHandler handler = new IntakeTaskHandler();

    @Test
    @DisplayName("summarizes the submission with normalized codes and categories")
    void summarize() {
        PriorAuthRequest request = ReviewFixtures.sampleRequest();
        request.setDocumentation(List.of(ReviewFixtures.document("DOC-1", " Clinical-Notes "),
                ReviewFixtures.document("DOC-2", "clinical-notes")));

        IntakeSummary summary = (IntakeSummary) handler.execute(
                new StubTaskContext(ReviewTaskIds.INTAKE).withSubmission(request)).block();

        assertEquals("CASE-1001", summary.getCaseId());
        assertEquals(ReviewFixtures.VALID_NPI, summary.getNpi());
        assertEquals(List.of("M545"), summary.getIcd10Codes());
        assertEquals(List.of("72148"), summary.getCptCodes());
        assertEquals(List.of("clinical-notes"), summary.getDocumentationCategories());
        assertEquals(3, summary.getClinicalFacts().size());
        assertTrue(handler.readsSubmission());
    }

    @Test
    @DisplayName("facts without an id are numbered by position")
    void factIds() {
        PriorAuthRequest request = ReviewFixtures.sampleRequest();
        request.setClinicalFacts(List.of(
                ReviewFixtures.fact(null, "Pain for 8 weeks", "back pain duration",
                        FactPolarity.SUPPORTING, EvidenceDirectness.DIRECT, "DOC-1"),
                ReviewFixtures.fact("X9", "PT done", "conservative therapy",
                        FactPolarity.SUPPORTING, EvidenceDirectness.DIRECT, "DOC-2")));

        IntakeSummary summary = IntakeTaskHandler.summarize(request);

        assertEquals("F1", summary.getClinicalFacts().get(0).getFactId());
        assertEquals("X9", summary.getClinicalFacts().get(1).getFactId());
    }

    @Test
    @DisplayName("a submission missing required fields is an input error")
    void invalidSubmission() {
        PriorAuthRequest request = ReviewFixtures.sampleRequest();
        request.setService(ServiceRequest.builder().description(" ").cptCodes(List.of("72148")).build());

        CaseInputException error = assertThrows(CaseInputException.class, () -> handler.execute(
                new StubTaskContext(ReviewTaskIds.INTAKE).withSubmission(request)).block());

        assertEquals(PaReviewInternalErrorCodes.CASE_INPUT_CONSTRAINT_VIOLATION, error.getErrorInfo());
        assertTrue(error.isRecoverable());
        assertTrue(error.getMessage().contains("service.description"));
    }
}
