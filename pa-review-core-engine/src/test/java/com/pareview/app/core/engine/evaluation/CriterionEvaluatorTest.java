package com.pareview.app.core.engine.evaluation;

import com.pareview.app.core.engine.ReviewFixtures;
import com.pareview.app.core.engine.evaluation.impl.ScopeTermEvidenceMatcher;
import com.pareview.app.core.exception.CaseInputException;
import com.pareview.app.core.exception.codes.PaReviewInternalErrorCodes;
import com.pareview.app.integration.enumerations.CriterionGrouping;
import com.pareview.app.integration.enumerations.CriterionVerdict;
import com.pareview.app.integration.enumerations.EvidenceDirectness;
import com.pareview.app.integration.enumerations.FactPolarity;
import com.pareview.app.integration.enumerations.RequirementLevel;
import com.pareview.app.integration.models.evaluation.CriterionEvaluation;
import com.pareview.app.integration.models.policy.PolicyCriterion;
import com.pareview.app.integration.models.request.EvidenceFact;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.pareview.app.core.engine.ReviewFixtures.criterion;
import static com.pareview.app.core.engine.ReviewFixtures.fact;
import static org.junit.jupiter.api.Assertions.*;

class CriterionEvaluatorTest {

    private final CriterionEvaluator evaluator = new CriterionEvaluator(new ScopeTermEvidenceMatcher());

    private static final PolicyCriterion THERAPY =
            criterion("C1", "Failed conservative therapy", RequirementLevel.MUST, "conservative therapy");

    private CriterionEvaluation evaluateOne(PolicyCriterion criterion, EvidenceFact... facts) {
        return evaluator.evaluate("POL", List.of(criterion), List.of(facts)).getEvaluations().get(0);
    }

    @Nested
    @DisplayName("Verdicts")
    class VerdictTests {

        @Test
        @DisplayName("a supporting fact with provenance meets the criterion")
        void supportingWithProvenanceMet() {
            CriterionEvaluation evaluation = evaluateOne(THERAPY,
                    fact("F1", "PT for 6 weeks", "conservative therapy", FactPolarity.SUPPORTING,
                            EvidenceDirectness.DIRECT, "DOC-1"));

            assertEquals(CriterionVerdict.MET, evaluation.getVerdict());
            assertEquals(95, evaluation.getConfidence());
            assertEquals("F1", evaluation.getSupportingEvidence().get(0).getFactId());
            assertEquals("DOC-1", evaluation.getSupportingEvidence().get(0).getProvenance().getDocumentId());
        }

        @Test
        @DisplayName("a supporting fact without provenance is insufficient")
        void supportingWithoutProvenanceInsufficient() {
            CriterionEvaluation evaluation = evaluateOne(THERAPY,
                    fact("F1", "PT for 6 weeks", "conservative therapy", FactPolarity.SUPPORTING,
                            EvidenceDirectness.DIRECT, null));

            assertEquals(CriterionVerdict.INSUFFICIENT, evaluation.getVerdict());
            assertTrue(evaluation.getConfidence() <= 49);
        }

        @Test
        @DisplayName("a documented absence makes the criterion not met")
        void documentedAbsenceNotMet() {
            CriterionEvaluation evaluation = evaluateOne(THERAPY,
                    fact("F1", "No therapy documented", "conservative therapy", FactPolarity.DOCUMENTED_ABSENCE,
                            EvidenceDirectness.STRONG_INFERENCE, "DOC-1"));

            assertEquals(CriterionVerdict.NOT_MET, evaluation.getVerdict());
            assertEquals(80, evaluation.getConfidence());
        }

        @Test
        @DisplayName("nothing found is insufficient, not a failure")
        void nothingFoundInsufficient() {
            CriterionEvaluation evaluation = evaluateOne(THERAPY,
                    fact("F1", "Patient reports headache", "headache", FactPolarity.SUPPORTING,
                            EvidenceDirectness.DIRECT, "DOC-1"));

            assertEquals(CriterionVerdict.INSUFFICIENT, evaluation.getVerdict());
            assertEquals(0, evaluation.getConfidence());
            assertTrue(evaluation.getSupportingEvidence().isEmpty());
        }

        @Test
        @DisplayName("the stronger side wins a conflict")
        void strongerSideWins() {
            CriterionEvaluation evaluation = evaluateOne(THERAPY,
                    fact("F1", "PT completed", "conservative therapy", FactPolarity.SUPPORTING,
                            EvidenceDirectness.DIRECT, "DOC-1"),
                    fact("F2", "Therapy possibly skipped", "conservative therapy", FactPolarity.CONTRADICTING,
                            EvidenceDirectness.WEAK, "DOC-2"));

            assertEquals(CriterionVerdict.MET, evaluation.getVerdict());
        }

        @Test
        @DisplayName("an even conflict is insufficient")
        void evenConflictInsufficient() {
            CriterionEvaluation evaluation = evaluateOne(THERAPY,
                    fact("F1", "PT completed", "conservative therapy", FactPolarity.SUPPORTING,
                            EvidenceDirectness.DIRECT, "DOC-1"),
                    fact("F2", "PT never started", "conservative therapy", FactPolarity.CONTRADICTING,
                            EvidenceDirectness.DIRECT, "DOC-2"));

            assertEquals(CriterionVerdict.INSUFFICIENT, evaluation.getVerdict());
            assertEquals(49, evaluation.getConfidence());
            assertEquals(2, evaluation.getSupportingEvidence().size());
        }

        @Test
        @DisplayName("explicit confidence is clamped into the directness band")
        void confidenceClampedToBand() {
            EvidenceFact overstated = fact("F1", "PT completed", "conservative therapy", FactPolarity.SUPPORTING,
                    EvidenceDirectness.REASONABLE_INFERENCE, "DOC-1").toBuilder().confidence(99).build();

            assertEquals(69, evaluateOne(THERAPY, overstated).getConfidence());
        }

        @Test
        @DisplayName("a criterion term in the statement matches without scope terms")
        void statementMatch() {
            EvidenceFact fact = fact("F1", "Completed conservative therapy in 2023", "unrelated",
                    FactPolarity.SUPPORTING, EvidenceDirectness.DIRECT, "DOC-1");

            assertEquals(CriterionVerdict.MET, evaluateOne(THERAPY, fact).getVerdict());
        }
    }

    @Nested
    @DisplayName("Groups and percentage")
    class GroupTests {

        @Test
        @DisplayName("sample case meets every verdict unit")
        void sampleCase() {
            CriterionEvaluationSet set = evaluator.evaluate(ReviewFixtures.POLICY_ID, ReviewFixtures.sampleCriteria(),
                    ReviewFixtures.sampleRequest().getClinicalFacts());

            assertEquals(4, set.getEvaluations().size());
            assertEquals(CriterionVerdict.INSUFFICIENT, set.getEvaluations().get(3).getVerdict());
            assertEquals(1, set.getGroupResults().size());
            assertEquals(CriterionVerdict.MET, set.getGroupResults().get(0).getVerdict());
            assertEquals(100.0, set.getPercentMet(), 1e-9);
            assertFalse(set.isAllEvidenceGathered());
        }

        @Test
        @DisplayName("an ALL group needs every member met")
        void allGroup() {
            List<PolicyCriterion> criteria = List.of(
                    criterion("A", "a", RequirementLevel.MUST, "alpha").toBuilder()
                            .groupId("G").grouping(CriterionGrouping.ALL).build(),
                    criterion("B", "b", RequirementLevel.MUST, "beta").toBuilder()
                            .groupId("G").grouping(CriterionGrouping.ALL).build());
            List<EvidenceFact> facts = List.of(
                    fact("F1", "alpha present", "alpha", FactPolarity.SUPPORTING, EvidenceDirectness.DIRECT, "D"));

            CriterionEvaluationSet set = evaluator.evaluate("POL", criteria, facts);

            assertEquals(CriterionVerdict.INSUFFICIENT, set.getGroupResults().get(0).getVerdict());
            assertEquals(0.0, set.getPercentMet(), 1e-9);
        }

        @Test
        @DisplayName("a group member that is not met fails an ALL group")
        void allGroupNotMet() {
            List<PolicyCriterion> criteria = List.of(
                    criterion("A", "a", RequirementLevel.MUST, "alpha").toBuilder().groupId("G").build(),
                    criterion("B", "b", RequirementLevel.MUST, "beta").toBuilder().groupId("G").build());
            List<EvidenceFact> facts = List.of(
                    fact("F1", "alpha present", "alpha", FactPolarity.SUPPORTING, EvidenceDirectness.DIRECT, "D"),
                    fact("F2", "beta absent", "beta", FactPolarity.DOCUMENTED_ABSENCE, EvidenceDirectness.DIRECT, "D"));

            CriterionEvaluationSet set = evaluator.evaluate("POL", criteria, facts);

            assertEquals(CriterionGrouping.ALL, set.getGroupResults().get(0).getGrouping());
            assertEquals(CriterionVerdict.NOT_MET, set.getGroupResults().get(0).getVerdict());
        }

        @Test
        @DisplayName("duplicate criteria are evaluated independently")
        void duplicatesKept() {
            CriterionEvaluationSet set = evaluator.evaluate("POL", List.of(THERAPY, THERAPY), List.of());

            assertEquals(2, set.getEvaluations().size());
        }

        @Test
        @DisplayName("missing criterion ids are numbered by position")
        void generatedIds() {
            PolicyCriterion unnamed = THERAPY.toBuilder().criterionId(null).build();

            CriterionEvaluationSet set = evaluator.evaluate("POL", List.of(THERAPY, unnamed), List.of());

            assertEquals("C2", set.getEvaluations().get(1).getCriterionId());
        }

        @Test
        @DisplayName("zero criteria is an input error")
        void emptyCriteria() {
            CaseInputException error = assertThrows(CaseInputException.class,
                    () -> evaluator.evaluate("POL", List.of(), List.of()));

            assertEquals(PaReviewInternalErrorCodes.POLICY_CRITERIA_EMPTY, error.getErrorInfo());
        }
    }
}
