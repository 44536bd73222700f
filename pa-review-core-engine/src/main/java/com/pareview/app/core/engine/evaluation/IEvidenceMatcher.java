package com.pareview.app.core.engine.evaluation;

import com.pareview.app.integration.models.policy.PolicyCriterion;
import com.pareview.app.integration.models.request.EvidenceFact;

/**
 * Decides whether a fact falls within a criterion's scope.
 */
public interface IEvidenceMatcher {

    boolean matches(PolicyCriterion criterion, EvidenceFact fact);
}
