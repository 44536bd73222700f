package com.pareview.app.core.engine.evaluation.impl;

import com.pareview.app.core.engine.evaluation.IEvidenceMatcher;
import com.pareview.app.integration.models.policy.PolicyCriterion;
import com.pareview.app.integration.models.request.EvidenceFact;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Matches on shared scope terms, or on a criterion term appearing in the fact's statement.
 * Terms compare case-insensitively with surrounding whitespace ignored. A criterion without
 * scope terms matches nothing.
 */
public class ScopeTermEvidenceMatcher implements IEvidenceMatcher {

    @Override
    public boolean matches(PolicyCriterion criterion, EvidenceFact fact) {
        Set<String> criterionTerms = normalize(criterion.getScopeTerms());
        if (criterionTerms.isEmpty()) {
            return false;
        }
        Set<String> factTerms = normalize(fact.getScopeTerms());
        if (factTerms.stream().anyMatch(criterionTerms::contains)) {
            return true;
        }
        String statement = fact.getStatement() == null ? "" : fact.getStatement().toLowerCase(Locale.ROOT);
        return criterionTerms.stream().anyMatch(statement::contains);
    }

    private static Set<String> normalize(List<String> terms) {
        if (terms == null) {
            return Set.of();
        }
        return terms.stream()
                .filter(term -> term != null && !term.isBlank())
                .map(term -> term.trim().toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());
    }
}
