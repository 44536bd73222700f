package com.pareview.app.integration.models.task;

import com.pareview.app.integration.models.decision.DecisionGap;
import com.pareview.app.integration.models.verification.CodeValidationEntry;
import com.pareview.app.integration.models.verification.ProviderVerificationResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Provider credentialing, code validation and completeness checks for a case.
 *
 * <p>A lookup that could not complete is reported through {@code collaboratorGaps} and the
 * matching {@code ...LookupCompleted} flag rather than failing the task.</p>
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ComplianceResult {

    private ProviderVerificationResult provider;

    private boolean providerLookupCompleted;

    private boolean specialtyAppropriate;

    private String providerNote;

    private boolean codeLookupCompleted;

    private List<CodeValidationEntry> codes;

    private List<String> missingItems;

    private double documentationScore;

    private List<DecisionGap> collaboratorGaps;
}
