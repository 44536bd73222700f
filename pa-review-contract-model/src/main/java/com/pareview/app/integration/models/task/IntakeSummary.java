package com.pareview.app.integration.models.task;

import com.pareview.app.integration.models.request.EvidenceFact;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Normalized view of the submitted case. Later tasks read this instead of the raw submission.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class IntakeSummary {

    private String caseId;

    private String memberId;

    private String planId;

    private String npi;

    private String providerName;

    private String requiredSpecialty;

    private String serviceDescription;

    private List<String> cptCodes;

    private List<String> icd10Codes;

    private String primaryDiagnosis;

    private boolean urgent;

    private List<EvidenceFact> clinicalFacts;

    private List<String> documentationCategories;
}
