package com.pareview.app.integration.models.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * A prior-authorization case as submitted for review.
 *
 * <p>Only the intake task reads this document; every later task works from checkpoints.</p>
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class PriorAuthRequest {

    @NotBlank
    private String caseId;

    @NotNull
    @Valid
    private MemberInfo member;

    @NotNull
    @Valid
    private ProviderInfo provider;

    @NotNull
    @Valid
    private ServiceRequest service;

    @NotNull
    @Valid
    private DiagnosisInfo diagnosis;

    private List<@Valid EvidenceFact> clinicalFacts;

    private List<@Valid SupportingDocument> documentation;
}
