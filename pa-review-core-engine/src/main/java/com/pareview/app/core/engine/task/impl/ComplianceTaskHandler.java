package com.pareview.app.core.engine.task.impl;

import com.pareview.app.core.engine.task.IReviewTaskContext;
import com.pareview.app.core.engine.task.IReviewTaskHandler;
import com.pareview.app.core.engine.validation.NpiValidator;
import com.pareview.app.integration.collaborator.ICodeValidationClient;
import com.pareview.app.integration.collaborator.IProviderVerificationClient;
import com.pareview.app.integration.constant.ReviewTaskIds;
import com.pareview.app.integration.enumerations.CodeSystem;
import com.pareview.app.integration.enumerations.DecisionGate;
import com.pareview.app.integration.models.decision.DecisionGap;
import com.pareview.app.integration.models.task.ComplianceResult;
import com.pareview.app.integration.models.task.IntakeSummary;
import com.pareview.app.integration.models.verification.CodeValidationEntry;
import com.pareview.app.integration.models.verification.CodeValidationReport;
import com.pareview.app.integration.models.verification.ProviderVerificationResult;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Provider credentialing, code validation and documentation completeness.
 *
 * <p>The provider lookup and the two code lookups run concurrently. A lookup that fails or times
 * out does not fail the task: the result records a gap and marks the lookup incomplete, which the
 * decision resolver's gates then act on.</p>
 */
@Slf4j
public class ComplianceTaskHandler implements IReviewTaskHandler {

    private final IProviderVerificationClient providerClient;
    private final ICodeValidationClient codeClient;
    private final List<String> requiredDocumentationCategories;
    private final Set<String> demoProviderIds;
    private final Duration collaboratorTimeout;

    @Builder
    public ComplianceTaskHandler(IProviderVerificationClient providerClient,
                                 ICodeValidationClient codeClient,
                                 Collection<String> requiredDocumentationCategories,
                                 Collection<String> demoProviderIds,
                                 Duration collaboratorTimeout) {
        this.providerClient = Objects.requireNonNull(providerClient, "providerClient");
        this.codeClient = Objects.requireNonNull(codeClient, "codeClient");
        this.requiredDocumentationCategories = requiredDocumentationCategories == null ? List.of()
                : requiredDocumentationCategories.stream().map(c -> c.trim().toLowerCase(Locale.ROOT)).distinct().toList();
        this.demoProviderIds = demoProviderIds == null ? Set.of() : Set.copyOf(demoProviderIds);
        this.collaboratorTimeout = collaboratorTimeout != null ? collaboratorTimeout : Duration.ofSeconds(10);
    }

    @Override
    public String taskId() {
        return ReviewTaskIds.COMPLIANCE;
    }

    @Override
    public Mono<Object> execute(IReviewTaskContext context) {
        return context.readCheckpoint(ReviewTaskIds.INTAKE, IntakeSummary.class)
                .flatMap(intake -> Mono.zip(checkProvider(intake), checkCodes(intake))
                        .map(checks -> assemble(intake, checks.getT1(), checks.getT2())));
    }

    // ========================================================================
    // PROVIDER
    // ========================================================================

    private Mono<ProviderCheck> checkProvider(IntakeSummary intake) {
        String npi = intake.getNpi();
        if (demoProviderIds.contains(npi)) {
            log.info("Demo provider id, registry lookup skipped: npi={}", npi);
            ProviderVerificationResult demo = ProviderVerificationResult.builder()
                    .npi(npi)
                    .found(true)
                    .active(true)
                    .name(intake.getProviderName())
                    .specialty(intake.getRequiredSpecialty())
                    .build();
            return Mono.just(new ProviderCheck(demo, true, "Demo provider id; registry lookup skipped", null));
        }
        if (!NpiValidator.isValid(npi)) {
            return Mono.just(new ProviderCheck(ProviderVerificationResult.notFound(npi), true,
                    "NPI " + npi + " fails check digit validation", null));
        }
        return providerClient.verify(npi)
                .timeout(collaboratorTimeout)
                .switchIfEmpty(Mono.fromSupplier(() -> ProviderVerificationResult.notFound(npi)))
                .map(result -> new ProviderCheck(result, true, null, null))
                .onErrorResume(error -> {
                    log.warn("Provider verification unavailable, continuing without it: npi={}, error={}",
                            npi, error.toString());
                    return Mono.just(new ProviderCheck(ProviderVerificationResult.notFound(npi), false,
                            "Provider registry unavailable",
                            DecisionGap.advisory(DecisionGate.PROVIDER, "Provider registry unavailable: " + error.getMessage())));
                });
    }

    /**
     * The registry specialty must equal the required one, or be a sub-specialty of it written as a
     * qualified form ("Orthopedic Surgery - Spine"). A broader registry specialty does not match.
     */
    static boolean specialtyMatches(String required, String actual) {
        if (required == null || required.isBlank()) {
            return true;
        }
        if (actual == null || actual.isBlank()) {
            return false;
        }
        String r = normalizeSpecialty(required);
        String a = normalizeSpecialty(actual);
        return a.equals(r) || a.startsWith(r + " ");
    }

    private static String normalizeSpecialty(String specialty) {
        return specialty.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", " ").trim();
    }

    // ========================================================================
    // CODES
    // ========================================================================

    private Mono<CodeCheck> checkCodes(IntakeSummary intake) {
        return Mono.zip(validateSystem(CodeSystem.ICD_10_CM, intake.getIcd10Codes()),
                        validateSystem(CodeSystem.CPT, intake.getCptCodes()))
                .map(both -> {
                    List<CodeValidationEntry> entries = new ArrayList<>(both.getT1());
                    entries.addAll(both.getT2());
                    return new CodeCheck(entries, true, null);
                })
                .onErrorResume(error -> {
                    log.warn("Code validation unavailable, continuing without it: caseId={}, error={}",
                            intake.getCaseId(), error.toString());
                    return Mono.just(new CodeCheck(List.of(), false,
                            DecisionGap.advisory(DecisionGate.CODES, "Code validation unavailable: " + error.getMessage())));
                });
    }

    /**
     * Malformed codes are invalid without a lookup; the rest go to the validation client. Entries
     * come back in request order.
     */
    private Mono<List<CodeValidationEntry>> validateSystem(CodeSystem system, List<String> codes) {
        List<String> requested = codes == null ? List.of() : codes;
        List<String> wellFormed = requested.stream().filter(system::isWellFormed).distinct().toList();

        Mono<Map<String, CodeValidationEntry>> lookup = wellFormed.isEmpty()
                ? Mono.just(Map.of())
                : codeClient.validate(system, wellFormed)
                .timeout(collaboratorTimeout)
                .switchIfEmpty(Mono.fromSupplier(() -> CodeValidationReport.of(List.of())))
                .map(report -> {
                    Map<String, CodeValidationEntry> byCode = new HashMap<>();
                    if (report.getEntries() != null) {
                        report.getEntries().forEach(entry -> byCode.put(system.normalize(entry.getCode()), entry));
                    }
                    return byCode;
                });

        return lookup.map(byCode -> requested.stream()
                .map(code -> {
                    if (!system.isWellFormed(code)) {
                        return CodeValidationEntry.malformed(code, system);
                    }
                    CodeValidationEntry found = byCode.get(system.normalize(code));
                    return found != null ? found : CodeValidationEntry.builder()
                            .code(code)
                            .codeSystem(system)
                            .valid(false)
                            .description("Not recognized by code validation")
                            .build();
                })
                .toList());
    }

    // ========================================================================
    // ASSEMBLY
    // ========================================================================

    private ComplianceResult assemble(IntakeSummary intake, ProviderCheck provider, CodeCheck codes) {
        List<String> present = intake.getDocumentationCategories() == null ? List.of() : intake.getDocumentationCategories();
        List<String> missing = requiredDocumentationCategories.stream()
                .filter(category -> !present.contains(category))
                .toList();
        double documentationScore = requiredDocumentationCategories.isEmpty() ? 100.0
                : (requiredDocumentationCategories.size() - missing.size()) * 100.0 / requiredDocumentationCategories.size();

        ProviderVerificationResult result = provider.result();
        boolean specialtyAppropriate = result.isFound()
                && specialtyMatches(intake.getRequiredSpecialty(), result.getSpecialty());
        String note = provider.note();
        if (note == null && result.isFound() && !specialtyAppropriate) {
            note = "Registry specialty " + result.getSpecialty() + " does not match required " + intake.getRequiredSpecialty();
        }

        List<DecisionGap> gaps = new ArrayList<>();
        if (provider.gap() != null) {
            gaps.add(provider.gap());
        }
        if (codes.gap() != null) {
            gaps.add(codes.gap());
        }

        log.info("Compliance checked: caseId={}, providerFound={}, active={}, specialtyAppropriate={}, codesChecked={}, missingItems={}",
                intake.getCaseId(), result.isFound(), result.isActive(), specialtyAppropriate,
                codes.entries().size(), missing);

        return ComplianceResult.builder()
                .provider(result)
                .providerLookupCompleted(provider.completed())
                .specialtyAppropriate(specialtyAppropriate)
                .providerNote(note)
                .codeLookupCompleted(codes.completed())
                .codes(codes.entries())
                .missingItems(missing)
                .documentationScore(documentationScore)
                .collaboratorGaps(gaps)
                .build();
    }

    private record ProviderCheck(ProviderVerificationResult result, boolean completed, String note, DecisionGap gap) {
    }

    private record CodeCheck(List<CodeValidationEntry> entries, boolean completed, DecisionGap gap) {
    }
}
