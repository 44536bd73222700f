package com.pareview.app.integration.models.request;

import com.pareview.app.integration.enumerations.EvidenceDirectness;
import com.pareview.app.integration.enumerations.FactPolarity;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * One structured clinical fact extracted from the case record.
 *
 * <p>{@code scopeTerms} name what the fact is about and drive matching against policy criteria.
 * A fact without provenance can never satisfy a criterion on its own.</p>
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class EvidenceFact {

    private String factId;

    @NotBlank
    private String category;

    @NotBlank
    private String statement;

    private List<String> scopeTerms;

    @NotNull
    private FactPolarity polarity;

    private EvidenceDirectness directness;

    @Min(0)
    @Max(100)
    private Integer confidence;

    @Valid
    private Provenance provenance;
}
