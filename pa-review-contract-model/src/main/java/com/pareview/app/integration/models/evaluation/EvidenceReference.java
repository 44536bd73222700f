package com.pareview.app.integration.models.evaluation;

import com.pareview.app.integration.enumerations.FactPolarity;
import com.pareview.app.integration.models.request.Provenance;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class EvidenceReference {

    private String factId;

    private String statement;

    private FactPolarity polarity;

    private int confidence;

    private Provenance provenance;
}
