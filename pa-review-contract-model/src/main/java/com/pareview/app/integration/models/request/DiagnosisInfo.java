package com.pareview.app.integration.models.request;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class DiagnosisInfo {

    @NotEmpty
    private List<@NotBlank String> icd10Codes;

    private String primaryDescription;
}
