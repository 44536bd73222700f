package com.pareview.app.integration.models.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ProviderInfo {

    @NotBlank
    @Pattern(regexp = "\\d{10}", message = "must be a 10-digit NPI")
    private String npi;

    private String name;

    /** Specialty the service requires the provider to hold. Blank accepts any specialty. */
    private String specialty;
}
