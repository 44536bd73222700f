package com.pareview.app.integration.models.verification;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Registry answer for a provider identifier.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ProviderVerificationResult {

    private String npi;

    private boolean found;

    private boolean active;

    private String name;

    private String specialty;

    public static ProviderVerificationResult notFound(String npi) {
        return ProviderVerificationResult.builder()
                .npi(npi)
                .found(false)
                .active(false)
                .build();
    }
}
