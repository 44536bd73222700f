package com.pareview.app.integration.models.request;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Where in the submitted record a fact was found.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Provenance {

    private String documentId;

    private String location;

    private String excerpt;

    @JsonIgnore
    public boolean isTraceable() {
        return documentId != null && !documentId.isBlank();
    }
}
