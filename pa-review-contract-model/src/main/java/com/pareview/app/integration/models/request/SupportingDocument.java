package com.pareview.app.integration.models.request;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class SupportingDocument {

    @NotBlank
    private String documentId;

    @NotBlank
    private String category;

    private String title;
}
