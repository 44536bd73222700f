package com.pareview.app.integration.models.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ServiceRequest {

    @NotBlank
    private String description;

    @NotEmpty
    private List<@NotBlank String> cptCodes;

    private String placeOfService;

    private boolean urgent;
}
