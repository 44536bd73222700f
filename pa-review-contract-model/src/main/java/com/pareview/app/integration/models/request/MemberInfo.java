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
public class MemberInfo {

    @NotBlank
    private String memberId;

    private String name;

    private String dateOfBirth;

    private String planId;
}
