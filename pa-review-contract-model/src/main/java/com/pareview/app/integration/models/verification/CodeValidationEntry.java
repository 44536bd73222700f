package com.pareview.app.integration.models.verification;

import com.pareview.app.integration.enumerations.CodeSystem;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class CodeValidationEntry {

    private String code;

    private CodeSystem codeSystem;

    private boolean valid;

    private String description;

    public static CodeValidationEntry malformed(String code, CodeSystem codeSystem) {
        return CodeValidationEntry.builder()
                .code(code)
                .codeSystem(codeSystem)
                .valid(false)
                .description("Malformed " + codeSystem.getDisplayName() + " code")
                .build();
    }
}
