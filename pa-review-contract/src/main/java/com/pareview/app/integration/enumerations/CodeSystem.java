package com.pareview.app.integration.enumerations;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Code systems used on a prior-authorization request, each with its structural format.
 */
@Getter
@AllArgsConstructor
public enum CodeSystem {
    ICD_10_CM("ICD-10-CM", Pattern.compile("^[A-Z][0-9][0-9A-Z]{0,5}$")),
    CPT("CPT/HCPCS", Pattern.compile("^[0-9A-Z]{4}[0-9A-Z]$"));

    private final String displayName;
    private final Pattern format;

    /**
     * Normalizes a code for lookup: trimmed, upper-cased, dots removed.
     */
    public String normalize(String code) {
        return code == null ? "" : code.trim().toUpperCase(Locale.ROOT).replace(".", "");
    }

    public boolean isWellFormed(String code) {
        return format.matcher(normalize(code)).matches();
    }
}
