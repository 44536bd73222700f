package com.pareview.app.integration.models.verification;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class CodeValidationReport {

    private List<CodeValidationEntry> entries;

    public static CodeValidationReport of(List<CodeValidationEntry> entries) {
        return new CodeValidationReport(new ArrayList<>(entries));
    }

    public boolean allValid() {
        return entries != null && !entries.isEmpty() && entries.stream().allMatch(CodeValidationEntry::isValid);
    }

    /**
     * Percentage of entries that validated, 0 for an empty report.
     */
    public double percentValid() {
        if (entries == null || entries.isEmpty()) {
            return 0.0;
        }
        long valid = entries.stream().filter(CodeValidationEntry::isValid).count();
        return valid * 100.0 / entries.size();
    }
}
