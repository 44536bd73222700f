package com.pareview.app.integration.models.evaluation;

import com.pareview.app.integration.enumerations.CriterionGrouping;
import com.pareview.app.integration.enumerations.CriterionVerdict;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class CriterionGroupResult {

    private String groupId;

    private CriterionGrouping grouping;

    private List<String> memberCriterionIds;

    private CriterionVerdict verdict;
}
