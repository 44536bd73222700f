package com.pareview.app.integration.models.task;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.pareview.app.integration.enumerations.DecisionOutcome;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class NotificationResult {

    private DecisionOutcome finalOutcome;

    private String report;

    private List<String> deliveredChannels;

    private List<String> failedChannels;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private Instant sentAt;
}
