package com.cx.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Scores and flags for one interaction")
public class RecordScore {

    @Schema(description = "Interaction identifier", example = "abc-123")
    private String interactionId;

    @Schema(description = "Raw score per model (higher = more anomalous); 'ensemble' holds the fused score in [0, 1]",
            example = "{\"iforest\": 0.61, \"lof\": 1.42, \"ensemble\": 0.55}")
    private Map<String, Double> scores;

    @Schema(description = "Anomaly flag per model (1 = anomaly, 0 = normal); 'ensemble' is the OR of the model flags",
            example = "{\"iforest\": 1, \"lof\": 0, \"ensemble\": 1}")
    private Map<String, Integer> isAnomaly;
}
