package com.cx.anomaly.model;

import com.cx.anomaly.engine.threshold.ScoreStats;
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
@Schema(description = "Training metadata persisted next to each model")
public class ModelMetadata {

    @Schema(description = "Algorithm identifier", example = "IsolationForest")
    private String algorithm;

    @Schema(description = "Training time (ISO-8601, UTC)", example = "2025-10-15T10:00:00Z")
    private String trainTimestamp;

    @Schema(description = "Rows used for training", example = "1000")
    private int sampleCount;

    @Schema(description = "Width of the transformed feature vector", example = "16")
    private int featureCount;

    @Schema(description = "Calibrated anomaly threshold on the raw score", example = "0.5312")
    private double threshold;

    @Schema(description = "Training-score percentile the threshold was taken at", example = "95.0")
    private double thresholdPercentile;

    @Schema(description = "Hyperparameters the model was fitted with")
    private Map<String, Object> modelParams;

    @Schema(description = "Training score distribution: min, max, mean, std")
    private ScoreStats scoreStats;
}
