package com.cx.anomaly.model;

import com.cx.anomaly.engine.threshold.ScoreStats;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "A loaded model and its training metadata")
public class ModelSummary {

    @Schema(example = "IsolationForest")
    private String algorithm;

    @Schema(example = "0.5312")
    private double threshold;

    @Schema(example = "95.0")
    private double thresholdPercentile;

    private String trainTimestamp;

    @Schema(example = "1000")
    private int sampleCount;

    @Schema(example = "16")
    private int featureCount;

    private ScoreStats scoreStats;

    public static ModelSummary from(ModelMetadata metadata) {
        return ModelSummary.builder()
                .algorithm(metadata.getAlgorithm())
                .threshold(metadata.getThreshold())
                .thresholdPercentile(metadata.getThresholdPercentile())
                .trainTimestamp(metadata.getTrainTimestamp())
                .sampleCount(metadata.getSampleCount())
                .featureCount(metadata.getFeatureCount())
                .scoreStats(metadata.getScoreStats())
                .build();
    }
}
