package com.cx.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Result of scoring a batch of interactions")
public class ScoreResponse {

    @Schema(description = "Per-record results, in request order")
    private List<RecordScore> scores;

    @Schema(description = "Number of records scored", example = "2")
    private int totalRecords;

    @Schema(description = "Records flagged by the ensemble, or by any selected model when no ensemble ran", example = "1")
    private int anomaliesDetected;

    @Schema(description = "Server-side processing time", example = "3.4")
    private double processingTimeMs;
}
