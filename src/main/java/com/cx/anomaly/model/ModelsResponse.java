package com.cx.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Models in the installed snapshot")
public class ModelsResponse {

    private Map<String, ModelSummary> models;

    @Schema(description = "True when at least two models are loaded", example = "true")
    private boolean ensembleAvailable;

    private Instant loadedAt;
}
