package com.cx.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Service health")
public class HealthResponse {

    @Schema(description = "healthy when models are loaded, degraded otherwise", example = "healthy",
            allowableValues = {"healthy", "degraded"})
    private String status;

    private Instant timestamp;

    @Schema(description = "Whether a model snapshot is installed", example = "true")
    private boolean modelLoaded;

    @Schema(example = "1.0.0")
    private String version;
}
