package com.cx.anomaly.controller;

import com.cx.anomaly.model.HealthResponse;
import com.cx.anomaly.registry.ModelRegistry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@Tag(name = "Service", description = "Service health and information")
public class HealthController {

    private final ModelRegistry registry;
    private final String version;

    public HealthController(ModelRegistry registry,
                            @Value("${cx.version:1.0.0}") String version) {
        this.registry = registry;
        this.version = version;
    }

    @Operation(summary = "Service health",
            description = "healthy when a model snapshot is installed, degraded otherwise. Always 200.")
    @GetMapping("/health")
    public ResponseEntity<HealthResponse> health() {
        boolean loaded = registry.isLoaded();
        return ResponseEntity.ok(HealthResponse.builder()
                .status(loaded ? "healthy" : "degraded")
                .timestamp(Instant.now())
                .modelLoaded(loaded)
                .version(version)
                .build());
    }

    @Operation(summary = "Service information")
    @GetMapping("/")
    public ResponseEntity<Map<String, Object>> root() {
        Map<String, String> endpoints = new LinkedHashMap<>();
        endpoints.put("health", "/health");
        endpoints.put("models", "/models");
        endpoints.put("score", "/score?model=iforest|lof|both");
        endpoints.put("reload", "/reload");
        endpoints.put("docs", "/swagger-ui.html");

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("service", "CX Anomaly Detector API");
        body.put("version", version);
        body.put("endpoints", endpoints);
        return ResponseEntity.ok(body);
    }
}
