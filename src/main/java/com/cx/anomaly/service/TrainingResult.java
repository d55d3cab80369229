package com.cx.anomaly.service;

import com.cx.anomaly.engine.pipeline.FittedPipeline;
import com.cx.anomaly.model.GlobalMetadata;
import com.cx.anomaly.registry.ModelArtifact;

import java.util.List;
import java.util.Map;

/**
 * Output of one training run. {@code trainingFlags} holds each model's flags on its own training rows.
 */
public record TrainingResult(FittedPipeline pipeline,
                             List<ModelArtifact> models,
                             Map<String, boolean[]> trainingFlags,
                             GlobalMetadata globalMetadata) {

    public double flaggedRate(String model) {
        boolean[] flags = trainingFlags.get(model);
        int flagged = 0;
        for (boolean flag : flags) {
            if (flag) flagged++;
        }
        return flags.length == 0 ? 0.0 : (double) flagged / flags.length;
    }
}
