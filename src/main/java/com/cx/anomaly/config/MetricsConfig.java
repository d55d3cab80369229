package com.cx.anomaly.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicInteger;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;
    private final AtomicInteger loadedModelCount;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
        this.loadedModelCount = registry.gauge("registry.models.loaded", new AtomicInteger(0));
    }

    public void recordScoringRequest(String selection, int records) {
        Counter.builder("scoring.requests.count")
                .tag("selection", selection)
                .register(registry)
                .increment();

        DistributionSummary.builder("scoring.batch.size")
                .tag("selection", selection)
                .register(registry)
                .record(records);
    }

    public void recordModelScores(String model, double[] scores, int anomalies) {
        DistributionSummary summary = DistributionSummary.builder("scoring.score")
                .tag("model", model)
                .register(registry);
        for (double score : scores) {
            summary.record(score);
        }

        Counter.builder("scoring.anomalies.count")
                .tag("model", model)
                .register(registry)
                .increment(anomalies);
    }

    public void recordReload(String status) {
        Counter.builder("registry.reload.count")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordNotification(String channel, String status) {
        Counter.builder("notification.sent.count")
                .tag("channel", channel)
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void updateLoadedModelCount(int count) {
        loadedModelCount.set(count);
    }
}
