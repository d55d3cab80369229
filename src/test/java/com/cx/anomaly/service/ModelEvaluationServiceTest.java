package com.cx.anomaly.service;

import com.cx.anomaly.config.DetectorProperties;
import com.cx.anomaly.config.MetricsConfig;
import com.cx.anomaly.engine.pipeline.DataTable;
import com.cx.anomaly.registry.ModelRegistry;
import com.cx.anomaly.repository.ArtifactRepository;
import com.cx.anomaly.testutil.TestDataFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.micrometer.tracing.Tracer;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ModelEvaluationServiceTest {

    @Test
    void pearson_linearSeries_isPlusOrMinusOne() {
        double[] x = {1, 2, 3, 4, 5};

        assertThat(ModelEvaluationService.pearson(x, new double[]{2, 4, 6, 8, 10})).isCloseTo(1.0, within(1e-12));
        assertThat(ModelEvaluationService.pearson(x, new double[]{5, 4, 3, 2, 1})).isCloseTo(-1.0, within(1e-12));
    }

    @Test
    void pearson_constantSeries_isNaN() {
        assertThat(ModelEvaluationService.pearson(new double[]{1, 2, 3}, new double[]{7, 7, 7})).isNaN();
    }

    @Test
    void evaluate_reportsPerModelStatsAndCorrelation() {
        DetectorProperties properties = TestDataFactory.createProperties();
        ModelRegistry registry = new ModelRegistry(Mockito.mock(ArtifactRepository.class), properties,
                new MetricsConfig(new SimpleMeterRegistry()), Tracer.NOOP);
        DataTable table = TestDataFactory.createNormalTable(150, 21L);

        ModelEvaluationService.EvaluationReport report = new ModelEvaluationService(registry)
                .evaluate(TestDataFactory.createSnapshot(1, properties, table), table);

        assertThat(report.totalSamples()).isEqualTo(150);
        assertThat(report.models()).containsOnlyKeys("iforest", "lof");
        ModelEvaluationService.ModelEvaluation iforest = report.models().get("iforest");
        assertThat(iforest.min()).isLessThanOrEqualTo(iforest.median());
        assertThat(iforest.median()).isLessThanOrEqualTo(iforest.max());
        assertThat(iforest.anomalyRate()).isEqualTo(iforest.anomalies() / 150.0);
        assertThat(report.correlation()).isBetween(-1.0, 1.0);
    }
}
