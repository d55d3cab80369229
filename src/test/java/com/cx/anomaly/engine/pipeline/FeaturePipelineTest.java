package com.cx.anomaly.engine.pipeline;

import com.cx.anomaly.engine.DetectorException;
import com.cx.anomaly.engine.ErrorKind;
import com.cx.anomaly.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class FeaturePipelineTest {

    private static final FeatureSpec SPEC = new FeatureSpec(
            List.of("csat", "aht_seconds"),
            List.of("channel"),
            List.of("interaction_id", "timestamp"),
            List.of());

    private static DataTable table(List<Map<String, Object>> rows) {
        return new DataTable(List.of("interaction_id", "timestamp", "csat", "aht_seconds", "channel"), rows);
    }

    private static Map<String, Object> row(String id, Double csat, Double aht, String channel) {
        Map<String, Object> row = new HashMap<>();
        row.put("interaction_id", id);
        row.put("timestamp", "2025-01-01T00:00:00Z");
        row.put("csat", csat);
        row.put("aht_seconds", aht);
        row.put("channel", channel);
        return row;
    }

    private static FeaturePipeline pipeline(ImputationStrategy strategy, ScalingMethod scaling) {
        return new FeaturePipeline(SPEC, strategy, 0.0, scaling);
    }

    @Test
    void fit_widthMatchesNumericPlusVocabulary() {
        DataTable train = table(List.of(
                row("a", 4.0, 300.0, "voice"),
                row("b", 3.0, 400.0, "chat"),
                row("c", 5.0, 200.0, null)));

        FittedPipeline fitted = pipeline(ImputationStrategy.MEAN, ScalingMethod.STANDARD).fit(train);

        // 2 numeric + {chat, missing, voice}
        assertThat(fitted.getFeatureWidth()).isEqualTo(5);
        assertThat(fitted.getFeatureNames())
                .containsExactly("csat", "aht_seconds", "channel_chat", "channel_missing", "channel_voice");
    }

    @Test
    void transform_outputHasFittedWidthAndNoMissingValues() {
        DataTable train = TestDataFactory.createNormalTable(200, 7L);
        List<Map<String, Object>> withGaps = new ArrayList<>(train.getRows());
        withGaps.set(0, TestDataFactory.createRow("gap", null, null, null, null, null, null, null, null, null));
        DataTable gappy = new DataTable(train.getColumns(), withGaps);

        FeaturePipeline pipeline = new FeaturePipeline(TestDataFactory.createProperties().featureSpec(),
                ImputationStrategy.MEDIAN, 0.0, ScalingMethod.STANDARD);
        FittedPipeline fitted = pipeline.fit(gappy);
        double[][] matrix = pipeline.transform(gappy);

        assertThat(matrix).hasNumberOfRows(200);
        for (double[] vector : matrix) {
            assertThat(vector).hasSize(fitted.getFeatureWidth());
            for (double v : vector) {
                assertThat(Double.isNaN(v) || Double.isInfinite(v)).isFalse();
            }
        }
    }

    @Test
    void transform_unknownCategoryEncodesAsAllZeros() {
        FeaturePipeline pipeline = pipeline(ImputationStrategy.MEAN, ScalingMethod.STANDARD);
        pipeline.fit(table(List.of(row("a", 4.0, 300.0, "voice"), row("b", 3.0, 400.0, "chat"))));

        double[][] unknown = pipeline.transform(table(List.of(row("x", 4.0, 300.0, "carrier-pigeon"))));
        double[][] other = pipeline.transform(table(List.of(row("y", 4.0, 300.0, "smoke-signal"))));

        assertThat(unknown[0][2]).isEqualTo(0.0);
        assertThat(unknown[0][3]).isEqualTo(0.0);
        assertThat(unknown[0]).containsExactly(other[0]);
    }

    @Test
    void transform_missingCategoryUsesMissingIndicator() {
        FeaturePipeline pipeline = pipeline(ImputationStrategy.MEAN, ScalingMethod.STANDARD);
        pipeline.fit(table(List.of(row("a", 4.0, 300.0, "voice"), row("b", 3.0, 400.0, null))));

        double[][] matrix = pipeline.transform(table(List.of(row("x", 4.0, 300.0, "  "))));

        // vocabulary: missing, voice
        assertThat(matrix[0][2]).isEqualTo(1.0);
        assertThat(matrix[0][3]).isEqualTo(0.0);
    }

    @Test
    void fit_meanImputationAndStandardScaling() {
        FeaturePipeline pipeline = pipeline(ImputationStrategy.MEAN, ScalingMethod.STANDARD);
        FittedPipeline fitted = pipeline.fit(table(List.of(
                row("a", 2.0, 100.0, "voice"),
                row("b", 4.0, 100.0, "voice"),
                row("c", null, 100.0, "voice"))));

        NumericColumn csat = fitted.getNumericColumns().get(0);
        assertThat(csat.fillValue()).isEqualTo(3.0);
        assertThat(csat.center()).isEqualTo(3.0);
        // imputed column {2, 4, 3}: population std = sqrt(2/3)
        assertThat(csat.scale()).isCloseTo(Math.sqrt(2.0 / 3.0), within(1e-12));

        // constant column keeps a unit scale
        assertThat(fitted.getNumericColumns().get(1).scale()).isEqualTo(1.0);
    }

    @Test
    void fit_minMaxScalingMapsTrainingRangeToUnitInterval() {
        FeaturePipeline pipeline = pipeline(ImputationStrategy.MEDIAN, ScalingMethod.MINMAX);
        DataTable train = table(List.of(
                row("a", 1.0, 100.0, "voice"),
                row("b", 5.0, 300.0, "voice"),
                row("c", 3.0, 200.0, "voice")));
        pipeline.fit(train);

        double[][] matrix = pipeline.transform(train);

        assertThat(matrix[0][0]).isEqualTo(0.0);
        assertThat(matrix[1][0]).isEqualTo(1.0);
        assertThat(matrix[2][1]).isEqualTo(0.5);
    }

    @Test
    void fit_constantImputationUsesConfiguredValue() {
        FeaturePipeline pipeline = new FeaturePipeline(SPEC, ImputationStrategy.CONSTANT, -1.0, ScalingMethod.MINMAX);
        FittedPipeline fitted = pipeline.fit(table(List.of(
                row("a", 2.0, 100.0, "voice"),
                row("b", null, 200.0, "voice"))));

        assertThat(fitted.getNumericColumns().get(0).fillValue()).isEqualTo(-1.0);
    }

    @Test
    void transform_doesNotChangeFittedState() {
        FeaturePipeline pipeline = pipeline(ImputationStrategy.MEAN, ScalingMethod.STANDARD);
        FittedPipeline fitted = pipeline.fit(table(List.of(row("a", 4.0, 300.0, "voice"), row("b", 3.0, 400.0, "chat"))));

        pipeline.transform(table(List.of(row("x", 1.0, 9000.0, "new"))));

        assertThat(pipeline.getFitted()).isSameAs(fitted);
        assertThat(fitted.getCategoricalColumns().get(0).vocabulary()).containsExactly("chat", "voice");
        assertThat(fitted.getNumericColumns().get(0).center()).isEqualTo(3.5);
    }

    @Test
    void transform_beforeFit_throwsNotFitted() {
        FeaturePipeline pipeline = pipeline(ImputationStrategy.MEAN, ScalingMethod.STANDARD);

        assertThatThrownBy(() -> pipeline.transform(table(List.of(row("a", 4.0, 300.0, "voice")))))
                .isInstanceOf(DetectorException.class)
                .extracting("kind")
                .isEqualTo(ErrorKind.NOT_FITTED);
    }

    @Test
    void fit_missingRequiredColumns_throwsSchemaErrorNamingThem() {
        DataTable incomplete = new DataTable(List.of("interaction_id", "csat"),
                List.of(Map.of("interaction_id", "a", "csat", 4.0)));

        assertThatThrownBy(() -> pipeline(ImputationStrategy.MEAN, ScalingMethod.STANDARD).fit(incomplete))
                .isInstanceOf(DetectorException.class)
                .hasMessageContaining("aht_seconds")
                .hasMessageContaining("channel")
                .hasMessageContaining("timestamp")
                .extracting("kind")
                .isEqualTo(ErrorKind.SCHEMA);
    }

    @Test
    void fit_identifierAndDroppedColumnsNeverBecomeFeatures() {
        FeatureSpec spec = new FeatureSpec(List.of("csat", "aht_seconds"), List.of("channel", "interaction_id"),
                List.of("interaction_id", "timestamp"), List.of("aht_seconds"));
        FeaturePipeline pipeline = new FeaturePipeline(spec, ImputationStrategy.MEAN, 0.0, ScalingMethod.STANDARD);

        FittedPipeline fitted = pipeline.fit(table(List.of(row("a", 4.0, 300.0, "voice"))));

        assertThat(fitted.getFeatureNames()).containsExactly("csat", "channel_voice");
    }
}
