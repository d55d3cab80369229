package com.cx.anomaly.testutil;

import com.cx.anomaly.config.DetectorProperties;
import com.cx.anomaly.engine.pipeline.DataTable;
import com.cx.anomaly.model.InteractionRecord;
import com.cx.anomaly.registry.RegistrySnapshot;
import com.cx.anomaly.repository.ArtifactRepository;
import com.cx.anomaly.repository.InteractionCsvRepository;
import com.cx.anomaly.service.DetectorFactory;
import com.cx.anomaly.service.ModelTrainingService;
import com.cx.anomaly.service.TrainingResult;
import org.mockito.Mockito;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Shared test data builders to avoid repeating construction boilerplate across test classes.
 */
public final class TestDataFactory {

    private TestDataFactory() {}

    /**
     * Default configuration with smaller forests so tests stay fast.
     */
    public static DetectorProperties createProperties() {
        DetectorProperties properties = new DetectorProperties();
        properties.getModels().get(0).getParams().setNumTrees(50);
        properties.getModels().get(1).getParams().setNeighbors(10);
        return properties;
    }

    public static InteractionRecord createRecord(String interactionId, double csat, double ahtSeconds, String channel) {
        return InteractionRecord.builder()
                .interactionId(interactionId)
                .timestamp(Instant.parse("2025-10-15T10:00:00Z"))
                .csat(csat)
                .ies(75.0)
                .complaints(0)
                .ahtSeconds(ahtSeconds)
                .holdTimeSeconds(30.0)
                .transfers(0)
                .channel(channel)
                .language("en")
                .queue("support")
                .build();
    }

    public static Map<String, Object> createRow(String interactionId, Double csat, Double ies, Double complaints,
                                                Double aht, Double hold, Double transfers,
                                                String channel, String language, String queue) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("interaction_id", interactionId);
        row.put("timestamp", "2025-01-01T10:00:00Z");
        row.put("csat", csat);
        row.put("ies", ies);
        row.put("complaints", complaints);
        row.put("aht_seconds", aht);
        row.put("hold_time_seconds", hold);
        row.put("transfers", transfers);
        row.put("channel", channel);
        row.put("language", language);
        row.put("queue", queue);
        return row;
    }

    /**
     * Well-behaved interactions drawn around typical values, reproducible for a given seed.
     */
    public static DataTable createNormalTable(int rows, long seed) {
        Random random = new Random(seed);
        String[] channels = {"voice", "chat", "email"};
        String[] languages = {"en", "es"};
        String[] queues = {"billing", "support"};
        List<Map<String, Object>> data = new ArrayList<>();
        for (int i = 0; i < rows; i++) {
            data.add(createRow("int_" + i,
                    Math.round((4.2 + 0.4 * random.nextGaussian()) * 10.0) / 10.0,
                    78 + 8 * random.nextGaussian(),
                    random.nextInt(10) == 0 ? 1.0 : 0.0,
                    320 + 60 * random.nextGaussian(),
                    Math.max(0, 35 + 15 * random.nextGaussian()),
                    random.nextInt(8) == 0 ? 1.0 : 0.0,
                    channels[random.nextInt(channels.length)],
                    languages[random.nextInt(languages.length)],
                    queues[random.nextInt(queues.length)]));
        }
        return new DataTable(InteractionRecord.COLUMNS, data);
    }

    public static ModelTrainingService createTrainingService(DetectorProperties properties) {
        return new ModelTrainingService(properties, new DetectorFactory(),
                Mockito.mock(ArtifactRepository.class), Mockito.mock(InteractionCsvRepository.class));
    }

    public static TrainingResult train(DetectorProperties properties, DataTable table) {
        return createTrainingService(properties).train(table);
    }

    public static RegistrySnapshot createSnapshot(long version, DetectorProperties properties, DataTable table) {
        TrainingResult result = train(properties, table);
        return new RegistrySnapshot(version, result.pipeline(), result.models(),
                properties.getEnsemble().getWeights(), result.globalMetadata(), Instant.now());
    }
}
