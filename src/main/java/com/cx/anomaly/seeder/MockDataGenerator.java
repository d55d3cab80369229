package com.cx.anomaly.seeder;

import com.cx.anomaly.engine.pipeline.DataTable;
import com.cx.anomaly.model.InteractionRecord;

import java.time.Duration;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Synthetic interaction data with a known share of anomalous rows.
 *
 * Normal rows: good satisfaction, short handle and hold times, rare complaints and transfers.
 * Anomalous rows come in three shapes: poor satisfaction, excessive handle time, and several
 * bad metrics at once. Rows are shuffled and then given sequential ids.
 */
public class MockDataGenerator {

    private static final String[] CHANNELS = {"voice", "chat", "email"};
    private static final String[] LANGUAGES = {"en", "es", "fr", "de"};
    private static final String[] QUEUES = {"billing", "support", "sales"};

    private final Random random;

    public MockDataGenerator(long seed) {
        this.random = new Random(seed);
    }

    public DataTable generate(int normalCount, int anomalyCount, String idPrefix, LocalDate startDate) {
        List<Map<String, Object>> rows = new ArrayList<>(normalCount + anomalyCount);
        ZonedDateTime day = startDate.atStartOfDay(ZoneOffset.UTC);
        for (int i = 0; i < normalCount; i++) {
            rows.add(normalRow(day));
            if (i % 50 == 0) day = day.plusDays(1);
        }
        day = startDate.atStartOfDay(ZoneOffset.UTC);
        for (int i = 0; i < anomalyCount; i++) {
            rows.add(anomalousRow(day));
            if (i % 3 == 0) day = day.plusDays(1);
        }
        Collections.shuffle(rows, random);
        for (int i = 0; i < rows.size(); i++) {
            rows.get(i).put("interaction_id", String.format("%s_%04d", idPrefix, i + 1));
        }
        return new DataTable(InteractionRecord.COLUMNS, rows);
    }

    private Map<String, Object> normalRow(ZonedDateTime day) {
        double csat = clip(gaussian(4.2, 0.5), 1.0, 5.0);
        double ies = clip(gaussian(78, 10), 0, 100);
        int complaints = random.nextInt(10) == 0 ? 1 : 0;
        double aht = Math.max(120, gaussian(320, 80));
        double hold = Math.max(0, gaussian(35, 20));
        int transfers = random.nextInt(8) == 0 ? 1 : 0;
        return row(day, csat, ies, complaints, aht, hold, transfers,
                pick(CHANNELS, 0.6, 0.3, 0.1), pick(LANGUAGES, 0.6, 0.2, 0.1, 0.1),
                pick(QUEUES, 0.4, 0.5, 0.1));
    }

    private Map<String, Object> anomalousRow(ZonedDateTime day) {
        double csat;
        double ies;
        int complaints;
        double aht;
        double hold;
        int transfers;
        switch (random.nextInt(3)) {
            case 0 -> { // poor satisfaction
                csat = uniform(1.0, 2.5);
                ies = uniform(30, 55);
                complaints = choose(1, 2, 2, 3);
                aht = uniform(400, 650);
                hold = uniform(60, 150);
                transfers = choose(1, 1, 2, 2, 3);
            }
            case 1 -> { // excessive handle time
                csat = uniform(2.5, 3.5);
                ies = uniform(40, 60);
                complaints = choose(1, 2);
                aht = uniform(600, 900);
                hold = uniform(100, 200);
                transfers = choose(2, 2, 3, 3, 4);
            }
            default -> { // several issues at once
                csat = uniform(1.5, 2.8);
                ies = uniform(25, 50);
                complaints = choose(2, 2, 3, 3, 4);
                aht = uniform(550, 800);
                hold = uniform(120, 220);
                transfers = choose(2, 3, 3, 4);
            }
        }
        return row(day, csat, ies, complaints, aht, hold, transfers,
                pick(CHANNELS, 0.7, 0.25, 0.05), pick(LANGUAGES, 0.6, 0.2, 0.1, 0.1),
                pick(QUEUES, 0.5, 0.45, 0.05));
    }

    private Map<String, Object> row(ZonedDateTime day, double csat, double ies, int complaints,
                                    double aht, double hold, int transfers,
                                    String channel, String language, String queue) {
        ZonedDateTime timestamp = day.plus(Duration.ofHours(8 + random.nextInt(10)))
                .plusMinutes(random.nextInt(60))
                .plusSeconds(random.nextInt(60));
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("interaction_id", null);
        row.put("timestamp", timestamp.toInstant().toString());
        row.put("csat", round1(csat));
        row.put("ies", round1(ies));
        row.put("complaints", (double) complaints);
        row.put("aht_seconds", Math.floor(aht));
        row.put("hold_time_seconds", Math.floor(hold));
        row.put("transfers", (double) transfers);
        row.put("channel", channel);
        row.put("language", language);
        row.put("queue", queue);
        return row;
    }

    private double gaussian(double mean, double std) {
        return mean + std * random.nextGaussian();
    }

    private double uniform(double low, double high) {
        return low + (high - low) * random.nextDouble();
    }

    private int choose(int... options) {
        return options[random.nextInt(options.length)];
    }

    private String pick(String[] values, double... probabilities) {
        double r = random.nextDouble();
        double cumulative = 0.0;
        for (int i = 0; i < values.length; i++) {
            cumulative += probabilities[i];
            if (r < cumulative) return values[i];
        }
        return values[values.length - 1];
    }

    private static double clip(double value, double low, double high) {
        return Math.min(high, Math.max(low, value));
    }

    private static double round1(double value) {
        return Math.round(value * 10.0) / 10.0;
    }
}
