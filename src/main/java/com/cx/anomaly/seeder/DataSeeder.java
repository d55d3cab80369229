package com.cx.anomaly.seeder;

import com.cx.anomaly.config.DetectorProperties;
import com.cx.anomaly.engine.pipeline.DataTable;
import com.cx.anomaly.repository.InteractionCsvRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Profile;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.nio.file.Paths;
import java.time.LocalDate;

/**
 * Writes synthetic training and inference CSVs for local testing.
 * Only runs when the "seed" Spring profile is active.
 *
 * Run with:  mvn spring-boot:run -Dspring-boot.run.profiles=seed
 *
 *   - training set: 930 normal + 70 anomalous interactions (7% contamination)
 *   - inference set: 950 normal + 50 anomalous interactions (5% contamination)
 *
 * Combine with the train profile (seed,train) to seed and train in one run.
 */
@Component
@Profile("seed")
@Order(1)
public class DataSeeder implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(DataSeeder.class);

    static final long SEED = 42L; // fixed seed for reproducibility

    private final InteractionCsvRepository csvRepository;
    private final DetectorProperties properties;

    public DataSeeder(InteractionCsvRepository csvRepository, DetectorProperties properties) {
        this.csvRepository = csvRepository;
        this.properties = properties;
    }

    @Override
    public void run(String... args) {
        log.info("=== Seeding synthetic interaction data ===");
        MockDataGenerator generator = new MockDataGenerator(SEED);

        DataTable train = generator.generate(930, 70, "tra", LocalDate.of(2025, 1, 1));
        csvRepository.write(Paths.get(properties.getData().getTrainPath()), train);

        DataTable inference = generator.generate(950, 50, "inf", LocalDate.of(2025, 2, 1));
        csvRepository.write(Paths.get(properties.getData().getInferencePath()), inference);

        log.info("=== Seeding complete: {} training rows, {} inference rows ===", train.size(), inference.size());
    }
}
