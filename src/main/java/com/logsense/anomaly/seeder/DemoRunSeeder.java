package com.logsense.anomaly.seeder;

import com.logsense.anomaly.model.DetectResponse;
import com.logsense.anomaly.service.DetectionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Records a few demo runs so the history endpoints have something to show.
 * Only runs when the "seed" Spring profile is active.
 *
 * Run with:  mvn spring-boot:run -Dspring-boot.run.profiles=seed
 */
@Component
@Profile("seed")
public class DemoRunSeeder implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(DemoRunSeeder.class);

    private static final long[] DEMO_SEEDS = {42L, 7L, 2024L};

    private final SampleMetricsGenerator generator;
    private final DetectionService detectionService;

    public DemoRunSeeder(SampleMetricsGenerator generator, DetectionService detectionService) {
        this.generator = generator;
        this.detectionService = detectionService;
    }

    @Override
    public void run(String... args) {
        log.info("=== Seeding demo detection runs ===");

        for (long seed : DEMO_SEEDS) {
            SampleBatch batch = generator.generate(240, 60, seed, Instant.now());
            DetectResponse response = detectionService.detect(batch.points(), null);
            log.info("Demo run seed={}: run_id={}, anomalies={}, spikes injected={}",
                    seed, response.getRunId(), response.getAnomaliesFound(), batch.spikePositions().size());
        }

        log.info("=== Demo seeding complete ===");
    }
}
