package com.logsense.anomaly.seeder;

import com.logsense.anomaly.model.MetricPoint;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class SampleMetricsGeneratorTest {

    private static final Instant START = Instant.parse("2026-10-18T09:00:00.750Z");

    private final SampleMetricsGenerator generator = new SampleMetricsGenerator();

    @Test
    void generate_sameSeed_sameBatch() {
        SampleBatch first = generator.generate(240, 60, 42L, START);
        SampleBatch second = generator.generate(240, 60, 42L, START);

        assertThat(second).isEqualTo(first);
    }

    @Test
    void generate_timestampsStepByInterval() {
        SampleBatch batch = generator.generate(3, 30, 1L, START);

        assertThat(batch.points()).extracting(MetricPoint::getTs)
                .containsExactly("2026-10-18T09:00:00", "2026-10-18T09:00:30", "2026-10-18T09:01:00");
    }

    @Test
    void generate_spikeCountIsTwoPercentWithFloorOfThree() {
        assertThat(generator.generate(240, 60, 42L, START).spikePositions()).hasSize(4);
        assertThat(generator.generate(50, 60, 42L, START).spikePositions()).hasSize(3);
        assertThat(generator.generate(2, 60, 42L, START).spikePositions()).hasSize(2);
        assertThat(generator.generate(1000, 60, 42L, START).spikePositions()).hasSize(20);
    }

    @Test
    void generate_spikePositionsSortedAndDistinct() {
        SampleBatch batch = generator.generate(500, 60, 3L, START);

        assertThat(batch.spikePositions()).isSorted().doesNotHaveDuplicates()
                .allSatisfy(p -> assertThat(p).isBetween(0, 499));
    }

    @Test
    void generate_valuesClippedAndRoundedToTwoDecimals() {
        SampleBatch batch = generator.generate(1000, 60, 9L, START);

        assertThat(batch.points()).allSatisfy(p -> {
            assertThat(p.getCpu()).isBetween(1.0, 99.0);
            assertThat(p.getRam()).isBetween(10.0, 95.0);
            assertThat(p.getDisk()).isBetween(1.0, 99.0);
            assertThat(p.getLatencyMs()).isBetween(20.0, 2000.0);
            assertThat(p.getCpu() * 100).isCloseTo(Math.rint(p.getCpu() * 100), within(1e-6));
        });
    }

    @Test
    void generate_rejectsBadArguments() {
        assertThatThrownBy(() -> generator.generate(0, 60, 1L, START))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> generator.generate(SampleMetricsGenerator.MAX_POINTS + 1, 60, 1L, START))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> generator.generate(10, 0, 1L, START))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
