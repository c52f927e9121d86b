package com.logsense.anomaly.engine;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ThresholdSelectorTest {

    @ParameterizedTest
    @CsvSource({
            "240, 0.05, 12",
            "100, 0.01, 1",
            "10, 0.05, 1",   // 0.5 rounds half-up
            "30, 0.01, 0",
            "7, 0.30, 2",
            "1, 0.30, 0",
            "1, 0.05, 0",
            "5, 0.30, 2"     // 1.5 rounds half-up
    })
    void anomalyCount_isRoundedProduct(int n, double contamination, int expected) {
        assertThat(ThresholdSelector.anomalyCount(n, contamination)).isEqualTo(expected);
    }

    @ParameterizedTest
    @ValueSource(doubles = {0.0, 0.009, 0.31, 1.0, -0.05, Double.NaN})
    void validate_outOfRange_throws(double contamination) {
        assertThatThrownBy(() -> ThresholdSelector.validate(contamination))
                .isInstanceOf(ContaminationRangeException.class)
                .hasMessageContaining("contamination")
                .extracting("field").isEqualTo("contamination");
    }

    @Test
    void validate_boundsAreInclusive() {
        assertThatCode(() -> ThresholdSelector.validate(0.01)).doesNotThrowAnyException();
        assertThatCode(() -> ThresholdSelector.validate(0.30)).doesNotThrowAnyException();
    }

    @Test
    void select_flagsHighestScores() {
        double[] scores = {0.01, 0.30, -0.05, 0.12, 0.02, 0.00, -0.10, 0.25, 0.03, 0.04};

        boolean[] flags = ThresholdSelector.select(scores, 0.20);

        assertThat(flags).containsExactly(false, true, false, false, false, false, false, true, false, false);
    }

    @Test
    void select_tiesBrokenByEarliestPosition() {
        double[] scores = {0.0, 0.0, 0.0, 0.0, 0.0, 0.0, 0.0, 0.0, 0.0, 0.0};

        boolean[] flags = ThresholdSelector.select(scores, 0.30);

        assertThat(flags).containsExactly(true, true, true, false, false, false, false, false, false, false);
    }

    @Test
    void select_tieAtCutoffPrefersEarlierRow() {
        double[] scores = {0.1, 0.2, 0.3, 0.2, 0.0};

        boolean[] flags = ThresholdSelector.select(scores, 0.30);

        // round(1.5) = 2: the 0.3 and the first of the two 0.2 scores
        assertThat(flags).containsExactly(false, true, true, false, false);
    }

    @Test
    void select_countRoundsToZero_flagsNothing() {
        boolean[] flags = ThresholdSelector.select(new double[]{0.4, 0.1, 0.2}, 0.05);

        assertThat(flags).containsOnly(false);
    }
}
