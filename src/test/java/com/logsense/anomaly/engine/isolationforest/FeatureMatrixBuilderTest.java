package com.logsense.anomaly.engine.isolationforest;

import com.logsense.anomaly.engine.EmptyBatchException;
import com.logsense.anomaly.engine.SchemaException;
import com.logsense.anomaly.model.MetricPoint;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.logsense.anomaly.testutil.TestDataFactory.point;
import static com.logsense.anomaly.testutil.TestDataFactory.ts;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FeatureMatrixBuilderTest {

    @Test
    void build_columnsInFixedOrder() {
        List<MetricPoint> batch = List.of(
                point(ts(0), 1.0, 2.0, 3.0, 4.0),
                point(ts(1), 5.0, 6.0, 7.0, 8.0));

        double[][] matrix = FeatureMatrixBuilder.build(batch);

        assertThat(matrix).hasDimensions(2, 4);
        assertThat(matrix[0]).containsExactly(1.0, 2.0, 3.0, 4.0);
        assertThat(matrix[1]).containsExactly(5.0, 6.0, 7.0, 8.0);
    }

    @Test
    void columnOrder_isCpuRamDiskLatency() {
        assertThat(MetricFeature.values()).extracting(MetricFeature::fieldName)
                .containsExactly("cpu", "ram", "disk", "latency_ms");
    }

    @Test
    void build_emptyBatch_throwsEmptyBatch() {
        assertThatThrownBy(() -> FeatureMatrixBuilder.build(List.of()))
                .isInstanceOf(EmptyBatchException.class);
        assertThatThrownBy(() -> FeatureMatrixBuilder.build(null))
                .isInstanceOf(EmptyBatchException.class);
    }

    @Test
    void build_missingField_throwsSchemaNamingTheField() {
        List<MetricPoint> batch = List.of(
                point(ts(0), 1.0, 2.0, 3.0, 4.0),
                MetricPoint.builder().ts(ts(1)).cpu(1.0).disk(3.0).latencyMs(4.0).build());

        assertThatThrownBy(() -> FeatureMatrixBuilder.build(batch))
                .isInstanceOf(SchemaException.class)
                .hasMessageContaining("points[1]")
                .hasMessageContaining("'ram'")
                .extracting("field").isEqualTo("points[1].ram");
    }

    @Test
    void build_missingTimestamp_throwsSchema() {
        List<MetricPoint> batch = List.of(MetricPoint.builder().cpu(1.0).ram(2.0).disk(3.0).latencyMs(4.0).build());

        assertThatThrownBy(() -> FeatureMatrixBuilder.build(batch))
                .isInstanceOf(SchemaException.class)
                .hasMessageContaining("'ts'");
    }

    @Test
    void build_nonFiniteValue_throwsSchema() {
        List<MetricPoint> batch = List.of(point(ts(0), 1.0, 2.0, Double.NaN, 4.0));

        assertThatThrownBy(() -> FeatureMatrixBuilder.build(batch))
                .isInstanceOf(SchemaException.class)
                .hasMessageContaining("'disk'");
    }

    @Test
    void build_nullPoint_throwsSchema() {
        List<MetricPoint> batch = new ArrayList<>();
        batch.add(null);

        assertThatThrownBy(() -> FeatureMatrixBuilder.build(batch))
                .isInstanceOf(SchemaException.class);
    }
}
