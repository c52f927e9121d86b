package com.logsense.anomaly.service;

import com.logsense.anomaly.engine.SchemaException;
import com.logsense.anomaly.model.MetricPoint;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CsvMetricParserTest {

    private final CsvMetricParser parser = new CsvMetricParser();

    @Test
    void parse_readsRowsInFileOrder() throws Exception {
        String csv = """
                ts,cpu,ram,disk,latency_ms
                2026-10-18T09:00:00,31.2,55.0,20.1,118.4
                2026-10-18T09:01:00,29.8,54.6,19.9,1640
                """;

        List<MetricPoint> points = parser.parse(stream(csv));

        assertThat(points).hasSize(2);
        assertThat(points.get(0).getTs()).isEqualTo("2026-10-18T09:00:00");
        assertThat(points.get(0).getCpu()).isEqualTo(31.2);
        assertThat(points.get(1).getLatencyMs()).isEqualTo(1640.0);
    }

    @Test
    void parse_columnOrderAndExtraColumnsDoNotMatter() throws Exception {
        String csv = """
                host,latency_ms,disk,ram,cpu,ts
                web-1,120,20,55,30,2026-10-18T09:00:00
                """;

        List<MetricPoint> points = parser.parse(stream(csv));

        assertThat(points).singleElement().satisfies(p -> {
            assertThat(p.getCpu()).isEqualTo(30.0);
            assertThat(p.getRam()).isEqualTo(55.0);
            assertThat(p.getDisk()).isEqualTo(20.0);
            assertThat(p.getLatencyMs()).isEqualTo(120.0);
        });
    }

    @Test
    void parse_skipsBlankLinesAndTrimsValues() throws Exception {
        String csv = "ts,cpu,ram,disk,latency_ms\n"
                + "2026-10-18T09:00:00, 30 , 55 ,20,120\n"
                + "\n"
                + "2026-10-18T09:01:00,31,56,21,121\n";

        List<MetricPoint> points = parser.parse(stream(csv));

        assertThat(points).hasSize(2);
        assertThat(points.get(0).getCpu()).isEqualTo(30.0);
    }

    @Test
    void parse_missingColumn_throwsSchemaNamingIt() {
        String csv = """
                ts,cpu,ram,disk
                2026-10-18T09:00:00,30,55,20
                """;

        assertThatThrownBy(() -> parser.parse(stream(csv)))
                .isInstanceOf(SchemaException.class)
                .hasMessageContaining("latency_ms")
                .extracting("field").isEqualTo("file");
    }

    @Test
    void parse_nonNumericValue_throwsSchemaWithLine() {
        String csv = """
                ts,cpu,ram,disk,latency_ms
                2026-10-18T09:00:00,30,55,20,120
                2026-10-18T09:01:00,high,55,20,120
                """;

        assertThatThrownBy(() -> parser.parse(stream(csv)))
                .isInstanceOf(SchemaException.class)
                .hasMessageContaining("line 3")
                .hasMessageContaining("'cpu'");
    }

    @ParameterizedTest
    @ValueSource(strings = {"12f", "3d", "0x1p3", "NaN", "Infinity", "1e", "."})
    void parse_nonDecimalLiteral_throwsSchema(String literal) {
        String csv = "ts,cpu,ram,disk,latency_ms\n"
                + "2026-10-18T09:00:00," + literal + ",55,20,120\n";

        assertThatThrownBy(() -> parser.parse(stream(csv)))
                .isInstanceOf(SchemaException.class)
                .hasMessageContaining("'cpu'");
    }

    @Test
    void parse_acceptsSignedAndScientificDecimals() throws Exception {
        String csv = """
                ts,cpu,ram,disk,latency_ms
                2026-10-18T09:00:00,+30.5,.5,2.,1.2e3
                """;

        MetricPoint point = parser.parse(stream(csv)).get(0);

        assertThat(point.getCpu()).isEqualTo(30.5);
        assertThat(point.getRam()).isEqualTo(0.5);
        assertThat(point.getDisk()).isEqualTo(2.0);
        assertThat(point.getLatencyMs()).isEqualTo(1200.0);
    }

    @Test
    void parse_emptyValue_throwsSchema() {
        String csv = """
                ts,cpu,ram,disk,latency_ms
                2026-10-18T09:00:00,30,,20,120
                """;

        assertThatThrownBy(() -> parser.parse(stream(csv)))
                .isInstanceOf(SchemaException.class)
                .hasMessageContaining("'ram'");
    }

    @Test
    void parse_headerOnly_returnsEmptyList() throws Exception {
        assertThat(parser.parse(stream("ts,cpu,ram,disk,latency_ms\n"))).isEmpty();
    }

    private static InputStream stream(String csv) {
        return new ByteArrayInputStream(csv.getBytes(StandardCharsets.UTF_8));
    }
}
