package com.fastbatch.core.report;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class BatchReportWriterTest {

    private final BatchReportWriter writer = new BatchReportWriter();

    private final BatchReport report = new BatchReport(1234, 8.1, 0.9, 0.25, 100, 480, 990,
            new BigDecimal("0.000153000000"));

    @Test
    void sameReport_serializesToSameBytes() {
        // when
        String first = writer.toJson(report);
        String second = writer.toJson(new BatchReport(1234, 8.1, 0.9, 0.25, 100, 480, 990,
                new BigDecimal("0.000153000000")));

        // then
        assertThat(first).isEqualTo(second);
    }

    @Test
    void fieldsInFixedOrder_costWrittenPlain() {
        // when
        String json = writer.toJson(report);

        // then
        assertThat(json.indexOf("\"totalDurationMs\""))
                .isLessThan(json.indexOf("\"throughputPerSec\""));
        assertThat(json.indexOf("\"throughputPerSec\"")).isLessThan(json.indexOf("\"successRate\""));
        assertThat(json.indexOf("\"successRate\"")).isLessThan(json.indexOf("\"retryRate\""));
        assertThat(json.indexOf("\"retryRate\"")).isLessThan(json.indexOf("\"p50\""));
        assertThat(json.indexOf("\"p99\"")).isLessThan(json.indexOf("\"cumulativeCost\""));
        assertThat(json).contains("0.000153000000")
                .doesNotContain("E-")
                .doesNotContain("cumulativeCostAsDouble");
    }

    @Test
    void write_createsParentDirectories(@TempDir Path dir) throws Exception {
        // given
        Path target = dir.resolve("reports/nightly/batch-1.json");

        // when
        writer.write(report, target);

        // then
        assertThat(target).exists();
        assertThat(Files.readString(target, StandardCharsets.UTF_8)).isEqualTo(writer.toJson(report));
    }
}
