package io.caldera.serialization;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import io.caldera.core.execution.RecipeStatus;
import io.caldera.core.pipeline.RunStatistics;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class RunSummaryTest {

    private static final Instant START = Instant.parse("2026-01-01T06:00:00Z");

    @TempDir Path tempDir;

    @Test
    void of_copiesCountsAndExitCode() {
        RunStatistics stats = new RunStatistics();
        stats.record(RecipeStatus.OK);
        stats.record(RecipeStatus.OK);
        stats.record(RecipeStatus.ERROR);

        RunSummary summary = RunSummary.of(stats, "20260101", false, START, START.plusSeconds(90));

        assertThat(summary.ok()).isEqualTo(2);
        assertThat(summary.error()).isEqualTo(1);
        assertThat(summary.total()).isEqualTo(3);
        assertThat(summary.exitCode()).isEqualTo(1);
        assertThat(summary.duration()).isEqualTo(Duration.ofSeconds(90));
        assertThat(summary.message()).isEqualTo("Processed 3 recipes of which 1 completed with an error");
    }

    @Test
    void toJson_writesIsoTimes() throws Exception {
        RunSummary summary = RunSummary.of(new RunStatistics(), "20260101", true, START, START.plusSeconds(5));

        JsonNode root = RecipeJson.createMapper().readTree(RecipeJson.toJson(summary));

        assertThat(root.get("startedAt").asText()).isEqualTo("2026-01-01T06:00:00Z");
        assertThat(root.get("duration").asText()).isEqualTo("PT5S");
        assertThat(root.get("batch").asBoolean()).isTrue();
    }

    @Test
    void writeSummary_createsParentAndReadsBack() throws Exception {
        RunStatistics stats = new RunStatistics();
        stats.record(RecipeStatus.TERMINATED);
        stats.markLoopTimedOut();
        RunSummary summary = RunSummary.of(stats, "20260101", false, START, START.plusMillis(250));
        Path file = tempDir.resolve("logs/summary.json");

        RecipeJson.writeSummary(summary, file);

        assertThat(file).exists();
        assertThat(RecipeJson.summaryFromJson(Files.readString(file))).isEqualTo(summary);
    }
}
