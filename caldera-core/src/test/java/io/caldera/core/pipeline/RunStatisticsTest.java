package io.caldera.core.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.caldera.core.execution.RecipeStatus;
import org.junit.jupiter.api.Test;

class RunStatisticsTest {

    @Test
    void shouldReportNothingForEmptyRun() {
        RunStatistics stats = new RunStatistics();

        assertThat(stats.summary()).isEmpty();
        assertThat(stats.exitCode()).isZero();
    }

    @Test
    void shouldSummariseSingleRecipe() {
        assertThat(single(RecipeStatus.OK)).isEqualTo("Processed one recipe which completed successfully");
        assertThat(single(RecipeStatus.TERMINATED)).isEqualTo("Processed one recipe which was terminated early");
        assertThat(single(RecipeStatus.BAD_ENGINE))
                .isEqualTo("Processed one recipe which had a bad algorithm engine");
        assertThat(single(RecipeStatus.ERROR)).isEqualTo("Processed one recipe which completed with an error");
    }

    @Test
    void shouldSummariseSeveralRecipes() {
        RunStatistics stats = new RunStatistics();
        stats.record(RecipeStatus.OK);
        stats.record(RecipeStatus.TERMINATED);
        stats.record(RecipeStatus.TERMINATED);

        assertThat(stats.summary()).isEqualTo("Processed 3 recipes of which 2 were terminated early");
        assertThat(stats.good()).isEqualTo(3);
        assertThat(stats.exitCode()).isZero();

        stats.record(RecipeStatus.BAD_ENGINE);

        assertThat(stats.summary()).isEqualTo("Processed 4 recipes of which 1 completed with an error");
        assertThat(stats.exitCode()).isEqualTo(1);
    }

    @Test
    void shouldFailRunWhenLoopTimedOut() {
        RunStatistics stats = new RunStatistics();
        stats.markLoopTimedOut();

        assertThat(stats.summary()).isEqualTo("No recipes processed before the data loop timed out");
        assertThat(stats.exitCode()).isEqualTo(1);

        stats.record(RecipeStatus.OK);
        stats.record(RecipeStatus.OK);

        assertThat(stats.summary()).isEqualTo("Processed 2 recipes successfully");
        assertThat(stats.exitCode()).isEqualTo(1);
    }

    @Test
    void shouldRejectStatusesThatAbortTheRun() {
        RunStatistics stats = new RunStatistics();

        assertThatThrownBy(() -> stats.record(RecipeStatus.FATAL)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> stats.record(RecipeStatus.USER_ABORT))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(stats.total()).isZero();
    }

    private static String single(RecipeStatus status) {
        RunStatistics stats = new RunStatistics();
        stats.record(status);
        return stats.summary();
    }
}
