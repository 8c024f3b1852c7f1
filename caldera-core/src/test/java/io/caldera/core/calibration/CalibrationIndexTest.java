package io.caldera.core.calibration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CalibrationIndexTest {

    private static final String TIME = "DR_TIME";

    @TempDir Path tempDir;

    private final IndexRules rules = IndexRules.parse(List.of("EXPTIME ==", "READMODE eq", TIME));

    @Test
    void shouldChooseNearestCompatibleEntry() throws Exception {
        // GIVEN
        CalibrationIndex index = CalibrationIndex.inMemory("dark", rules, TIME);
        index.add("dark_10", header(10, 30));
        index.add("dark_20", header(20, 30));
        index.add("dark_30", header(30, 30));

        // WHEN
        var chosen = index.choose(header(22, 30), SearchMode.NEAREST);

        // THEN
        assertThat(chosen).map(IndexEntry::name).hasValue("dark_20");
    }

    @Test
    void shouldSkipIncompatibleEntries() throws Exception {
        CalibrationIndex index = CalibrationIndex.inMemory("dark", rules, TIME);
        index.add("dark_10", header(10, 30));
        index.add("dark_20", header(20, 60));

        var chosen = index.choose(header(22, 30), SearchMode.NEAREST);

        assertThat(chosen).map(IndexEntry::name).hasValue("dark_10");
    }

    @Test
    void shouldBreakTiesByInsertionOrder() throws Exception {
        CalibrationIndex index = CalibrationIndex.inMemory("dark", rules, TIME);
        index.add("dark_30", header(30, 30));
        index.add("dark_10", header(10, 30));

        var chosen = index.choose(header(20, 30), SearchMode.NEAREST);

        assertThat(chosen).map(IndexEntry::name).hasValue("dark_30");
    }

    @Test
    void shouldOnlyLookBackInEarlierMode() throws Exception {
        CalibrationIndex index = CalibrationIndex.inMemory("dark", rules, TIME);
        index.add("dark_10", header(10, 30));
        index.add("dark_21", header(21, 30));

        var chosen = index.choose(header(20, 30), SearchMode.EARLIER);

        assertThat(chosen).map(IndexEntry::name).hasValue("dark_10");
    }

    @Test
    void shouldReturnEmptyWhenNothingIsCompatible() throws Exception {
        CalibrationIndex index = CalibrationIndex.inMemory("dark", rules, TIME);
        index.add("dark_10", header(10, 60));

        assertThat(index.choose(header(10, 30), SearchMode.NEAREST)).isEmpty();
    }

    @Test
    void shouldRejectHeaderMissingRuleKey() {
        CalibrationIndex index = CalibrationIndex.inMemory("dark", rules, TIME);

        assertThatThrownBy(() -> index.add("dark_1", Map.of(TIME, 1.0, "EXPTIME", 30)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("READMODE");
        assertThat(index.entries()).isEmpty();
    }

    @Test
    void shouldLetLaterRowSupersedeEarlierRowOfSameName() throws Exception {
        CalibrationIndex index = CalibrationIndex.inMemory("dark", rules, TIME);
        index.add("dark_a", header(10, 30));
        index.add("dark_b", header(15, 30));
        index.add("dark_a", header(12, 60));

        assertThat(index.entries()).extracting(IndexEntry::name).containsExactly("dark_b", "dark_a");
        assertThat(index.verify("dark_a", header(12, 30))).isEqualTo(Verdict.UNSUITABLE);
        assertThat(index.verify("dark_z", header(12, 30))).isEqualTo(Verdict.UNKNOWN);
    }

    @Test
    void shouldPersistRowsAndReadThemBack() throws Exception {
        // GIVEN
        Path file = tempDir.resolve("index.dark");
        CalibrationIndex index = CalibrationIndex.open("dark", rules, TIME, file, false);
        index.add("dark_10", Map.of(TIME, 10.0, "EXPTIME", 30L, "READMODE", "FAST READ"));
        index.add("dark_20", header(20, 30));

        // WHEN
        CalibrationIndex reopened = CalibrationIndex.open("dark", rules, TIME, file, false);

        // THEN
        assertThat(Files.readAllLines(file).get(0)).isEqualTo("#name DR_TIME EXPTIME READMODE");
        assertThat(reopened.entries()).extracting(IndexEntry::name).containsExactly("dark_10", "dark_20");
        assertThat(reopened.entry("dark_10").orElseThrow().value("READMODE")).isEqualTo("FAST READ");
    }

    @Test
    void shouldRefuseWritesToReadOnlyIndex() throws Exception {
        CalibrationIndex index =
                CalibrationIndex.open("dark", rules, TIME, tempDir.resolve("index.dark"), true);

        assertThatThrownBy(() -> index.add("dark_1", header(1, 30)))
                .isInstanceOf(IllegalStateException.class);
    }

    private static Map<String, Object> header(double time, double exptime) {
        return Map.of(TIME, time, "EXPTIME", exptime, "READMODE", "FAST");
    }
}
