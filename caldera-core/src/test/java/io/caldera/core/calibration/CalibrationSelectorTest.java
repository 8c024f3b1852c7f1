package io.caldera.core.calibration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;

import io.caldera.core.frame.DerivedHeaders;
import io.caldera.core.instrument.DefaultCalibrationRuleProvider;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CalibrationSelectorTest {

    private static final String TIME = DerivedHeaders.TIME;

    @TempDir Path tempDir;

    private CalibrationIndex darks;
    private CalibrationSelector selector;

    @BeforeEach
    void setUp() throws Exception {
        CalibrationIndexes indexes =
                new CalibrationIndexes(
                        new DefaultCalibrationRuleProvider(Map.of("dark", IndexMode.DYNAMIC)),
                        new CalibrationSearchPath(tempDir, List.of()));
        darks = CalibrationIndex.inMemory("dark", IndexRules.parse(List.of("EXPTIME ==")), TIME);
        indexes.register(darks);
        selector = new CalibrationSelector(indexes);
    }

    @Test
    void shouldSelectNearestAndBindIt() throws Exception {
        darks.add("dark_10", context(10, 30));
        darks.add("dark_20", context(20, 30));
        darks.add("dark_30", context(30, 30));

        String chosen = selector.select("dark", context(22, 30));

        assertThat(chosen).isEqualTo("dark_20");
        assertThat(selector.current("dark")).hasValue("dark_20");
    }

    @Test
    void shouldKeepBoundCalibrationWhileStillSuitable() throws Exception {
        darks.add("dark_10", context(10, 30));
        selector.select("dark", context(10, 30));
        darks.add("dark_29", context(29, 30));

        assertThat(selector.select("dark", context(30, 30))).isEqualTo("dark_10");
    }

    @Test
    void shouldReselectWhenBindingBecomesUnsuitable() throws Exception {
        darks.add("dark_10", context(10, 30));
        darks.add("dark_12", context(12, 60));
        selector.select("dark", context(10, 30));

        assertThat(selector.select("dark", context(11, 60))).isEqualTo("dark_12");
    }

    @Test
    void shouldFailWhenNothingIsSuitable() throws Exception {
        darks.add("dark_10", context(10, 60));

        assertThatThrownBy(() -> selector.select("dark", context(10, 30)))
                .isInstanceOf(NoSuitableCalibrationException.class)
                .hasMessageContaining("No suitable dark");
    }

    @Test
    void shouldFailForRoleWithoutRulesFile() {
        assertThatThrownBy(() -> selector.select("flat", context(10, 30)))
                .isInstanceOf(NoSuitableCalibrationException.class)
                .hasMessageContaining("rules.flat");
    }

    @Test
    void shouldOpenIndexFromRulesOnSearchPath() throws Exception {
        Files.writeString(tempDir.resolve("rules.flat"), "FILTER eq\n");
        Files.writeString(
                tempDir.resolve("index.flat"), "#name DR_TIME FILTER\nflat_3 3 J\nflat_4 4 H\n");

        assertThat(selector.select("flat", Map.of(TIME, 10.0, "FILTER", "J"))).isEqualTo("flat_3");
    }

    @Test
    void shouldNeverReplaceOrValidatePinnedRole() throws Exception {
        // GIVEN
        CalibrationIndexes indexes = mock(CalibrationIndexes.class);
        CalibrationSelector pinnedSelector = new CalibrationSelector(indexes);
        pinnedSelector.pin("dark", "my_dark");

        // WHEN
        pinnedSelector.bind("dark", "other_dark");
        String chosen = pinnedSelector.select("dark", context(10, 30));

        // THEN
        assertThat(chosen).isEqualTo("my_dark");
        assertThat(pinnedSelector.isPinned("dark")).isTrue();
        verifyNoInteractions(indexes);
    }

    @Test
    void shouldReadScalarColumnOfSelectedEntry() throws Exception {
        CalibrationIndex noise =
                CalibrationIndex.inMemory("readnoise", IndexRules.parse(List.of("VALUE")), TIME);
        noise.add("rn_1", Map.of(TIME, 1.0, "VALUE", 8.5));
        selector.getIndexes().register(noise);

        assertThat(selector.column("readnoise", Map.of(TIME, 2.0), "VALUE")).isEqualTo("8.5");
    }

    @Test
    void shouldFallBackWhenNothingIsFound() {
        assertThat(selector.selectOrDefault("dark", context(1, 30), () -> "none")).isEqualTo("none");
        assertThat(selector.find("dark", context(1, 30))).isEmpty();
    }

    @Test
    void shouldParseOverridesIntoPins() {
        selector.applyOverrides(CalibrationOverrides.parse("Dark=d_12, readnoise=8.5"));

        assertThat(selector.bindings())
                .containsEntry("dark", new CalibrationSelector.Binding("d_12", true))
                .containsEntry("readnoise", new CalibrationSelector.Binding("8.5", true));
    }

    private static Map<String, Object> context(double time, double exptime) {
        return Map.of(TIME, time, "EXPTIME", exptime);
    }
}
