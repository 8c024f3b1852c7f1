package io.caldera.core.frame;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class FrameTest {

    @Nested
    @DisplayName("Observation number")
    class Number {

        @Test
        void shouldParseTrailingDigitsOfRawName() {
            assertThat(new Frame("f20260101_0042", Map.of()).number()).isEqualTo(42);
        }

        @Test
        void shouldPreferDerivedObservationNumber() {
            Frame frame = new Frame("f20260101_0042", Map.of());
            frame.setDerived(DerivedHeaders.OBSERVATION_NUMBER, 7);

            assertThat(frame.number()).isEqualTo(7);
        }

        @Test
        void shouldReturnMinusOneWithoutDigits() {
            assertThat(new Frame("flatfield", Map.of()).number()).isEqualTo(-1);
        }
    }

    @Nested
    @DisplayName("inout")
    class InOut {

        @Test
        void shouldAppendSuffixAfterObservationNumber() {
            Frame frame = new Frame("f20260101_0012.fits", Map.of());

            Frame.InOut names = frame.inout("_ff");

            assertThat(names.in()).isEqualTo("f20260101_0012.fits");
            assertThat(names.out()).isEqualTo("f20260101_0012_ff");
        }

        @Test
        void shouldReplacePreviousSuffix() {
            Frame frame = new Frame("f20260101_0012", Map.of());
            frame.setFile("f20260101_0012_ff");

            assertThat(frame.inout("dk").out()).isEqualTo("f20260101_0012_dk");
        }

        @Test
        void shouldKeepDirectory() {
            Frame frame = new Frame("f20260101_0012", Map.of());
            frame.setFile("sub/f20260101_0012_ff");

            assertThat(frame.inout("sky").out()).isEqualTo("sub/f20260101_0012_sky");
        }
    }

    @Nested
    @DisplayName("Working files")
    class Files {

        @Test
        void shouldStartWithRawFile() {
            Frame frame = new Frame("f20260101_0001", Map.of());

            assertThat(frame.file()).isEqualTo("f20260101_0001");
            assertThat(frame.files()).containsExactly("f20260101_0001");
        }

        @Test
        void shouldRecordReplacedFilesAsIntermediates() {
            Frame frame = new Frame("raw", Map.of());
            frame.setFile("raw_a");
            frame.setFile("raw_b");

            assertThat(frame.intermediates()).containsExactly("raw_a");
        }

        @Test
        void shouldAddressFilesFromOne() {
            Frame frame = new Frame("raw", Map.of());
            frame.setFiles(List.of("a", "b"));

            assertThat(frame.file(1)).isEqualTo("a");
            assertThat(frame.file(2)).isEqualTo("b");
        }

        @Test
        void shouldRejectEmptyFileList() {
            Frame frame = new Frame("raw", Map.of());

            assertThatThrownBy(() -> frame.setFiles(List.of()))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Test
    void shouldLayerDerivedHeaderOverRawHeader() {
        Frame frame = new Frame("raw", Map.of("OBJECT", "M31", "EXPTIME", 10));
        frame.setDerived("OBJECT", "M32");

        assertThat(frame.headerValue("OBJECT")).isEqualTo("M32");
        assertThat(frame.headerContext())
                .containsEntry("OBJECT", "M32")
                .containsEntry("EXPTIME", 10);
        assertThat(frame.header()).containsEntry("OBJECT", "M31");
    }

    @Test
    void shouldExposeRecipeAndGroupAsDerivedValues() {
        Frame frame = new Frame("raw", Map.of());
        frame.setRecipe("QUICK_LOOK");
        frame.setGroupKey("12");

        assertThat(frame.headerValue(DerivedHeaders.RECIPE)).isEqualTo("QUICK_LOOK");
        assertThat(frame.headerValue(DerivedHeaders.GROUP)).isEqualTo("12");
    }

    @Test
    void shouldStayGoodUntilMarkedBad() {
        Frame frame = new Frame("raw", Map.of());
        assertThat(frame.isGood()).isTrue();

        frame.markBad();

        assertThat(frame.isGood()).isFalse();
    }
}
