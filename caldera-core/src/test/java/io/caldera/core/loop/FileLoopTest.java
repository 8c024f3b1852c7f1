package io.caldera.core.loop;

import static io.caldera.core.loop.LoopTestSupport.UTDATE;
import static io.caldera.core.loop.LoopTestSupport.data;
import static io.caldera.core.loop.LoopTestSupport.frames;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.caldera.core.exception.LoopException;
import io.caldera.core.frame.Frame;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileLoopTest {

    @TempDir Path tempDir;

    @Test
    void shouldProcessNamedFilesInOrder() throws Exception {
        Files.writeString(tempDir.resolve("arc.fits"), "a");
        Files.writeString(tempDir.resolve("f20260101_0012.fits"), "b");
        FileLoop loop = new FileLoop(data(tempDir, tempDir));
        LoopCursor cursor = LoopCursor.ofFiles(List.of("f20260101_0012.fits", "arc.fits"));

        Frame first = loop.next(frames(), UTDATE, cursor, false).orElseThrow();
        Frame second = loop.next(frames(), UTDATE, cursor, false).orElseThrow();

        assertThat(first.number()).isEqualTo(12);
        assertThat(second.raw()).isEqualTo("arc.fits");
        assertThat(loop.next(frames(), UTDATE, cursor, false)).isEmpty();
    }

    @Test
    void shouldFailOnMissingFileWithoutSkip() {
        FileLoop loop = new FileLoop(data(tempDir, tempDir));

        assertThatThrownBy(() -> loop.next(frames(), UTDATE, LoopCursor.ofFiles(List.of("gone.fits")), false))
                .isInstanceOf(LoopException.class)
                .hasMessageContaining("gone.fits")
                .hasMessageEndingWith("does not exist");
    }

    @Test
    void shouldSkipMissingFileWhenAsked() throws Exception {
        Files.writeString(tempDir.resolve("here.fits"), "a");
        FileLoop loop = new FileLoop(data(tempDir, tempDir));

        Frame frame = loop.next(frames(), UTDATE, LoopCursor.ofFiles(List.of("gone.fits", "here.fits")), true)
                .orElseThrow();

        assertThat(frame.raw()).isEqualTo("here.fits");
    }
}
