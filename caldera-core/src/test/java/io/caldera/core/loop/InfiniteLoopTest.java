package io.caldera.core.loop;

import static io.caldera.core.loop.LoopTestSupport.UTDATE;
import static io.caldera.core.loop.LoopTestSupport.data;
import static io.caldera.core.loop.LoopTestSupport.frames;
import static io.caldera.core.loop.LoopTestSupport.raw;
import static org.assertj.core.api.Assertions.assertThat;

import io.caldera.core.frame.Frame;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class InfiniteLoopTest {

    @TempDir Path tempDir;

    @Test
    void shouldProcessConsecutiveObservationsUntilOneIsMissing() throws Exception {
        raw(tempDir, 5);
        raw(tempDir, 6);
        raw(tempDir, 8);
        InfiniteLoop loop = new InfiniteLoop(data(tempDir, tempDir));
        LoopCursor cursor = LoopCursor.from(5);

        assertThat(loop.next(frames(), UTDATE, cursor, false)).map(Frame::number).hasValue(5);
        assertThat(loop.next(frames(), UTDATE, cursor, false)).map(Frame::number).hasValue(6);
        assertThat(loop.next(frames(), UTDATE, cursor, false)).isEmpty();
        assertThat(cursor.current()).hasValue(7);
    }

    @Test
    void shouldPickUpObservationThatArrivesLater() throws Exception {
        InfiniteLoop loop = new InfiniteLoop(data(tempDir, tempDir));
        LoopCursor cursor = LoopCursor.from(1);

        assertThat(loop.next(frames(), UTDATE, cursor, false)).isEmpty();
        raw(tempDir, 1);

        assertThat(loop.next(frames(), UTDATE, cursor, false)).map(Frame::number).hasValue(1);
    }
}
