package io.caldera.core.pipeline;

import io.caldera.core.execution.RecipeStatus;
import java.util.EnumMap;
import java.util.Map;

/// Tally of recipe outcomes over a run.
///
/// `OK` and `TERMINATED` are good. `BAD_ENGINE` and `ERROR` are bad and make
/// the run exit with status 1. A run whose data loop timed out also exits
/// with status 1, since data it expected never arrived.
///
/// @implNote **Not thread-safe**.
public class RunStatistics {

    private final Map<RecipeStatus, Integer> counts = new EnumMap<>(RecipeStatus.class);
    private boolean loopTimedOut;

    /// @param status final status of one recipe, not `FATAL` or `USER_ABORT`
    /// @throws IllegalArgumentException for a status that unwinds the run
    public void record(RecipeStatus status) {
        if (status == RecipeStatus.FATAL || status == RecipeStatus.USER_ABORT) {
            throw new IllegalArgumentException(status + " aborts the run and is never tallied");
        }
        counts.merge(status, 1, Integer::sum);
    }

    public void markLoopTimedOut() {
        loopTimedOut = true;
    }

    public boolean isLoopTimedOut() {
        return loopTimedOut;
    }

    public int count(RecipeStatus status) {
        return counts.getOrDefault(status, 0);
    }

    public int total() {
        return counts.values().stream().mapToInt(Integer::intValue).sum();
    }

    public int good() {
        return count(RecipeStatus.OK) + count(RecipeStatus.TERMINATED);
    }

    public int bad() {
        return count(RecipeStatus.ERROR) + count(RecipeStatus.BAD_ENGINE);
    }

    /// @return 0 when every recipe completed or terminated and the loop did not time out, else 1
    public int exitCode() {
        return bad() == 0 && !loopTimedOut ? 0 : 1;
    }

    /// @return one-line summary for the end of a run, or an empty string if nothing ran
    public String summary() {
        int total = total();
        if (total == 0) {
            return loopTimedOut ? "No recipes processed before the data loop timed out" : "";
        }
        if (total == 1) {
            String text = "which completed successfully";
            if (count(RecipeStatus.TERMINATED) > 0) {
                text = "which was terminated early";
            } else if (count(RecipeStatus.BAD_ENGINE) > 0) {
                text = "which had a bad algorithm engine";
            } else if (good() == 0) {
                text = "which completed with an error";
            }
            return "Processed one recipe " + text;
        }
        String text = "successfully";
        if (bad() > 0) {
            text = "of which " + bad() + " completed with an error";
        } else if (count(RecipeStatus.TERMINATED) > 0) {
            int term = count(RecipeStatus.TERMINATED);
            text = "of which " + term + (term == 1 ? " was" : " were") + " terminated early";
        }
        return "Processed " + total + " recipes " + text;
    }

    @Override
    public String toString() {
        return "RunStatistics{ok=" + count(RecipeStatus.OK)
                + ", terminated=" + count(RecipeStatus.TERMINATED)
                + ", badEngine=" + count(RecipeStatus.BAD_ENGINE)
                + ", error=" + count(RecipeStatus.ERROR)
                + ", loopTimedOut=" + loopTimedOut + "}";
    }
}
