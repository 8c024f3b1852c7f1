package io.caldera.core.loop;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.List;
import java.util.OptionalInt;

/// Position of a data-arrival loop between calls.
///
/// A cursor is either a queue of observation numbers (list loops), a single
/// next number that advances after each frame (infinite, wait and flag loops),
/// or a queue of explicit filenames (file loops). Flag loops also queue the
/// data files a flag file listed, so one flag can yield several frames.
///
/// @implNote **Not thread-safe**. Owned by the orchestrator for one run.
public final class LoopCursor {

    private final Deque<Integer> numbers;
    private final Deque<String> files;
    private final Deque<String> pending = new ArrayDeque<>();
    private Integer next;

    private LoopCursor(Collection<Integer> numbers, Integer next, Collection<String> files) {
        this.numbers = new ArrayDeque<>(numbers);
        this.next = next;
        this.files = new ArrayDeque<>(files);
    }

    /// @param observations explicit observation numbers, in processing order
    public static LoopCursor ofList(List<Integer> observations) {
        return new LoopCursor(observations, null, List.of());
    }

    /// @param first first observation number to look for
    public static LoopCursor from(int first) {
        return new LoopCursor(List.of(), first, List.of());
    }

    /// @param fileNames filenames relative to the input directory, in processing order
    public static LoopCursor ofFiles(List<String> fileNames) {
        return new LoopCursor(List.of(), null, fileNames);
    }

    /// @return the next queued observation number, removed from the queue, or empty if exhausted
    public OptionalInt pollNumber() {
        Integer n = numbers.poll();
        return n == null ? OptionalInt.empty() : OptionalInt.of(n);
    }

    /// @return the number the loop is waiting for, or empty if the cursor has ended
    public OptionalInt current() {
        return next == null ? OptionalInt.empty() : OptionalInt.of(next);
    }

    /// Moves the cursor to the following observation.
    public void advance() {
        if (next != null) {
            next++;
        }
    }

    /// Jumps to another observation number.
    public void moveTo(int observation) {
        next = observation;
    }

    /// Ends the cursor; every later call on the loop returns no frame.
    public void end() {
        next = null;
        numbers.clear();
        files.clear();
        pending.clear();
    }

    /// @return the next explicit filename, removed from the queue, or null if exhausted
    public String pollFile() {
        return files.poll();
    }

    void addPending(List<String> fileNames) {
        pending.addAll(fileNames);
    }

    String pollPending() {
        return pending.poll();
    }

    /// @return remaining queued observation numbers, for diagnostics
    public List<Integer> remaining() {
        return List.copyOf(numbers);
    }
}
