package io.caldera.core.loop;

import java.util.ArrayList;
import java.util.List;

/// Parser for observation lists such as `1,3,5:8`.
///
/// Items are separated by commas; `a:b` is an inclusive range. Order is kept
/// and duplicates are allowed.
public final class ObservationList {

    private ObservationList() {}

    /// @param text the list, not null
    /// @return the observation numbers in the order given, never null
    /// @throws IllegalArgumentException if an item is not a number or a range
    public static List<Integer> parse(String text) {
        List<Integer> numbers = new ArrayList<>();
        for (String item : text.split(",")) {
            String trimmed = item.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            int colon = trimmed.indexOf(':');
            if (colon < 0) {
                numbers.add(number(trimmed));
                continue;
            }
            int from = number(trimmed.substring(0, colon).trim());
            int to = number(trimmed.substring(colon + 1).trim());
            if (to < from) {
                throw new IllegalArgumentException("Descending range in observation list: " + trimmed);
            }
            for (int n = from; n <= to; n++) {
                numbers.add(n);
            }
        }
        if (numbers.isEmpty()) {
            throw new IllegalArgumentException("Empty observation list: '" + text + "'");
        }
        return numbers;
    }

    /// @return the inclusive range as a list
    public static List<Integer> range(int from, int to) {
        List<Integer> numbers = new ArrayList<>();
        for (int n = from; n <= to; n++) {
            numbers.add(n);
        }
        return numbers;
    }

    private static int number(String text) {
        try {
            int n = Integer.parseInt(text);
            if (n < 0) {
                throw new IllegalArgumentException("Negative observation number: " + text);
            }
            return n;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Not an observation number: '" + text + "'", e);
        }
    }
}
