package io.caldera.core.instrument;

import io.caldera.core.frame.Frame;
import java.util.ArrayList;
import java.util.List;

/// Groups frames by the values of one or more header keys.
///
/// Frames missing any of the keys form a group of their own, keyed by
/// observation number, so an incomplete header never merges unrelated data.
public class HeaderGroupingRule implements GroupingRule {

    private final List<String> keys;

    /// @param keys header keys joined with `_` to form the group key, not null
    public HeaderGroupingRule(List<String> keys) {
        this.keys = List.copyOf(keys);
    }

    @Override
    public String groupKey(Frame frame) {
        List<String> parts = new ArrayList<>();
        for (String key : keys) {
            Object value = frame.headerValue(key);
            if (value == null || value.toString().isBlank()) {
                return Integer.toString(frame.number());
            }
            parts.add(value.toString().trim());
        }
        if (parts.isEmpty()) {
            return Integer.toString(frame.number());
        }
        return String.join("_", parts);
    }

    public List<String> getKeys() {
        return keys;
    }
}
