package io.caldera.core.frame;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/// An ordered collection of frames sharing a group key.
///
/// A group keeps two lists: every frame ever pushed ({@link #allMembers()}) and
/// the frames currently valid ({@link #members()}). Valid members are the
/// order-preserving subsequence of all members whose good flag is set and
/// which the bad-observation filter does not match.
///
/// ### Contracts
/// - **Invariant**: `members ⊆ allMembers`, in the same relative order
/// - **Invariant**: members are recomputed on every push or bulk replace, and
///   on read when the filter's revision has changed
///
/// Frames marked bad after being pushed stay in `members` until the next
/// {@link #checkMembership()}; the orchestrator calls it after each recipe.
///
/// @implNote **Not thread-safe**. Mutated only by the orchestrator thread.
public class Group {

    private static final Logger logger = Logger.getLogger(Group.class.getName());

    private final String key;
    private final BadObservationFilter filter;
    private final List<Frame> allMembers = new ArrayList<>();
    private final Map<String, Object> header = new LinkedHashMap<>();
    private final Map<String, Object> derived = new LinkedHashMap<>();
    private final Set<Frame> reported = Collections.newSetFromMap(new IdentityHashMap<>());
    private List<Frame> members = List.of();
    private long filterRevision;
    private String file;

    /// @param key the group key, not null
    /// @param file the group's output filename, not null
    /// @param filter bad-observation filter applied to members, not null
    public Group(String key, String file, BadObservationFilter filter) {
        this.key = Objects.requireNonNull(key, "key");
        this.file = Objects.requireNonNull(file, "file");
        this.filter = Objects.requireNonNull(filter, "filter");
        this.filterRevision = filter.revision();
    }

    public String key() {
        return key;
    }

    public String file() {
        return file;
    }

    public void setFile(String file) {
        this.file = file;
    }

    /// Appends frames and recomputes the valid members.
    ///
    /// The first frame pushed into an empty group seeds the group header.
    ///
    /// @param frames frames to append, not null
    public void push(Frame... frames) {
        for (Frame frame : frames) {
            if (allMembers.isEmpty() && header.isEmpty()) {
                header.putAll(frame.header());
            }
            allMembers.add(frame);
        }
        checkMembership();
    }

    /// Replaces every member and recomputes the valid members.
    ///
    /// @param frames the new member list, not null
    public void setAllMembers(List<Frame> frames) {
        allMembers.clear();
        allMembers.addAll(frames);
        checkMembership();
    }

    public List<Frame> allMembers() {
        return Collections.unmodifiableList(allMembers);
    }

    /// Returns the currently valid members in push order.
    ///
    /// @return an unmodifiable list, never null
    public List<Frame> members() {
        if (filter.revision() != filterRevision) {
            checkMembership();
        }
        return members;
    }

    /// Recomputes {@link #members()} from {@link #allMembers()}.
    ///
    /// Frames whose good flag is cleared are dropped silently; frames matched by
    /// the bad-observation filter are dropped with a warning the first time.
    public void checkMembership() {
        filterRevision = filter.revision();
        List<Frame> valid = new ArrayList<>();
        for (Frame frame : allMembers) {
            if (!frame.isGood()) {
                continue;
            }
            if (filter.matches(frame)) {
                if (reported.add(frame)) {
                    logger.warning(
                            "Removing observation " + frame.number() + " from group " + key);
                }
                continue;
            }
            valid.add(frame);
        }
        members = Collections.unmodifiableList(valid);
    }

    public int numberOfMembers() {
        return members().size();
    }

    /// Returns the members whose header matches every given value.
    ///
    /// @param criteria header key to expected value, not null
    /// @return a new group holding the matching members, same key and filter
    public Group subgroup(Map<String, ?> criteria) {
        Group sub = new Group(key, file, filter);
        List<Frame> matching = new ArrayList<>();
        for (Frame frame : members()) {
            boolean keep = true;
            for (Map.Entry<String, ?> criterion : criteria.entrySet()) {
                Object actual = frame.headerValue(criterion.getKey());
                if (actual == null
                        || !BadObservationRules.sameValue(
                                actual.toString().trim(),
                                String.valueOf(criterion.getValue()).trim())) {
                    keep = false;
                    break;
                }
            }
            if (keep) {
                matching.add(frame);
            }
        }
        sub.setAllMembers(matching);
        return sub;
    }

    /// Partitions the members by the values of the given header keys.
    ///
    /// @param keys header keys, not null
    /// @return one group per distinct value combination, in first-seen order
    public List<Group> subgroups(String... keys) {
        Map<List<String>, List<Frame>> partitions = new LinkedHashMap<>();
        for (Frame frame : members()) {
            List<String> values = new ArrayList<>();
            for (String k : keys) {
                values.add(String.valueOf(frame.headerValue(k)));
            }
            partitions.computeIfAbsent(values, v -> new ArrayList<>()).add(frame);
        }
        List<Group> result = new ArrayList<>();
        for (List<Frame> frames : partitions.values()) {
            Group sub = new Group(key, file, filter);
            sub.setAllMembers(frames);
            result.add(sub);
        }
        return result;
    }

    /// @return `true` if the frame is the last valid member
    public boolean isLastMember(Frame frame) {
        List<Frame> current = members();
        return !current.isEmpty() && current.get(current.size() - 1) == frame;
    }

    /// @return `true` if the frame is the first valid member
    public boolean isFirstMember(Frame frame) {
        List<Frame> current = members();
        return !current.isEmpty() && current.get(0) == frame;
    }

    /// Returns the frame that stands for the whole group: the last valid member.
    public Optional<Frame> reduce() {
        List<Frame> current = members();
        return current.isEmpty() ? Optional.empty() : Optional.of(current.get(current.size() - 1));
    }

    public List<String> memberNames() {
        List<String> names = new ArrayList<>();
        for (Frame frame : members()) {
            names.add(frame.file());
        }
        return names;
    }

    public List<Integer> memberNumbers() {
        List<Integer> numbers = new ArrayList<>();
        for (Frame frame : members()) {
            numbers.add(frame.number());
        }
        return numbers;
    }

    public Map<String, Object> header() {
        return Collections.unmodifiableMap(header);
    }

    public Object derivedValue(String key) {
        return derived.get(key);
    }

    public void setDerived(String key, Object value) {
        derived.put(key, value);
    }

    @Override
    public String toString() {
        return "Group[" + key + ", members=" + memberNumbers() + " of " + allMembers.size() + "]";
    }
}
