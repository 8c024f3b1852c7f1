package io.caldera.core.frame;

import io.caldera.core.instrument.RawNamingScheme;
import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/// Creates groups on first use and places frames into them.
///
/// Groups are kept in creation order, which is the order batch mode processes
/// them in.
///
/// When a group is created and a product with its filename already exists in
/// the output directory, the product is kept if the run resumes and deleted
/// otherwise, so a rerun never coadds into stale output.
public class GroupRegistry {

    /// Key of the only group in {@link GroupMode#SINGLE} mode.
    public static final String SINGLE_GROUP_KEY = "ALL";

    private static final Logger logger = Logger.getLogger(GroupRegistry.class.getName());

    private final RawNamingScheme naming;
    private final Path outputDir;
    private final BadObservationFilter filter;
    private final GroupMode mode;
    private final boolean resume;
    private final Map<String, Group> groups = new LinkedHashMap<>();

    public GroupRegistry(
            RawNamingScheme naming,
            Path outputDir,
            BadObservationFilter filter,
            GroupMode mode,
            boolean resume) {
        this.naming = naming;
        this.outputDir = outputDir;
        this.filter = filter;
        this.mode = mode;
        this.resume = resume;
    }

    /// Pushes the frame into its group, creating the group if needed.
    ///
    /// @param frame a configured frame, not null
    /// @return the group now holding the frame, never null
    /// @throws IOException if a stale group product cannot be removed
    public Group place(Frame frame) throws IOException {
        String key = mode == GroupMode.SINGLE ? SINGLE_GROUP_KEY : frame.groupKey();
        Group group = groups.get(key);
        if (group == null) {
            if (mode == GroupMode.TRANSIENT) {
                groups.clear();
            }
            group = create(key, frame.utdate());
            groups.put(key, group);
            logger.info("A new group " + group.file() + " has been created");
        } else {
            logger.info("This observation is part of group " + group.file());
        }
        group.push(frame);
        return group;
    }

    private Group create(String key, String utdate) throws IOException {
        String file = naming.groupFileName(utdate, key);
        if (Files.isDirectory(outputDir)) {
            for (Path existing : existingProducts(file)) {
                if (resume) {
                    logger.info("Resuming with existing group product " + existing.getFileName());
                } else {
                    logger.info("Removing stale group product " + existing.getFileName());
                    Files.deleteIfExists(existing);
                }
            }
        }
        return new Group(key, file, filter);
    }

    private List<Path> existingProducts(String stem) throws IOException {
        List<Path> found = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(outputDir)) {
            for (Path path : stream) {
                String name = path.getFileName().toString();
                if (name.equals(stem) || name.startsWith(stem + ".")) {
                    found.add(path);
                }
            }
        }
        return found;
    }

    /// @return groups in creation order, never null
    public List<Group> groups() {
        return Collections.unmodifiableList(new ArrayList<>(groups.values()));
    }

    public Group group(String key) {
        return groups.get(key);
    }

    public GroupMode getMode() {
        return mode;
    }

    public void clear() {
        groups.clear();
    }
}
