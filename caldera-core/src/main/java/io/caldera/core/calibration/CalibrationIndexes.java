package io.caldera.core.calibration;

import io.caldera.core.instrument.CalibrationRuleProvider;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/// Opens and caches the index of each calibration role.
///
/// Rules files are looked up on the search path; the index location depends on
/// the role's {@link IndexMode}.
public class CalibrationIndexes {

    private static final Logger logger = Logger.getLogger(CalibrationIndexes.class.getName());

    private final CalibrationRuleProvider provider;
    private final CalibrationSearchPath searchPath;
    private final Map<String, CalibrationIndex> open = new ConcurrentHashMap<>();

    public CalibrationIndexes(CalibrationRuleProvider provider, CalibrationSearchPath searchPath) {
        this.provider = provider;
        this.searchPath = searchPath;
    }

    /// Returns the index for a role, opening it on first use.
    ///
    /// @param role calibration role, not null
    /// @return the index, never null
    /// @throws NoSuchFileException if the role's rules file is on no search directory
    /// @throws IOException if the rules or index cannot be read, or a copy fails
    public CalibrationIndex index(String role) throws IOException {
        CalibrationIndex index = open.get(role);
        if (index == null) {
            index = openIndex(role);
            open.put(role, index);
        }
        return index;
    }

    /// Registers a ready-made index, replacing any opened one.
    public void register(CalibrationIndex index) {
        open.put(index.role(), index);
    }

    private CalibrationIndex openIndex(String role) throws IOException {
        String rulesName = provider.rulesFileName(role);
        Path rulesFile =
                searchPath
                        .find(rulesName)
                        .orElseThrow(
                                () ->
                                        new NoSuchFileException(
                                                rulesName,
                                                null,
                                                "not found in " + searchPath.dirs()));
        IndexRules rules = IndexRules.load(rulesFile);

        String indexName = provider.indexFileName(role);
        IndexMode mode = provider.indexMode(role);
        Path dynamicFile = searchPath.getOutputDir().resolve(indexName);
        Optional<Path> staticFile = searchPath.findStatic(indexName);

        CalibrationIndex index =
                switch (mode) {
                    case DYNAMIC -> CalibrationIndex.open(role, rules, provider.timeKey(), dynamicFile, false);
                    case STATIC -> CalibrationIndex.open(
                            role,
                            rules,
                            provider.timeKey(),
                            staticFile.orElse(dynamicFile),
                            true);
                    case COPY -> {
                        if (!Files.exists(dynamicFile) && staticFile.isPresent()) {
                            Files.createDirectories(searchPath.getOutputDir());
                            Files.copy(staticFile.get(), dynamicFile);
                            logger.info("Copied " + role + " index from " + staticFile.get());
                        }
                        yield CalibrationIndex.open(role, rules, provider.timeKey(), dynamicFile, false);
                    }
                };
        logger.fine("Opened " + mode + " " + role + " index " + index.file() + " with rules " + rulesFile);
        return index;
    }

    /// @return the instrument's roles plus any registered ones, never null
    public Set<String> roles() {
        Set<String> roles = new LinkedHashSet<>(provider.roles());
        roles.addAll(open.keySet());
        return roles;
    }

    public CalibrationSearchPath getSearchPath() {
        return searchPath;
    }
}
