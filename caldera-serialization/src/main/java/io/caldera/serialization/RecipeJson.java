package io.caldera.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.caldera.core.recipe.CompiledRecipe;
import io.caldera.core.recipe.Step;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/// Utility class for writing compiled recipes and run summaries as JSON.
///
/// ### Usage
/// {@snippet :
/// // Compiled step listing
/// String json = RecipeJson.toJson(recipe);
/// List<Step> steps = RecipeJson.stepsFromJson(json);
///
/// // Run summary file
/// RecipeJson.writeSummary(RunSummary.of(stats, utdate, batch, start, end), file);
/// }
///
/// @implNote Thread-safe. The internal ObjectMapper is created per call via
/// `createMapper()`. For high-throughput scenarios, cache the mapper.
///
/// @see CalderaJacksonModule for the registered type handlers
public final class RecipeJson {

    private static final TypeReference<List<Step>> STEP_LIST = new TypeReference<>() {};

    private RecipeJson() {}

    /// Serializes a compiled recipe (name, parameters and steps) to pretty-printed JSON.
    ///
    /// @param recipe the recipe, not null
    /// @return JSON string representation, never null
    /// @throws IllegalArgumentException if serialization fails
    public static String toJson(CompiledRecipe recipe) {
        try {
            return createMapper().writeValueAsString(recipe);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize recipe: " + e.getMessage(), e);
        }
    }

    /// Reads the steps of a recipe written by {@link #toJson(CompiledRecipe)}.
    ///
    /// A bare JSON array of steps is accepted as well.
    ///
    /// @param json JSON string, not null
    /// @return the steps in order, never null
    /// @throws IllegalArgumentException if deserialization fails
    public static List<Step> stepsFromJson(String json) {
        ObjectMapper mapper = createMapper();
        try {
            var root = mapper.readTree(json);
            var steps = root.isArray() ? root : root.path("steps");
            if (!steps.isArray()) {
                throw new IllegalArgumentException("No step list in JSON document");
            }
            return mapper.readerFor(STEP_LIST).readValue(steps);
        } catch (IOException e) {
            throw new IllegalArgumentException("Failed to deserialize steps: " + e.getMessage(), e);
        }
    }

    /// Serializes a run summary.
    ///
    /// @param summary the summary, not null
    /// @return JSON string representation, never null
    /// @throws IllegalArgumentException if serialization fails
    public static String toJson(RunSummary summary) {
        try {
            return createMapper().writeValueAsString(summary);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize run summary: " + e.getMessage(), e);
        }
    }

    /// @param json JSON string, not null
    /// @return the summary, never null
    /// @throws IllegalArgumentException if deserialization fails
    public static RunSummary summaryFromJson(String json) {
        try {
            return createMapper().readValue(json, RunSummary.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to deserialize run summary: " + e.getMessage(), e);
        }
    }

    /// Writes a run summary file, replacing any previous one.
    ///
    /// @param summary the summary, not null
    /// @param file destination, not null
    /// @throws IOException if the file cannot be written
    public static void writeSummary(RunSummary summary, Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(file, toJson(summary));
    }

    /// Creates an ObjectMapper configured for Caldera types.
    ///
    /// Registers:
    /// - `CalderaJacksonModule` for the step hierarchy and compiled recipes
    /// - `JavaTimeModule` for `Instant` and `Duration` fields
    /// - `FAIL_ON_UNKNOWN_PROPERTIES` disabled for forward compatibility
    /// - Timestamps written as ISO-8601 strings (not numeric)
    ///
    /// @return configured ObjectMapper, never null
    public static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new CalderaJacksonModule())
                .registerModule(new JavaTimeModule())
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }
}
