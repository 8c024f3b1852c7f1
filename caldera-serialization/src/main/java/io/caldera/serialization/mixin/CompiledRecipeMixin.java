package io.caldera.serialization.mixin;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/// Jackson mixin that leaves the source modification times out of a compiled recipe.
///
/// Applied to `CompiledRecipe.class` via `CalderaJacksonModule.setupModule()`.
/// Source times are only used by the in-process compile cache.
///
/// @see io.caldera.serialization.CalderaJacksonModule
@JsonIgnoreProperties({"sources"})
public abstract class CompiledRecipeMixin {}
