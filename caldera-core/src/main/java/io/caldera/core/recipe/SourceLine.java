package io.caldera.core.recipe;

/// A significant line of recipe or primitive source.
///
/// @param number 1-based line number in the file
/// @param text the line with surrounding whitespace removed
public record SourceLine(int number, String text) {}
