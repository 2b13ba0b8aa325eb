package de.mirkosertic.corpuscoverage.config;

/**
 * A named corpus source and the file its lines are read from.
 */
public record SourceSettings(String name, String path) {
}
