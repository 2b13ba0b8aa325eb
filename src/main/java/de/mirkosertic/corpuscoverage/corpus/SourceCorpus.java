package de.mirkosertic.corpuscoverage.corpus;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * All lines of one corpus source, in file order.
 *
 * @param name      source name, e.g. {@code "blogs"}
 * @param sizeBytes size of the source file on disk
 * @param lines     sanitized lines
 */
public record SourceCorpus(String name, long sizeBytes, List<String> lines) {

    public SourceCorpus {
        lines = List.copyOf(lines);
    }

    /**
     * In-memory source whose size is the UTF-8 length of its lines plus one newline each.
     */
    public static SourceCorpus of(final String name, final List<String> lines) {
        long bytes = 0;
        for (final String line : lines) {
            bytes += line.getBytes(StandardCharsets.UTF_8).length + 1;
        }
        return new SourceCorpus(name, bytes, lines);
    }

    public int lineCount() {
        return lines.size();
    }
}
