package de.mirkosertic.corpuscoverage.corpus;

import de.mirkosertic.corpuscoverage.config.SourceSettings;
import de.mirkosertic.corpuscoverage.util.TextCleaner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads corpus source files line by line.
 *
 * <p>Files are decoded as UTF-8. Undecodable byte sequences, null bytes and other storage
 * artifacts are stripped from every line (see {@link TextCleaner}).</p>
 */
public class CorpusLoader {

    private static final Logger logger = LoggerFactory.getLogger(CorpusLoader.class);

    public List<SourceCorpus> loadAll(final List<SourceSettings> sources) throws IOException {
        final List<SourceCorpus> corpora = new ArrayList<>(sources.size());
        for (final SourceSettings source : sources) {
            corpora.add(load(source.name(), Paths.get(source.path())));
        }
        return corpora;
    }

    public SourceCorpus load(final String name, final Path file) throws IOException {
        final long startTime = System.currentTimeMillis();
        final long sizeBytes = Files.size(file);

        final CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPLACE)
                .onUnmappableCharacter(CodingErrorAction.REPLACE);

        final List<String> lines = new ArrayList<>();
        try (final BufferedReader reader = new BufferedReader(
                new InputStreamReader(Files.newInputStream(file), decoder))) {
            String line;
            while ((line = reader.readLine()) != null) {
                lines.add(TextCleaner.sanitizeLine(line));
            }
        }

        logger.info("Loaded source '{}' from {}: {} lines, {} bytes in {}ms",
                name, file, lines.size(), sizeBytes, System.currentTimeMillis() - startTime);
        return new SourceCorpus(name, sizeBytes, lines);
    }
}
