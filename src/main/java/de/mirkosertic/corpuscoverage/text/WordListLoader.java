package de.mirkosertic.corpuscoverage.text;

import de.mirkosertic.corpuscoverage.config.ConfigurationException;
import org.apache.lucene.analysis.CharArraySet;
import org.apache.lucene.analysis.WordlistLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Loads one-word-per-line lists such as stopwords or profanity.
 *
 * <p>A location is either {@code classpath:<resource>} or a file system path. Lines starting
 * with {@code #} are comments. A list that cannot be found or read is a configuration error:
 * filtering must never run with an incomplete exclusion set.</p>
 *
 * <p>Exclusion lists are compared against normalized text, so {@link #loadExclusions} runs every
 * entry through the {@link TextNormalizer} first: {@code "they've"} is stored as {@code "theyve"}.
 * Entries that normalize to nothing can never match a token and are dropped.</p>
 */
public final class WordListLoader {

    private static final Logger logger = LoggerFactory.getLogger(WordListLoader.class);

    private static final String CLASSPATH_PREFIX = "classpath:";
    private static final String COMMENT = "#";

    private WordListLoader() {
    }

    public static ExclusionWordLists loadExclusions(final String stopwordsLocation, final String profanityLocation) {
        final TextNormalizer normalizer = new TextNormalizer();
        final CharArraySet stopwords = normalized(load(stopwordsLocation), normalizer, stopwordsLocation);
        final CharArraySet profanity = normalized(load(profanityLocation), normalizer, profanityLocation);
        logger.info("Loaded {} stopwords from {} and {} profanity entries from {}",
                stopwords.size(), stopwordsLocation, profanity.size(), profanityLocation);
        return new ExclusionWordLists(stopwords, profanity);
    }

    public static CharArraySet load(final String location) {
        if (location == null || location.isBlank()) {
            throw new ConfigurationException("Word list location must not be empty");
        }
        try (final Reader reader = open(location)) {
            final CharArraySet words = WordlistLoader.getWordSet(reader, COMMENT, new CharArraySet(256, true));
            logger.debug("Read {} entries from {}", words.size(), location);
            return words;
        } catch (final IOException e) {
            throw new ConfigurationException("Failed to read word list: " + location, e);
        }
    }

    private static CharArraySet normalized(final CharArraySet words, final TextNormalizer normalizer, final String location) {
        final CharArraySet result = new CharArraySet(words.size(), true);
        int dropped = 0;
        for (final Object word : words) {
            final String entry = word instanceof char[] ? new String((char[]) word) : word.toString();
            final String normalizedEntry = normalizer.normalize(entry);
            if (normalizedEntry.isEmpty()) {
                dropped++;
            } else {
                result.add(normalizedEntry);
            }
        }
        if (dropped > 0) {
            logger.debug("Dropped {} entries of {} that normalize to nothing", dropped, location);
        }
        return result;
    }

    private static Reader open(final String location) throws IOException {
        if (location.startsWith(CLASSPATH_PREFIX)) {
            final String resource = location.substring(CLASSPATH_PREFIX.length());
            final InputStream is = WordListLoader.class.getClassLoader().getResourceAsStream(resource);
            if (is == null) {
                throw new ConfigurationException("Word list not found on classpath: " + resource);
            }
            return new InputStreamReader(is, StandardCharsets.UTF_8);
        }
        final Path path = Paths.get(location);
        if (!Files.isRegularFile(path)) {
            throw new ConfigurationException("Word list file does not exist: " + path.toAbsolutePath());
        }
        return Files.newBufferedReader(path, StandardCharsets.UTF_8);
    }
}
