package de.mirkosertic.corpuscoverage.text;

import com.ibm.icu.text.Transliterator;
import org.jspecify.annotations.Nullable;

import java.util.regex.Pattern;

/**
 * Deterministic cleanup applied to every sampled corpus line before tokenization.
 *
 * <p>The rewrites run in a fixed order:</p>
 * <ol>
 *   <li>Remove every run of characters that are neither alphabetic nor whitespace
 *       (punctuation, digits, symbols, emoji). Alphabetic includes letter numbers such as
 *       {@code "Ⅳ"} and the vowel signs of Indic scripts.</li>
 *   <li>Remove every whitespace-delimited run starting with {@code http}. After step 1 a URL
 *       such as {@code http://x.co} has collapsed into {@code httpxco}.</li>
 *   <li>Remove every word that contains the same character twice in a row, anywhere.
 *       This is deliberately literal: {@code "sooo"} goes, but so do {@code "book"} and
 *       {@code "letter"}.</li>
 *   <li>Transliterate to ASCII with ICU4J ({@code Any-Latin; Latin-ASCII}) and drop whatever
 *       has no ASCII equivalent.</li>
 * </ol>
 *
 * <p>Whitespace is collapsed to single spaces and trimmed at the end. Transliteration can
 * create new doubled letters ({@code "Straße"} becomes {@code "Strasse"}), so when step 4
 * changes the text, steps 1 to 3 run once more on the ASCII result. The output is therefore
 * a fixed point: normalizing it again returns it unchanged.</p>
 *
 * <p>Not thread-safe: the ICU transliterator is shared per instance, so use one normalizer
 * per thread.</p>
 */
public class TextNormalizer {

    private static final Pattern NON_LETTER_RUNS = Pattern.compile(
            "[^\\p{IsAlphabetic}\\s]+", Pattern.UNICODE_CHARACTER_CLASS);

    private static final Pattern URL_RUNS = Pattern.compile("(?<!\\S)http\\S*");

    private static final Pattern REPEATED_CHARACTER_WORDS = Pattern.compile(
            "\\b(?=\\w*(\\w)\\1)\\w+\\b", Pattern.UNICODE_CHARACTER_CLASS);

    private static final Pattern NON_ASCII = Pattern.compile("[^\\x00-\\x7F]+");

    private static final Pattern WHITESPACE_RUNS = Pattern.compile("\\s+");

    private static final String TRANSLITERATOR_ID = "Any-Latin; Latin-ASCII";

    private final Transliterator transliterator;

    public TextNormalizer() {
        this.transliterator = Transliterator.getInstance(TRANSLITERATOR_ID);
    }

    /**
     * Normalizes one line of text.
     *
     * @param text raw text (may be null)
     * @return the cleaned text, single-space separated; empty if nothing survives
     */
    public String normalize(final @Nullable String text) {
        if (text == null || text.isBlank()) {
            return "";
        }

        final String letters = stripWords(text);
        String ascii = transliterate(letters);
        if (!ascii.equals(letters)) {
            ascii = stripWords(ascii);
        }
        return WHITESPACE_RUNS.matcher(ascii).replaceAll(" ").trim();
    }

    private static String stripWords(final String text) {
        String cleaned = NON_LETTER_RUNS.matcher(text).replaceAll("");
        cleaned = URL_RUNS.matcher(cleaned).replaceAll("");
        return REPEATED_CHARACTER_WORDS.matcher(cleaned).replaceAll("");
    }

    private String transliterate(final String text) {
        final String latin = transliterator.transliterate(text);
        return NON_ASCII.matcher(latin).replaceAll("");
    }
}
