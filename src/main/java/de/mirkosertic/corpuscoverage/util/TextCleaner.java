package de.mirkosertic.corpuscoverage.util;

import org.jspecify.annotations.Nullable;

import java.util.regex.Pattern;

/**
 * Strips characters from raw corpus lines that are artifacts of storage rather than text.
 *
 * <p>Removed before any counting happens:</p>
 * <ul>
 *   <li>Null bytes embedded in the source files</li>
 *   <li>Control characters other than tab</li>
 *   <li>Zero-width characters and byte order marks</li>
 *   <li>Unicode replacement characters left by undecodable byte sequences</li>
 * </ul>
 */
public final class TextCleaner {

    /**
     * <ul>
     *   <li>U+0000-U+0008, U+000A-U+001F: NUL and control characters except TAB</li>
     *   <li>U+007F: DEL</li>
     *   <li>U+200B-U+200D: zero-width space, non-joiner, joiner</li>
     *   <li>U+2028, U+2029: line and paragraph separators</li>
     *   <li>U+FEFF: byte order mark</li>
     *   <li>U+FFFD: replacement character</li>
     * </ul>
     */
    private static final Pattern STORAGE_ARTIFACTS = Pattern.compile(
        "[" +
        "\\u0000-\\u0008" +        // NUL and control chars before TAB
        "\\u000A-\\u001F" +        // control chars after TAB, including CR and LF
        "\\u007F" +                 // DEL
        "\\u200B-\\u200D" +        // zero-width space, non-joiner, joiner
        "\\u2028\\u2029" +          // line and paragraph separators
        "\\uFEFF" +                 // byte order mark
        "\\uFFFD" +                 // replacement character
        "]"
    );

    private TextCleaner() {
    }

    /**
     * Removes storage artifacts from one corpus line.
     *
     * @param line the raw line (may be null)
     * @return the sanitized line, empty for null input
     */
    public static String sanitizeLine(final @Nullable String line) {
        if (line == null || line.isEmpty()) {
            return "";
        }
        return STORAGE_ARTIFACTS.matcher(line).replaceAll("");
    }

    /**
     * Counts whitespace-delimited words the way the corpus summary reports them.
     */
    public static long countWords(final @Nullable String line) {
        if (line == null) {
            return 0;
        }
        long words = 0;
        boolean inWord = false;
        for (int i = 0; i < line.length(); i++) {
            if (Character.isWhitespace(line.charAt(i))) {
                inWord = false;
            } else if (!inWord) {
                inWord = true;
                words++;
            }
        }
        return words;
    }
}
