// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mnemo.core.text;

import java.text.Normalizer;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Unicode canonicalization applied to every phrase, word and passphrase.
 *
 * <p>
 * Text is brought to Normalization Form KD and every IDEOGRAPHIC SPACE
 * (U+3000) becomes an ASCII space. Equivalent text supplied in NFC, NFD, NFKC
 * or NFKD therefore yields the same UTF-8 bytes, which is what makes seeds
 * reproducible across platforms and input methods.
 *
 * <p>
 * Splitting always runs on normalized text, so an ideographic space separates
 * words exactly like an ASCII space does.
 *
 * @since 0.1.0
 */
public final class Normalization {

    /** IDEOGRAPHIC SPACE (U+3000), the word separator used by Japanese phrases. */
    public static final String IDEOGRAPHIC_SPACE = "\u3000";

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private Normalization() {
        // Utility class
    }

    /**
     * Applies NFKD normalization and maps ideographic spaces to ASCII spaces.
     *
     * @param text the text to normalize
     * @return the normalized text
     * @throws IllegalArgumentException if text is null
     */
    public static String normalize(final String text) {
        if (text == null) {
            throw new IllegalArgumentException("Text cannot be null");
        }
        // NFKD already folds U+3000 to U+0020; the replace keeps that guarantee explicit.
        return Normalizer.normalize(text, Normalizer.Form.NFKD).replace(IDEOGRAPHIC_SPACE, " ");
    }

    /**
     * Normalizes a phrase and splits it into words.
     *
     * <p>
     * Leading and trailing whitespace is ignored and runs of whitespace count as a
     * single separator.
     *
     * @param phrase the phrase to split
     * @return the normalized words, empty for blank input
     * @throws IllegalArgumentException if phrase is null
     */
    public static List<String> splitWords(final String phrase) {
        final String normalized = normalize(phrase).strip();
        if (normalized.isEmpty()) {
            return List.of();
        }
        return List.of(WHITESPACE.split(normalized));
    }
}
