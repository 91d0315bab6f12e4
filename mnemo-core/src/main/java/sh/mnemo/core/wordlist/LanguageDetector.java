// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mnemo.core.wordlist;

import java.util.ArrayList;
import java.util.List;

import sh.mnemo.core.error.LanguageDetectionException;
import sh.mnemo.core.text.Normalization;

/**
 * Identifies which wordlist a word or phrase was drawn from.
 *
 * <p>
 * Supported wordlists never share an entry, so a single word is enough to pick
 * a language. For a phrase, a language matches only if its list contains every
 * word. Detection succeeds only when exactly one list matches.
 */
public final class LanguageDetector {

    private final List<Wordlist> wordlists;

    /**
     * Creates a detector over the given wordlists.
     *
     * @param wordlists the candidate lists, searched in order
     */
    public LanguageDetector(final List<Wordlist> wordlists) {
        if (wordlists == null) {
            throw new IllegalArgumentException("Wordlists cannot be null");
        }
        this.wordlists = List.copyOf(wordlists);
    }

    /**
     * Creates a detector over every bundled language.
     *
     * @return a detector backed by {@link Wordlists#all()}
     */
    public static LanguageDetector supported() {
        return new LanguageDetector(Wordlists.all());
    }

    /**
     * Returns the name of the single wordlist containing every word of the input.
     *
     * @param text a word or a whitespace separated phrase
     * @return the matching wordlist's name, e.g. {@code "english"}
     * @throws LanguageDetectionException if no list, or more than one list, matches
     */
    public String detect(final String text) {
        final List<String> words = Normalization.splitWords(text);
        if (words.isEmpty()) {
            throw new LanguageDetectionException("Cannot detect language of blank input", List.of());
        }

        final var matches = new ArrayList<String>();
        for (Wordlist wordlist : wordlists) {
            if (words.stream().allMatch(wordlist::contains)) {
                matches.add(wordlist.name());
            }
        }

        if (matches.size() == 1) {
            return matches.get(0);
        }
        if (matches.isEmpty()) {
            throw new LanguageDetectionException("Language unrecognized for input", matches);
        }
        throw new LanguageDetectionException("Language ambiguous between " + matches, matches);
    }
}
