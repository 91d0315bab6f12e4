// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mnemo.core.wordlist;

import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Completes truncated words against one wordlist.
 *
 * <p>
 * A prefix is expanded only when the outcome is certain: an exact entry stays as
 * it is, a prefix of exactly one entry becomes that entry, and anything else,
 * unknown or ambiguous, is returned unchanged.
 */
public final class PrefixExpander {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final Wordlist wordlist;

    public PrefixExpander(final Wordlist wordlist) {
        if (wordlist == null) {
            throw new IllegalArgumentException("Wordlist cannot be null");
        }
        this.wordlist = wordlist;
    }

    /**
     * Expands a single prefix. A word the list contains, in any normalization form, is
     * returned as given.
     *
     * @param prefix the possibly truncated word
     * @return the full word when exactly one entry starts with the prefix,
     *         otherwise the prefix itself
     */
    public String expandWord(final String prefix) {
        if (prefix == null) {
            throw new IllegalArgumentException("Prefix cannot be null");
        }
        if (prefix.isBlank() || wordlist.contains(prefix)) {
            return prefix;
        }
        final List<String> matches = wordlist.wordsWithPrefix(prefix);
        return matches.size() == 1 ? matches.get(0) : prefix;
    }

    /**
     * Expands every whitespace separated token of a sentence.
     *
     * <p>
     * Tokens keep their order and are rejoined with single spaces. The text is not
     * normalized. Blank input is returned unchanged.
     *
     * @param sentence the words to expand
     * @return the expanded sentence
     */
    public String expand(final String sentence) {
        if (sentence == null) {
            throw new IllegalArgumentException("Sentence cannot be null");
        }
        if (sentence.isBlank()) {
            return sentence;
        }
        return Arrays.stream(WHITESPACE.split(sentence.strip()))
                .map(this::expandWord)
                .collect(Collectors.joining(" "));
    }
}
