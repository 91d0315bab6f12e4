// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mnemo.core.wordlist;

import java.util.Arrays;
import java.util.List;

import org.jspecify.annotations.Nullable;

import sh.mnemo.core.error.WordlistLoadException;

/**
 * The closed set of languages with a bundled wordlist.
 *
 * <p>
 * Each constant records the identifier used in the public API, the published
 * SHA-256 digest of its wordlist file, and, for validated languages, the allowed
 * entry length in code points and the allowed alphabet.
 *
 * @see <a href="https://github.com/bitcoin/bips/blob/master/bip-0039/bip-0039-wordlists.md">BIP-39 wordlists</a>
 */
public enum Language {

    ENGLISH("english", 3, 8, "abcdefghijklmnopqrstuvwxyz",
            "2f5eed53a4727b4bf8880d8f3f199efc90e58503646d9ff8eff3a2ed3b24dbda");

    private final String id;
    private final int minLength;
    private final int maxLength;
    private final @Nullable String alphabet;
    private final String sha256;

    Language(final String id, final int minLength, final int maxLength,
             final @Nullable String alphabet, final String sha256) {
        this.id = id;
        this.minLength = minLength;
        this.maxLength = maxLength;
        this.alphabet = alphabet;
        this.sha256 = sha256;
    }

    /**
     * Returns the language identifier, e.g. {@code "english"}.
     *
     * @return lowercase ASCII identifier
     */
    public String id() {
        return id;
    }

    /** Hex SHA-256 of the bundled wordlist file. */
    public String sha256() {
        return sha256;
    }

    /** Classpath resource name, relative to {@link Wordlist}. */
    String resourceName() {
        return id + ".txt";
    }

    /**
     * Returns whether entries of this language are checked against a length range
     * and an alphabet when the list is loaded.
     */
    public boolean isValidated() {
        return alphabet != null;
    }

    /**
     * Checks a wordlist entry against this language's length range and alphabet.
     * Always {@code true} for languages that are not validated.
     *
     * @param word the entry to check
     * @return whether the entry is well formed for this language
     */
    public boolean acceptsEntry(final String word) {
        if (alphabet == null) {
            return true;
        }
        final int length = word.codePointCount(0, word.length());
        if (length < minLength || length > maxLength) {
            return false;
        }
        return word.codePoints().allMatch(cp -> alphabet.indexOf(cp) >= 0);
    }

    /**
     * Resolves a language from its identifier.
     *
     * @param id the identifier, e.g. {@code "english"}
     * @return the matching language
     * @throws WordlistLoadException if no bundled language has that identifier
     */
    public static Language fromId(final String id) {
        if (id == null) {
            throw new IllegalArgumentException("Language id cannot be null");
        }
        for (Language language : values()) {
            if (language.id.equals(id)) {
                return language;
            }
        }
        throw new WordlistLoadException("Language not supported: " + id);
    }

    /**
     * Lists every supported language identifier in declaration order.
     *
     * @return immutable list of identifiers
     */
    public static List<String> ids() {
        return Arrays.stream(values()).map(Language::id).toList();
    }
}
