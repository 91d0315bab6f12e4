// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mnemo.core.wordlist;

import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Process-wide access to the bundled wordlists.
 *
 * <p>
 * Each language is loaded at most once and the same immutable {@link Wordlist} is
 * returned afterwards. A failed load is not remembered: the next call retries and
 * throws again.
 */
public final class Wordlists {

    private static final ConcurrentMap<Language, Wordlist> LOADED = new ConcurrentHashMap<>();

    private Wordlists() {
        // Utility class
    }

    /**
     * Returns the wordlist of a language, loading it on first use.
     *
     * @param language the language
     * @return the shared wordlist
     * @throws sh.mnemo.core.error.WordlistLoadException if the bundled list is missing or invalid
     */
    public static Wordlist get(final Language language) {
        if (language == null) {
            throw new IllegalArgumentException("Language cannot be null");
        }
        return LOADED.computeIfAbsent(language, Wordlist::load);
    }

    /**
     * Returns the wordlists of every supported language, in {@link Language} order.
     */
    public static List<Wordlist> all() {
        return Arrays.stream(Language.values()).map(Wordlists::get).toList();
    }
}
