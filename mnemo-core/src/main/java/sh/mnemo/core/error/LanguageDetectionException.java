// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mnemo.core.error;

import java.util.List;

/**
 * Thrown when input cannot be attributed to exactly one supported language.
 *
 * <p>{@link #candidates()} is empty when no wordlist contains the input, and holds
 * every matching language identifier when more than one does.
 *
 * @since 0.1.0
 */
public final class LanguageDetectionException extends MnemonicException {

    private final List<String> candidates;

    public LanguageDetectionException(final String message, final List<String> candidates) {
        super(message);
        this.candidates = List.copyOf(candidates);
    }

    /**
     * Returns the languages whose wordlists matched the input.
     *
     * @return immutable list of matching language identifiers, possibly empty
     */
    public List<String> candidates() {
        return candidates;
    }

    public boolean isAmbiguous() {
        return candidates.size() > 1;
    }
}
