// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mnemo.core.error;

/**
 * Thrown when a wordlist cannot be read or violates the wordlist format:
 * wrong entry count, duplicate or malformed entries, a byte-order mark, an
 * unknown language identifier, or a digest that does not match the published list.
 *
 * @since 0.1.0
 */
public final class WordlistLoadException extends MnemonicException {

    public WordlistLoadException(final String message) {
        super(message);
    }

    public WordlistLoadException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
