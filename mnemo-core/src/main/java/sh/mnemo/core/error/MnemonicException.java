// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mnemo.core.error;

/**
 * Base runtime exception for all mnemo failures.
 *
 * <p>
 * This sealed class forms the root of the exception hierarchy, so every
 * library error can be caught with a single catch clause while pattern
 * matching over the subtypes stays exhaustive.
 *
 * <p>
 * <strong>Exception Hierarchy:</strong>
 * <pre>
 * MnemonicException
 * ├── {@link InvalidEntropyLengthException} - entropy is not 128..256 bits in steps of 32
 * ├── {@link MnemonicDecodingException} - phrase has a bad length, an unknown word or a bad checksum
 * ├── {@link LanguageDetectionException} - a word matches no language, or more than one
 * └── {@link WordlistLoadException} - a wordlist could not be read or failed validation
 * </pre>
 *
 * <p>
 * <strong>Usage:</strong>
 *
 * <pre>{@code
 * try {
 *     byte[] entropy = mnemonic.toEntropy(phrase);
 * } catch (MnemonicDecodingException e) {
 *     switch (e.kind()) {
 *         case UNKNOWN_WORD -> askToRetype(e.position());
 *         case CHECKSUM_MISMATCH -> askToRetypeAll();
 *         case INVALID_MNEMONIC_LENGTH -> showExpectedLengths();
 *     }
 * }
 * }</pre>
 *
 * @since 0.1.0
 */
public sealed class MnemonicException extends RuntimeException
        permits InvalidEntropyLengthException,
        MnemonicDecodingException,
        LanguageDetectionException,
        WordlistLoadException {

    public MnemonicException(final String message) {
        super(message);
    }

    public MnemonicException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
