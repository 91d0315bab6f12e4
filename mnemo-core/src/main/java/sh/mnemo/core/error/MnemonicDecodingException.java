// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mnemo.core.error;

/**
 * Exception for phrases that cannot be turned back into entropy.
 *
 * <p>The {@link Kind} tells callers which remediation applies: an unknown word
 * or a checksum failure usually means a transcription error the user can retype,
 * while a wrong length usually means words are missing.
 *
 * <p>Messages never contain the phrase itself. An unknown word is reported by its
 * zero-based position only.
 *
 * @since 0.1.0
 */
public final class MnemonicDecodingException extends MnemonicException {

    /**
     * Categorizes the decoding failure.
     */
    public enum Kind {
        /** Word count is not accepted by the active word count policy. */
        INVALID_MNEMONIC_LENGTH,
        /** A word is not part of the bound wordlist. */
        UNKNOWN_WORD,
        /** Words decode, but the embedded checksum does not match the entropy. */
        CHECKSUM_MISMATCH
    }

    /** The category of decoding failure. */
    private final Kind kind;

    /** Position of the offending word, or -1 when no single word is at fault. */
    private final int position;

    private MnemonicDecodingException(final Kind kind, final String message, final int position) {
        super(message);
        this.kind = kind;
        this.position = position;
    }

    /**
     * Returns the kind of decoding failure.
     *
     * @return the failure kind
     */
    public Kind kind() {
        return kind;
    }

    /**
     * Returns the zero-based position of the unknown word.
     *
     * @return the word position, or -1 for failures not tied to a single word
     */
    public int position() {
        return position;
    }

    // ═══════════════════════════════════════════════════════════════
    // Factory methods for specific error conditions
    // ═══════════════════════════════════════════════════════════════

    /**
     * Creates an exception for a phrase with an unsupported number of words.
     *
     * @param wordCount the number of words supplied
     * @param expected  human-readable description of the accepted counts
     * @return a new exception with kind INVALID_MNEMONIC_LENGTH
     */
    public static MnemonicDecodingException invalidLength(final int wordCount, final String expected) {
        return new MnemonicDecodingException(
                Kind.INVALID_MNEMONIC_LENGTH,
                "Mnemonic must have " + expected + " words, got " + wordCount,
                -1);
    }

    /**
     * Creates an exception for a word missing from the wordlist.
     *
     * @param position     zero-based position of the word in the phrase
     * @param wordlistName name of the wordlist that was searched
     * @return a new exception with kind UNKNOWN_WORD
     */
    public static MnemonicDecodingException unknownWord(final int position, final String wordlistName) {
        return new MnemonicDecodingException(
                Kind.UNKNOWN_WORD,
                "Word at position " + position + " is not in the " + wordlistName + " wordlist",
                position);
    }

    /**
     * Creates an exception for a phrase whose checksum bits do not match.
     *
     * @param wordCount the number of words in the phrase
     * @return a new exception with kind CHECKSUM_MISMATCH
     */
    public static MnemonicDecodingException checksumMismatch(final int wordCount) {
        return new MnemonicDecodingException(
                Kind.CHECKSUM_MISMATCH,
                "Checksum mismatch for " + wordCount + "-word mnemonic",
                -1);
    }
}
