// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mnemo.core.codec;

import java.util.Arrays;

import sh.mnemo.core.error.MnemonicException;
import sh.mnemo.core.text.Normalization;

/**
 * Boolean validation of a phrase, for call sites that only need a yes or no.
 *
 * <p>
 * A phrase is valid when it has an accepted word count, every word is in the
 * wordlist and the checksum matches. No exception leaves {@link #check}.
 */
public final class MnemonicChecker {

    private final EntropyCodec codec;

    public MnemonicChecker(final EntropyCodec codec) {
        if (codec == null) {
            throw new IllegalArgumentException("Codec cannot be null");
        }
        this.codec = codec;
    }

    /**
     * Validates a phrase. Words may be separated by any whitespace, including
     * ideographic spaces.
     *
     * @param mnemonic the phrase, may be {@code null}
     * @return {@code true} if the phrase decodes and its checksum matches
     */
    public boolean check(final String mnemonic) {
        if (mnemonic == null) {
            return false;
        }
        try {
            final byte[] entropy = codec.toEntropy(Normalization.splitWords(mnemonic));
            Arrays.fill(entropy, (byte) 0);
            return true;
        } catch (MnemonicException e) {
            return false;
        }
    }
}
