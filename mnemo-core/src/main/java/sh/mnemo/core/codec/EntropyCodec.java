// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mnemo.core.codec;

import java.util.Arrays;
import java.util.List;

import sh.mnemo.core.DebugLogger;
import sh.mnemo.core.crypto.Sha256;
import sh.mnemo.core.error.InvalidEntropyLengthException;
import sh.mnemo.core.error.MnemonicDecodingException;
import sh.mnemo.core.wordlist.Wordlist;

/**
 * Converts entropy to a mnemonic phrase and back, bound to one wordlist.
 *
 * <p>
 * Encoding appends {@code bits/32} checksum bits, taken from the front of
 * SHA-256(entropy), to the entropy bits and reads the result as consecutive 11-bit
 * big-endian word indices. Decoding reverses this and recomputes the checksum.
 *
 * <p>
 * Instances hold no mutable state and can be shared between threads. Entropy is
 * never retained.
 *
 * @see <a href="https://github.com/bitcoin/bips/blob/master/bip-0039.mediawiki">BIP-39</a>
 */
public final class EntropyCodec {

    private static final int BITS_PER_WORD = 11;
    private static final int WORD_MASK = (1 << BITS_PER_WORD) - 1;

    private final Wordlist wordlist;
    private final WordCountPolicy policy;

    public EntropyCodec(final Wordlist wordlist, final WordCountPolicy policy) {
        if (wordlist == null || policy == null) {
            throw new IllegalArgumentException("Wordlist and policy cannot be null");
        }
        this.wordlist = wordlist;
        this.policy = policy;
    }

    public Wordlist wordlist() {
        return wordlist;
    }

    public WordCountPolicy policy() {
        return policy;
    }

    /**
     * Returns whether {@code bits} is a valid entropy size: 128 to 256 in steps of 32.
     */
    public static boolean isValidEntropyBits(final int bits) {
        return bits >= 128 && bits <= 256 && bits % 32 == 0;
    }

    /**
     * Encodes entropy as a phrase of words joined by single ASCII spaces.
     *
     * @param entropy 16, 20, 24, 28 or 32 bytes
     * @return the mnemonic phrase (12 to 24 words)
     * @throws InvalidEntropyLengthException if the entropy has any other length
     */
    public String toMnemonic(final byte[] entropy) {
        if (entropy == null) {
            throw new IllegalArgumentException("Entropy cannot be null");
        }
        final int entropyBits = entropy.length * 8;
        if (!isValidEntropyBits(entropyBits)) {
            throw new InvalidEntropyLengthException(entropyBits);
        }

        final int checksumBits = entropyBits / 32;
        final int checksum = Sha256.leadingBits(entropy, checksumBits);
        final int wordCount = (entropyBits + checksumBits) / BITS_PER_WORD;

        final var words = new StringBuilder(wordCount * 9);
        int acc = 0;
        int accBits = 0;
        for (int i = 0; i <= entropy.length; i++) {
            // The checksum is fed in as a final, shorter chunk.
            final int chunkBits = i < entropy.length ? 8 : checksumBits;
            final int chunk = i < entropy.length ? entropy[i] & 0xFF : checksum;
            acc = (acc << chunkBits) | chunk;
            accBits += chunkBits;

            while (accBits >= BITS_PER_WORD) {
                accBits -= BITS_PER_WORD;
                if (words.length() > 0) {
                    words.append(' ');
                }
                words.append(wordlist.word((acc >>> accBits) & WORD_MASK));
                acc &= (1 << accBits) - 1;
            }
        }

        DebugLogger.log("[ENCODE] language=%s entropyBits=%d words=%d", wordlist.name(), entropyBits, wordCount);
        return words.toString();
    }

    /**
     * Decodes a phrase, already split into words, back to its entropy.
     *
     * <p>
     * Each word is NFKD-normalized by {@link Wordlist#indexOf} before it is looked
     * up. Checks run in order: word
     * count, then every word, then the checksum.
     *
     * @param words the phrase words
     * @return the entropy (4 bytes per 3 words)
     * @throws MnemonicDecodingException with kind {@code INVALID_MNEMONIC_LENGTH},
     *                                   {@code UNKNOWN_WORD} or {@code CHECKSUM_MISMATCH}
     */
    public byte[] toEntropy(final List<String> words) {
        if (words == null) {
            throw new IllegalArgumentException("Words cannot be null");
        }
        final int wordCount = words.size();
        if (!policy.accepts(wordCount)) {
            DebugLogger.log("[DECODE] rejected length words=%d policy=%s", wordCount, policy);
            throw MnemonicDecodingException.invalidLength(wordCount, policy.description());
        }

        final int[] indices = new int[wordCount];
        for (int i = 0; i < wordCount; i++) {
            final String word = words.get(i);
            indices[i] = word == null ? -1 : wordlist.indexOf(word);
            if (indices[i] < 0) {
                DebugLogger.log("[DECODE] unknown word position=%d language=%s", i, wordlist.name());
                throw MnemonicDecodingException.unknownWord(i, wordlist.name());
            }
        }

        final int totalBits = wordCount * BITS_PER_WORD;
        final int checksumBits = totalBits / 33;
        final int entropyBits = totalBits - checksumBits;
        final byte[] entropy = new byte[entropyBits / 8];
        for (int bit = 0; bit < entropyBits; bit++) {
            if (bitAt(indices, bit)) {
                entropy[bit >>> 3] |= (byte) (0x80 >>> (bit & 7));
            }
        }

        // One checksum bit per 32 entropy bits; phrases past 768 words would need more
        // checksum bits than SHA-256 has and can never verify.
        final byte[] hash = Sha256.hash(entropy);
        boolean matches = checksumBits <= hash.length * 8;
        for (int i = 0; matches && i < checksumBits; i++) {
            final boolean expected = (hash[i >>> 3] & (0x80 >>> (i & 7))) != 0;
            matches = bitAt(indices, entropyBits + i) == expected;
        }
        Arrays.fill(indices, 0);
        Arrays.fill(hash, (byte) 0);

        if (!matches) {
            Arrays.fill(entropy, (byte) 0);
            DebugLogger.log("[DECODE] checksum mismatch words=%d language=%s", wordCount, wordlist.name());
            throw MnemonicDecodingException.checksumMismatch(wordCount);
        }
        return entropy;
    }

    /** Reads bit {@code bit} of the phrase, most significant bit of the first word first. */
    private static boolean bitAt(final int[] indices, final int bit) {
        final int shift = BITS_PER_WORD - 1 - bit % BITS_PER_WORD;
        return ((indices[bit / BITS_PER_WORD] >>> shift) & 1) != 0;
    }
}
