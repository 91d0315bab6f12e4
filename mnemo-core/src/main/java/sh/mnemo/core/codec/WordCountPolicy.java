// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mnemo.core.codec;

/**
 * Which phrase lengths the decoder accepts.
 *
 * <p>
 * Every accepted length is a multiple of three words, so the phrase always splits
 * into 32 entropy bits plus one checksum bit per three words.
 */
public enum WordCountPolicy {

    /** 12, 15, 18, 21 or 24 words: the lengths the encoder produces. */
    STANDARD(12, 24, "12, 15, 18, 21 or 24"),

    /** Any positive multiple of three. Default for {@link sh.mnemo.core.Mnemonic} handles. */
    RELAXED(3, Integer.MAX_VALUE, "a positive multiple of 3");

    private final int minWords;
    private final int maxWords;
    private final String description;

    WordCountPolicy(final int minWords, final int maxWords, final String description) {
        this.minWords = minWords;
        this.maxWords = maxWords;
        this.description = description;
    }

    public boolean accepts(final int wordCount) {
        return wordCount >= minWords && wordCount <= maxWords && wordCount % 3 == 0;
    }

    /** Human-readable list of accepted counts, used in error messages. */
    public String description() {
        return description;
    }
}
