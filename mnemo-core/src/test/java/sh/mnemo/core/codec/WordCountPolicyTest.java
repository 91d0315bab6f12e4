// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mnemo.core.codec;

import static org.junit.jupiter.api.Assertions.*;

import java.util.stream.IntStream;

import org.junit.jupiter.api.Test;

class WordCountPolicyTest {

    @Test
    void standardAcceptsOnlyEncoderLengths() {
        int[] accepted = IntStream.rangeClosed(0, 30).filter(WordCountPolicy.STANDARD::accepts).toArray();
        assertArrayEquals(new int[] {12, 15, 18, 21, 24}, accepted);
    }

    @Test
    void relaxedAcceptsEveryPositiveMultipleOfThree() {
        int[] accepted = IntStream.rangeClosed(0, 30).filter(WordCountPolicy.RELAXED::accepts).toArray();
        assertArrayEquals(new int[] {3, 6, 9, 12, 15, 18, 21, 24, 27, 30}, accepted);
        assertTrue(WordCountPolicy.RELAXED.accepts(771));
        assertFalse(WordCountPolicy.RELAXED.accepts(772));
    }
}
