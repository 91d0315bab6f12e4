// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mnemo.core.wordlist;

import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import sh.mnemo.core.error.WordlistLoadException;

/**
 * Tests for loading, validating and querying wordlists.
 */
class WordlistTest {

    private static final Wordlist ENGLISH = Wordlist.load(Language.ENGLISH);

    @Test
    void englishHasExpectedSize() {
        assertEquals(Wordlist.SIZE, ENGLISH.size());
        assertEquals(2048, ENGLISH.words().size());
        assertEquals("english", ENGLISH.name());
    }

    @Test
    void wordAtKnownIndices() {
        assertEquals("abandon", ENGLISH.word(0));
        assertEquals("ability", ENGLISH.word(1));
        assertEquals("about", ENGLISH.word(3));
        assertEquals("zone", ENGLISH.word(2046));
        assertEquals("zoo", ENGLISH.word(2047));
    }

    @Test
    void indexOfKnownWords() {
        assertEquals(0, ENGLISH.indexOf("abandon"));
        assertEquals(1558, ENGLISH.indexOf("security"));
        assertEquals(2047, ENGLISH.indexOf("zoo"));
        assertEquals(-1, ENGLISH.indexOf("notaword"));
        assertEquals(-1, ENGLISH.indexOf(""));
    }

    @Test
    void indexOfAndWordAreInverses() {
        for (int i = 0; i < Wordlist.SIZE; i++) {
            assertEquals(i, ENGLISH.indexOf(ENGLISH.word(i)), "index " + i);
        }
    }

    @Test
    void wordRejectsOutOfRangeIndex() {
        assertThrows(IndexOutOfBoundsException.class, () -> ENGLISH.word(-1));
        assertThrows(IndexOutOfBoundsException.class, () -> ENGLISH.word(2048));
    }

    @Test
    void wordsAreImmutable() {
        assertThrows(UnsupportedOperationException.class, () -> ENGLISH.words().set(0, "x"));
    }

    @Test
    void englishEntriesFollowLanguageRules() {
        for (String word : ENGLISH.words()) {
            assertTrue(Language.ENGLISH.acceptsEntry(word), word);
        }
    }

    @Test
    @DisplayName("No two English words share their first four letters")
    void englishHasNoDuplicateFourLetterPrefixes() {
        assertEquals(0, ENGLISH.duplicatePrefixes(4).size());
    }

    @Test
    @DisplayName("No two English words differ by a single easily confused letter")
    void englishHasNoConfusableWordPairs() {
        assertEquals(List.of(), confusablePairs(ENGLISH.words()));
    }

    @Test
    void confusablePairsFindsOneLetterSwaps() {
        assertEquals(List.of("cat/oat"), confusablePairs(List.of("cat", "oat", "dog", "cart")));
        assertEquals(List.of(), confusablePairs(List.of("cat", "bat", "cut")));
    }

    @Test
    void duplicatePrefixesReportsSharedPrefixes() {
        var groups = ENGLISH.duplicatePrefixes(3);
        assertEquals(List.of("access", "accident", "account", "accuse"), groups.get("acc"));
        assertFalse(groups.containsKey("zoo"));
    }

    @Test
    void duplicatePrefixesRejectsNonPositiveLength() {
        assertThrows(IllegalArgumentException.class, () -> ENGLISH.duplicatePrefixes(0));
    }

    @Test
    void wordsWithPrefixKeepsListOrder() {
        assertEquals(List.of("access", "accident", "account", "accuse"), ENGLISH.wordsWithPrefix("acc"));
        assertEquals(List.of("action"), ENGLISH.wordsWithPrefix("acti"));
        assertEquals(List.of(), ENGLISH.wordsWithPrefix("acb"));
    }

    @Test
    void lookupDoesNotDependOnSortOrder() {
        var reversed = new ArrayList<>(TestWordlists.entries("w"));
        java.util.Collections.reverse(reversed);
        Wordlist unsorted = Wordlist.of("reversed", reversed);

        assertEquals(0, unsorted.indexOf("w2047"));
        assertEquals(2047, unsorted.indexOf("w0000"));
        assertEquals(1000, unsorted.indexOf("w1047"));
    }

    @Test
    void lookupIsNormalizationInsensitive() {
        // stored composed, looked up composed and decomposed
        var words = TestWordlists.entriesEndingWith("w", "caf\u00e9");
        Wordlist list = Wordlist.of("accented", words);

        assertEquals(2047, list.indexOf("caf\u00e9"));
        assertEquals(2047, list.indexOf("cafe\u0301"));
    }

    @Test
    void readAcceptsWellFormedStream() {
        Wordlist list = Wordlist.read("custom", stream(TestWordlists.asText(TestWordlists.entries("w"))));
        assertEquals("custom", list.name());
        assertEquals("w0042", list.word(42));
    }

    @Test
    void readAcceptsCrLfAndMissingFinalNewline() {
        String text = String.join("\r\n", TestWordlists.entries("w"));
        assertEquals("w2047", Wordlist.read("crlf", stream(text)).word(2047));
    }

    @Test
    void readRejectsWrongCount() {
        var words = TestWordlists.entries("w").subList(0, 2047);
        var e = assertThrows(WordlistLoadException.class,
                () -> Wordlist.read("short", stream(TestWordlists.asText(words))));
        assertTrue(e.getMessage().contains("expected 2048 words, got 2047"));
    }

    @Test
    void readRejectsDuplicates() {
        var words = TestWordlists.entriesEndingWith("w", "w0000");
        var e = assertThrows(WordlistLoadException.class,
                () -> Wordlist.read("dup", stream(TestWordlists.asText(words))));
        assertTrue(e.getMessage().contains("duplicates entry 0"));
    }

    @Test
    void readRejectsBlankLine() {
        var words = TestWordlists.entriesEndingWith("w", "");
        assertThrows(WordlistLoadException.class,
                () -> Wordlist.read("blank", stream(String.join("\n", words) + "\n")));
    }

    @Test
    void readRejectsEmbeddedWhitespace() {
        var words = TestWordlists.entriesEndingWith("w", "two words");
        assertThrows(WordlistLoadException.class,
                () -> Wordlist.read("spaces", stream(TestWordlists.asText(words))));
    }

    @Test
    void readRejectsByteOrderMark() {
        String text = "\uFEFF" + TestWordlists.asText(TestWordlists.entries("w"));
        var e = assertThrows(WordlistLoadException.class, () -> Wordlist.read("bom", stream(text)));
        assertTrue(e.getMessage().contains("byte-order mark"));
    }

    @Test
    void readRejectsMalformedUtf8() {
        byte[] raw = TestWordlists.asText(TestWordlists.entries("w")).getBytes(StandardCharsets.UTF_8);
        raw[0] = (byte) 0xC3;
        raw[1] = (byte) 0x28;
        assertThrows(WordlistLoadException.class, () -> Wordlist.read("latin1", new ByteArrayInputStream(raw)));
    }

    @Test
    void readWrapsIoFailure() {
        InputStream broken = new InputStream() {
            @Override
            public int read() throws IOException {
                throw new IOException("disk gone");
            }
        };
        var e = assertThrows(WordlistLoadException.class, () -> Wordlist.read("broken", broken));
        assertInstanceOf(IOException.class, e.getCause());
    }

    @Test
    void rejectionIsLoggedAtWarn() {
        Logger logger = (Logger) LoggerFactory.getLogger(Wordlist.class);
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
        try {
            assertThrows(WordlistLoadException.class, () -> Wordlist.of("tiny", List.of("one")));
            assertEquals(1, appender.list.size());
            assertEquals(Level.WARN, appender.list.get(0).getLevel());
            assertTrue(appender.list.get(0).getFormattedMessage().contains("tiny"));
        } finally {
            logger.detachAppender(appender);
        }
    }

    private static InputStream stream(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }

    // Letter pairs that are easy to misread in handwriting
    private static final Set<String> CONFUSABLE = Set.of(
            "ac", "ae", "ao",
            "bd", "bh", "bp", "bq", "br",
            "ce", "cg", "cn", "co", "cq", "cu",
            "dg", "dh", "do", "dp", "dq",
            "ef", "eo",
            "fi", "fj", "fl", "fp", "ft",
            "gj", "go", "gp", "gq", "gy",
            "hk", "hl", "hm", "hn", "hr",
            "ij", "il", "it", "iy",
            "jl", "jp", "jq", "jy",
            "kx",
            "lt",
            "mn", "mw",
            "nu", "nz",
            "op", "oq", "ou", "ov",
            "pq", "pr",
            "qy",
            "sz",
            "uv", "uw", "uy",
            "vw", "vy");

    /** Same-length word pairs whose only difference is one confusable letter pair. */
    private static List<String> confusablePairs(final List<String> words) {
        final var pairs = new ArrayList<String>();
        for (int i = 0; i < words.size(); i++) {
            for (int j = i + 1; j < words.size(); j++) {
                final String a = words.get(i);
                final String b = words.get(j);
                if (a.length() != b.length()) {
                    continue;
                }
                String diff = null;
                int differences = 0;
                for (int k = 0; k < a.length(); k++) {
                    final char x = a.charAt(k);
                    final char y = b.charAt(k);
                    if (x != y) {
                        differences++;
                        diff = x < y ? "" + x + y : "" + y + x;
                    }
                }
                if (differences == 1 && CONFUSABLE.contains(diff)) {
                    pairs.add(a + "/" + b);
                }
            }
        }
        return pairs;
    }
}
