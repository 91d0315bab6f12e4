// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mnemo.core.wordlist;

import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.text.Normalizer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.mnemo.core.crypto.Sha256;
import sh.mnemo.core.error.WordlistLoadException;
import sh.mnemo.core.text.Normalization;
import sh.mnemo.primitives.Hex;

/**
 * An immutable, ordered vocabulary of exactly 2048 words.
 *
 * <p>
 * The position of a word is the 11-bit value it encodes. Lookups go through a hash
 * index built once at construction and keyed by the NFKD form of each entry, so
 * they are correct whatever order the list is in; several published lists are not
 * sorted by code point, which rules out binary search.
 *
 * <p>
 * Instances are safe to share between threads without synchronization.
 *
 * @see Wordlists
 */
public final class Wordlist {

    private static final Logger LOG = LoggerFactory.getLogger(Wordlist.class);

    /** Number of entries in every wordlist (2^11). */
    public static final int SIZE = 2048;

    private final String name;
    private final List<String> words;
    private final Map<String, Integer> index;

    private Wordlist(final String name, final List<String> words, final Map<String, Integer> index) {
        this.name = name;
        this.words = words;
        this.index = index;
    }

    /**
     * Loads and validates the bundled wordlist of a language.
     *
     * <p>
     * On top of the format checks of {@link #read}, the raw file must match the
     * language's published SHA-256 digest and, for validated languages, every entry
     * must satisfy {@link Language#acceptsEntry}.
     *
     * @param language the language to load
     * @return the wordlist
     * @throws WordlistLoadException if the resource is missing, unreadable or invalid
     */
    public static Wordlist load(final Language language) {
        if (language == null) {
            throw new IllegalArgumentException("Language cannot be null");
        }

        final byte[] raw;
        try (InputStream is = Wordlist.class.getResourceAsStream(language.resourceName())) {
            if (is == null) {
                throw fail(language.id(), "resource not found: " + language.resourceName(), null);
            }
            raw = is.readAllBytes();
        } catch (IOException e) {
            throw fail(language.id(), "resource unreadable", e);
        }

        final String digest = Hex.encodeNoPrefix(Sha256.hash(raw));
        if (!digest.equals(language.sha256())) {
            throw fail(language.id(), "digest " + digest + " does not match published " + language.sha256(), null);
        }

        final List<String> entries = parse(language.id(), raw);
        for (int i = 0; i < entries.size(); i++) {
            if (!language.acceptsEntry(entries.get(i))) {
                throw fail(language.id(), "entry " + i + " violates the " + language.id() + " alphabet or length rules", null);
            }
        }

        final Wordlist wordlist = of(language.id(), entries);
        LOG.debug("Loaded {} wordlist ({} words, sha256 {})", language.id(), wordlist.size(), digest);
        return wordlist;
    }

    /**
     * Reads a wordlist from a caller-supplied stream.
     *
     * <p>
     * The stream must hold UTF-8 text without a byte-order mark, one word per line,
     * exactly {@value #SIZE} distinct lines. A final newline is optional. The stream
     * is read to the end but not closed.
     *
     * @param name identifier reported by {@link #name()} and language detection
     * @param in   the source
     * @return the wordlist
     * @throws WordlistLoadException if the stream cannot be read or the content is invalid
     */
    public static Wordlist read(final String name, final InputStream in) {
        if (name == null || in == null) {
            throw new IllegalArgumentException("Name and stream cannot be null");
        }
        final byte[] raw;
        try {
            raw = in.readAllBytes();
        } catch (IOException e) {
            throw fail(name, "stream unreadable", e);
        }
        return of(name, parse(name, raw));
    }

    /**
     * Creates a wordlist from entries already in memory.
     *
     * @param name  identifier of the list
     * @param words exactly {@value #SIZE} distinct entries in index order
     * @return the wordlist
     * @throws WordlistLoadException if the count is wrong or entries repeat
     */
    public static Wordlist of(final String name, final List<String> words) {
        if (name == null || words == null) {
            throw new IllegalArgumentException("Name and words cannot be null");
        }
        if (words.size() != SIZE) {
            throw fail(name, "expected " + SIZE + " words, got " + words.size(), null);
        }

        final var index = new HashMap<String, Integer>(SIZE * 2);
        for (int i = 0; i < SIZE; i++) {
            final String word = words.get(i);
            if (word == null || word.isEmpty() || word.codePoints().anyMatch(Character::isWhitespace)) {
                throw fail(name, "entry " + i + " is empty or contains whitespace", null);
            }
            final Integer previous = index.putIfAbsent(Normalization.normalize(word), i);
            if (previous != null) {
                throw fail(name, "entry " + i + " duplicates entry " + previous, null);
            }
        }
        return new Wordlist(name, List.copyOf(words), Collections.unmodifiableMap(index));
    }

    /**
     * Returns the identifier of this list, e.g. {@code "english"}.
     */
    public String name() {
        return name;
    }

    public int size() {
        return words.size();
    }

    /**
     * Returns the word at the specified index.
     *
     * @param index the wordlist index (0-2047)
     * @return the word at the given index
     * @throws IndexOutOfBoundsException if index is not in range [0, 2047]
     */
    public String word(final int index) {
        return words.get(index);
    }

    /**
     * Returns the index of a word. The word is normalized before the lookup.
     *
     * @param word the word to look up
     * @return the index (0-2047), or -1 if the word is not in the list
     */
    public int indexOf(final String word) {
        if (word == null) {
            throw new IllegalArgumentException("Word cannot be null");
        }
        final Integer i = index.get(Normalization.normalize(word));
        return i == null ? -1 : i;
    }

    public boolean contains(final String word) {
        return indexOf(word) >= 0;
    }

    /**
     * Returns all entries, in index order.
     *
     * @return immutable list of {@value #SIZE} words
     */
    public List<String> words() {
        return words;
    }

    /**
     * Returns every entry that starts with the given prefix, in index order.
     *
     * @param prefix the prefix to match, compared as-is
     * @return matching entries, possibly empty
     */
    public List<String> wordsWithPrefix(final String prefix) {
        if (prefix == null) {
            throw new IllegalArgumentException("Prefix cannot be null");
        }
        return words.stream().filter(w -> w.startsWith(prefix)).toList();
    }

    /**
     * Groups entries that share their first {@code length} code points.
     *
     * <p>
     * Entries are compared in NFKC form, the form users see. A well formed list
     * lets every word be identified by its first four letters, so for {@code length}
     * 4 the result is empty.
     *
     * @param length number of leading code points to compare
     * @return prefixes shared by two or more entries, each with its entries in index order
     */
    public Map<String, List<String>> duplicatePrefixes(final int length) {
        if (length < 1) {
            throw new IllegalArgumentException("Prefix length must be positive, got " + length);
        }
        final var groups = new LinkedHashMap<String, List<String>>();
        for (String word : words) {
            final String composed = Normalizer.normalize(word, Normalizer.Form.NFKC);
            final int end = composed.offsetByCodePoints(0, Math.min(length, composed.codePointCount(0, composed.length())));
            groups.computeIfAbsent(composed.substring(0, end), k -> new ArrayList<>()).add(word);
        }
        groups.values().removeIf(group -> group.size() < 2);
        return Collections.unmodifiableMap(groups);
    }

    @Override
    public String toString() {
        return "Wordlist[" + name + ", " + words.size() + " words]";
    }

    private static List<String> parse(final String name, final byte[] raw) {
        if (raw.length >= 3 && (raw[0] & 0xFF) == 0xEF && (raw[1] & 0xFF) == 0xBB && (raw[2] & 0xFF) == 0xBF) {
            throw fail(name, "byte-order mark not allowed", null);
        }

        final String text;
        try {
            text = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(raw))
                    .toString();
        } catch (CharacterCodingException e) {
            throw fail(name, "content is not valid UTF-8", e);
        }

        final var lines = new ArrayList<String>(SIZE);
        int start = 0;
        while (start < text.length()) {
            int end = text.indexOf('\n', start);
            if (end < 0) {
                end = text.length();
            }
            String line = text.substring(start, end);
            if (line.endsWith("\r")) {
                line = line.substring(0, line.length() - 1);
            }
            lines.add(line);
            start = end + 1;
        }
        return lines;
    }

    private static WordlistLoadException fail(final String name, final String reason, final Throwable cause) {
        LOG.warn("Rejected {} wordlist: {}", name, reason);
        final String message = "Invalid " + name + " wordlist: " + reason;
        return cause == null ? new WordlistLoadException(message) : new WordlistLoadException(message, cause);
    }
}
