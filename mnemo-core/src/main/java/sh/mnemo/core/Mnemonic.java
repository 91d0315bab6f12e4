// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mnemo.core;

import java.security.SecureRandom;
import java.util.Arrays;
import java.util.List;

import sh.mnemo.core.codec.EntropyCodec;
import sh.mnemo.core.codec.MnemonicChecker;
import sh.mnemo.core.codec.WordCountPolicy;
import sh.mnemo.core.error.InvalidEntropyLengthException;
import sh.mnemo.core.seed.SeedDeriver;
import sh.mnemo.core.text.Normalization;
import sh.mnemo.core.wordlist.Language;
import sh.mnemo.core.wordlist.LanguageDetector;
import sh.mnemo.core.wordlist.PrefixExpander;
import sh.mnemo.core.wordlist.Wordlist;
import sh.mnemo.core.wordlist.Wordlists;

/**
 * BIP-39 mnemonic phrases bound to one wordlist.
 *
 * <p>
 * A handle converts entropy to a phrase and back, validates phrases and expands
 * abbreviated words, all against the wordlist chosen at construction. Seed
 * derivation, normalization and language detection do not depend on a handle and
 * are static.
 *
 * <h2>Security Considerations</h2>
 *
 * <ul>
 *   <li><b>Phrases, entropy and seeds are secrets.</b> Exceptions and logs produced by
 *       this library never include them; keep it that way in calling code.</li>
 *   <li><b>Byte arrays can be wiped, strings cannot.</b> Clear entropy and seed arrays
 *       with {@link Arrays#fill(byte[], byte)} once they are no longer needed.</li>
 *   <li><b>Randomness is the caller's job.</b> {@link #generate} only encodes what the
 *       supplied {@link SecureRandom} produces.</li>
 * </ul>
 *
 * <h2>Usage Examples</h2>
 *
 * <pre>{@code
 * Mnemonic mnemonic = new Mnemonic(Language.ENGLISH);
 *
 * String phrase = mnemonic.generate(128, new SecureRandom());
 * boolean ok = mnemonic.check(phrase);
 * byte[] entropy = mnemonic.toEntropy(phrase);
 *
 * byte[] seed = Mnemonic.toSeed(phrase, "optional passphrase");
 * String language = Mnemonic.detectLanguage("security"); // "english"
 * }</pre>
 *
 * <p>
 * Handles are immutable and thread-safe.
 *
 * @see <a href="https://github.com/bitcoin/bips/blob/master/bip-0039.mediawiki">BIP-39</a>
 * @since 0.1.0
 */
public final class Mnemonic {

    /** IDEOGRAPHIC SPACE (U+3000), accepted as a word separator everywhere. */
    public static final String IDEOGRAPHIC_SPACE = Normalization.IDEOGRAPHIC_SPACE;

    private final Wordlist wordlist;
    private final EntropyCodec codec;
    private final MnemonicChecker checker;
    private final PrefixExpander expander;

    /**
     * Creates a handle for a bundled language that decodes any positive multiple of
     * three words.
     *
     * @param language the language
     * @throws sh.mnemo.core.error.WordlistLoadException if the wordlist cannot be loaded
     */
    public Mnemonic(final Language language) {
        this(language, WordCountPolicy.RELAXED);
    }

    /**
     * Creates a handle for a bundled language.
     *
     * @param language the language
     * @param policy   the phrase lengths {@link #toEntropy} and {@link #check} accept
     * @throws sh.mnemo.core.error.WordlistLoadException if the wordlist cannot be loaded
     */
    public Mnemonic(final Language language, final WordCountPolicy policy) {
        this(Wordlists.get(language), policy);
    }

    /**
     * Creates a handle over a caller-supplied wordlist that decodes any positive
     * multiple of three words.
     *
     * @param wordlist the wordlist, e.g. from {@link Wordlist#read}
     */
    public Mnemonic(final Wordlist wordlist) {
        this(wordlist, WordCountPolicy.RELAXED);
    }

    /**
     * Creates a handle over a caller-supplied wordlist.
     *
     * @param wordlist the wordlist
     * @param policy   the phrase lengths {@link #toEntropy} and {@link #check} accept
     */
    public Mnemonic(final Wordlist wordlist, final WordCountPolicy policy) {
        this.wordlist = wordlist;
        this.codec = new EntropyCodec(wordlist, policy);
        this.checker = new MnemonicChecker(codec);
        this.expander = new PrefixExpander(wordlist);
    }

    /**
     * Creates a handle from a language identifier such as {@code "english"}.
     *
     * @param languageId the identifier
     * @return a handle with the {@link WordCountPolicy#RELAXED} word counts
     * @throws sh.mnemo.core.error.WordlistLoadException if the language is not supported
     */
    public static Mnemonic of(final String languageId) {
        return of(languageId, WordCountPolicy.RELAXED);
    }

    /**
     * Creates a handle from a language identifier and a word count policy.
     *
     * @param languageId the identifier
     * @param policy     the phrase lengths {@link #toEntropy} and {@link #check} accept
     * @return the handle
     * @throws sh.mnemo.core.error.WordlistLoadException if the language is not supported
     */
    public static Mnemonic of(final String languageId, final WordCountPolicy policy) {
        return new Mnemonic(Language.fromId(languageId), policy);
    }

    /**
     * Returns the wordlist this handle is bound to.
     */
    public Wordlist wordlist() {
        return wordlist;
    }

    /**
     * Returns the identifier of the bound wordlist, e.g. {@code "english"}.
     */
    public String language() {
        return wordlist.name();
    }

    /**
     * Encodes entropy as a mnemonic phrase.
     *
     * @param entropy 16, 20, 24, 28 or 32 bytes
     * @return words joined by single ASCII spaces
     * @throws InvalidEntropyLengthException if the entropy length is not supported
     */
    public String toMnemonic(final byte[] entropy) {
        return codec.toMnemonic(entropy);
    }

    /**
     * Decodes phrase words back to entropy.
     *
     * @param words the words of the phrase
     * @return the entropy
     * @throws sh.mnemo.core.error.MnemonicDecodingException on a bad length, an unknown
     *                                                      word or a checksum mismatch
     */
    public byte[] toEntropy(final List<String> words) {
        return codec.toEntropy(words);
    }

    /**
     * Decodes a phrase back to entropy. The phrase is normalized and split on
     * whitespace, including ideographic spaces.
     *
     * @param phrase the phrase
     * @return the entropy
     * @throws sh.mnemo.core.error.MnemonicDecodingException on a bad length, an unknown
     *                                                      word or a checksum mismatch
     */
    public byte[] toEntropy(final String phrase) {
        if (phrase == null) {
            throw new IllegalArgumentException("Phrase cannot be null");
        }
        return codec.toEntropy(Normalization.splitWords(phrase));
    }

    /**
     * Validates a phrase without throwing.
     *
     * @param mnemonic the phrase, may be {@code null}
     * @return {@code true} if the phrase decodes and its checksum matches
     */
    public boolean check(final String mnemonic) {
        return checker.check(mnemonic);
    }

    /**
     * Expands a unique prefix to its full word; anything else is returned unchanged.
     *
     * @param prefix the possibly truncated word
     * @return the full word, or {@code prefix}
     */
    public String expandWord(final String prefix) {
        return expander.expandWord(prefix);
    }

    /**
     * Expands every word of a sentence with {@link #expandWord}.
     *
     * @param sentence whitespace separated words
     * @return the words expanded and joined by single spaces
     */
    public String expand(final String sentence) {
        return expander.expand(sentence);
    }

    /**
     * Generates a phrase from fresh entropy.
     *
     * @param strength entropy size in bits: 128, 160, 192, 224 or 256
     * @param random   the source of randomness
     * @return a new phrase of {@code strength * 33 / 352} words
     * @throws InvalidEntropyLengthException if strength is not supported
     */
    public String generate(final int strength, final SecureRandom random) {
        if (random == null) {
            throw new IllegalArgumentException("Random cannot be null");
        }
        if (!EntropyCodec.isValidEntropyBits(strength)) {
            throw new InvalidEntropyLengthException(strength);
        }

        final byte[] entropy = new byte[strength / 8];
        random.nextBytes(entropy);
        try {
            return codec.toMnemonic(entropy);
        } finally {
            Arrays.fill(entropy, (byte) 0);
        }
    }

    // ═══════════════════════════════════════════════════════════════
    // Language independent operations
    // ═══════════════════════════════════════════════════════════════

    /**
     * Derives the 64-byte seed of a phrase with an empty passphrase.
     *
     * @param mnemonic the phrase
     * @return 64-byte seed
     */
    public static byte[] toSeed(final String mnemonic) {
        return SeedDeriver.toSeed(mnemonic, "");
    }

    /**
     * Derives the 64-byte seed of a phrase and passphrase.
     *
     * @param mnemonic   the phrase; it does not have to pass {@link #check}
     * @param passphrase the passphrase, empty for none
     * @return 64-byte seed
     */
    public static byte[] toSeed(final String mnemonic, final String passphrase) {
        return SeedDeriver.toSeed(mnemonic, passphrase);
    }

    /**
     * Applies the normalization used for phrases and passphrases.
     *
     * @param text the text
     * @return NFKD text with ideographic spaces replaced by ASCII spaces
     */
    public static String normalizeString(final String text) {
        return Normalization.normalize(text);
    }

    /**
     * Lists the identifiers of all supported languages.
     *
     * @return immutable list, in a fixed order
     */
    public static List<String> listLanguages() {
        return Language.ids();
    }

    /**
     * Detects the language a word, or every word of a phrase, belongs to.
     *
     * @param word a word or phrase
     * @return the language identifier
     * @throws sh.mnemo.core.error.LanguageDetectionException if zero or several
     *                                                       languages match
     */
    public static String detectLanguage(final String word) {
        return LanguageDetector.supported().detect(word);
    }

    @Override
    public String toString() {
        return "Mnemonic[language=" + wordlist.name() + ", policy=" + codec.policy() + "]";
    }
}
