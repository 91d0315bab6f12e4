// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mnemo.core.seed;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import org.bouncycastle.crypto.digests.SHA512Digest;
import org.bouncycastle.crypto.generators.PKCS5S2ParametersGenerator;
import org.bouncycastle.crypto.params.KeyParameter;

import sh.mnemo.core.DebugLogger;
import sh.mnemo.core.text.Normalization;

/**
 * Derives the 64-byte binary seed from a phrase and a passphrase.
 *
 * <p>
 * PBKDF2 with HMAC-SHA512, 2048 iterations. The password is the UTF-8 encoding of
 * the normalized phrase and the salt is the UTF-8 encoding of {@code "mnemonic"}
 * followed by the normalized passphrase. No wordlist is involved, so any phrase,
 * valid or not, yields a seed.
 *
 * <p>
 * Derivation is CPU bound and cannot be interrupted part way; run it on a worker
 * thread if the caller needs to stay responsive.
 */
public final class SeedDeriver {

    /** PBKDF2 iteration count. */
    public static final int ITERATIONS = 2048;

    /** Length of the derived seed. */
    public static final int SEED_LENGTH_BYTES = 64;

    private static final String SALT_PREFIX = "mnemonic";

    private SeedDeriver() {
        // Utility class
    }

    /**
     * Derives a seed using PBKDF2-HMAC-SHA512.
     *
     * @param mnemonic   the mnemonic phrase
     * @param passphrase the passphrase (can be empty string, but not null)
     * @return 64-byte seed
     * @throws IllegalArgumentException if mnemonic is null or passphrase is null
     */
    public static byte[] toSeed(final String mnemonic, final String passphrase) {
        if (mnemonic == null) {
            throw new IllegalArgumentException("Mnemonic cannot be null");
        }
        if (passphrase == null) {
            throw new IllegalArgumentException("Passphrase cannot be null");
        }

        final byte[] password = Normalization.normalize(mnemonic).getBytes(StandardCharsets.UTF_8);
        final byte[] salt = (SALT_PREFIX + Normalization.normalize(passphrase)).getBytes(StandardCharsets.UTF_8);

        final long started = System.nanoTime();
        try {
            final var generator = new PKCS5S2ParametersGenerator(new SHA512Digest());
            generator.init(password, salt, ITERATIONS);
            final var key = (KeyParameter) generator.generateDerivedParameters(SEED_LENGTH_BYTES * 8);
            return key.getKey();
        } finally {
            Arrays.fill(password, (byte) 0);
            Arrays.fill(salt, (byte) 0);
            DebugLogger.log("[SEED] derived %d bytes in %d ms",
                    SEED_LENGTH_BYTES, (System.nanoTime() - started) / 1_000_000);
        }
    }
}
