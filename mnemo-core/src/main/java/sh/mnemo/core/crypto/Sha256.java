// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mnemo.core.crypto;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Objects;

/**
 * SHA-256 hashing utility.
 *
 * <p>
 * Used for mnemonic checksums and for verifying shipped wordlists against their
 * published digests.
 *
 * <h2>ThreadLocal Memory Management</h2>
 *
 * <p>
 * One {@link MessageDigest} is cached per thread. In thread pools that outlive the
 * application's class loader (servlet containers, hot-redeploying servers) call
 * {@link #cleanup()} when a worker is done with the library, for example in a
 * filter's {@code finally} block.
 *
 * @since 0.1.0
 */
public final class Sha256 {

    private static final String ALGORITHM = "SHA-256";

    private static final ThreadLocal<MessageDigest> DIGEST = ThreadLocal.withInitial(() -> {
        try {
            return MessageDigest.getInstance(ALGORITHM);
        } catch (NoSuchAlgorithmException e) {
            // SHA-256 is required by the Java platform
            throw new AssertionError("SHA-256 algorithm not available", e);
        }
    });

    private Sha256() {
        // Utility class
    }

    /**
     * Computes the SHA-256 hash of the input bytes.
     *
     * @param input the data to hash
     * @return 32-byte hash
     * @throws NullPointerException if input is null
     */
    public static byte[] hash(final byte[] input) {
        Objects.requireNonNull(input, "input cannot be null");

        final MessageDigest digest = DIGEST.get();
        digest.reset();
        return digest.digest(input);
    }

    /**
     * Returns the leading {@code bits} bits of SHA-256({@code input}) as an
     * unsigned integer, most significant bit first.
     *
     * @param input the data to hash
     * @param bits  how many leading bits to keep, 1 to 8
     * @return the leading bits, right-aligned
     * @throws IllegalArgumentException if bits is outside 1..8
     */
    public static int leadingBits(final byte[] input, final int bits) {
        if (bits < 1 || bits > 8) {
            throw new IllegalArgumentException("bits must be between 1 and 8, got " + bits);
        }
        return (hash(input)[0] & 0xFF) >>> (8 - bits);
    }

    /**
     * Removes the cached digest instance from the current thread.
     *
     * @see ThreadLocal#remove()
     */
    public static void cleanup() {
        DIGEST.remove();
    }
}
