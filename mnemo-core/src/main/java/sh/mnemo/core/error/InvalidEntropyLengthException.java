// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mnemo.core.error;

/**
 * Thrown when entropy handed to the encoder, or a requested generation strength,
 * is not one of 128, 160, 192, 224 or 256 bits.
 *
 * @since 0.1.0
 */
public final class InvalidEntropyLengthException extends MnemonicException {

    private final int bits;

    public InvalidEntropyLengthException(final int bits) {
        super("Entropy must be 128, 160, 192, 224 or 256 bits, got " + bits);
        this.bits = bits;
    }

    /**
     * Returns the rejected length in bits.
     *
     * @return the bit length that was supplied
     */
    public int bits() {
        return bits;
    }
}
