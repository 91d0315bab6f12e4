// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mnemo.core;

/**
 * Global toggle for verbose diagnostics from the codec and seed derivation.
 *
 * <p>Starts from the {@code mnemo.debug} system property and can be flipped at
 * runtime. Diagnostics go through {@link DebugLogger} and never include words,
 * entropy, seeds or passphrases.
 */
public final class MnemoDebug {

    /** System property that enables diagnostics at startup. */
    public static final String PROPERTY = "mnemo.debug";

    private static volatile boolean enabled = Boolean.getBoolean(PROPERTY);

    private MnemoDebug() {
    }

    public static boolean isEnabled() {
        return enabled;
    }

    public static void setEnabled(final boolean value) {
        enabled = value;
    }
}
