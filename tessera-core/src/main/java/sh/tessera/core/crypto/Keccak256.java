// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.crypto;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

import org.bouncycastle.jcajce.provider.digest.Keccak;

/**
 * Keccak-256 hashing, as used for function selectors, event topics and
 * address derivation.
 *
 * <p>
 * This is the original Keccak padding, not the NIST SHA3-256 variant. Digest instances
 * are cached per thread; call {@link #cleanup()} before returning a pooled thread to a
 * container that may unload this class.
 *
 * <pre>{@code
 * byte[] topic = Keccak256.hash("Transfer(address,address,uint256)");
 * }</pre>
 *
 * @since 0.1.0
 */
public final class Keccak256 {

    private static final ThreadLocal<Keccak.Digest256> DIGEST = ThreadLocal.withInitial(Keccak.Digest256::new);

    private Keccak256() {
        // Utility class
    }

    /**
     * Computes the Keccak-256 hash of the input bytes.
     *
     * @param input the data to hash
     * @return 32-byte hash
     * @throws NullPointerException if input is null
     */
    public static byte[] hash(final byte[] input) {
        Objects.requireNonNull(input, "input cannot be null");

        final Keccak.Digest256 digest = DIGEST.get();
        digest.reset();
        return digest.digest(input);
    }

    /**
     * Computes the Keccak-256 hash of several arrays as if they were concatenated.
     *
     * @param inputs the data arrays to hash
     * @return 32-byte hash
     * @throws NullPointerException if inputs or any element is null
     */
    public static byte[] hash(final byte[]... inputs) {
        Objects.requireNonNull(inputs, "inputs cannot be null");

        final Keccak.Digest256 digest = DIGEST.get();
        digest.reset();
        for (byte[] input : inputs) {
            Objects.requireNonNull(input, "input element cannot be null");
            digest.update(input);
        }
        return digest.digest();
    }

    /**
     * Hashes the UTF-8 bytes of a signature string.
     *
     * @param text the text to hash, typically a canonical signature
     * @return 32-byte hash
     */
    public static byte[] hash(final String text) {
        Objects.requireNonNull(text, "text cannot be null");
        return hash(text.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Removes the cached digest instance from the current thread.
     */
    public static void cleanup() {
        DIGEST.remove();
    }
}
