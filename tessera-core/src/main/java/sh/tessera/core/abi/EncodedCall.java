// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.abi;

import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import sh.tessera.core.types.HexData;
import sh.tessera.primitives.Hex;

/**
 * The result of encoding a call: a 4-byte selector, the head words and the tail.
 *
 * <p>
 * The head has one 32-byte word per parameter. Dynamic parameters hold an offset into
 * the argument block ({@code head ++ tail}), measured from its first byte.
 *
 * @since 0.1.0
 */
public final class EncodedCall {

    private final byte[] selector;
    private final List<byte[]> head;
    private final byte[] tail;

    EncodedCall(final byte[] selector, final List<byte[]> head, final byte[] tail) {
        this.selector = Objects.requireNonNull(selector, "selector").clone();
        this.head = new ArrayList<>(head.size());
        for (byte[] word : head) {
            this.head.add(word.clone());
        }
        this.tail = Objects.requireNonNull(tail, "tail").clone();
    }

    public byte[] selector() {
        return selector.clone();
    }

    /**
     * Returns copies of the head words, in parameter order.
     *
     * @return the head words
     */
    public List<byte[]> head() {
        final List<byte[]> copy = new ArrayList<>(head.size());
        for (byte[] word : head) {
            copy.add(word.clone());
        }
        return copy;
    }

    public byte[] tail() {
        return tail.clone();
    }

    /**
     * Returns the argument block without the selector.
     *
     * @return {@code head ++ tail}
     */
    public byte[] arguments() {
        final ByteArrayOutputStream out = new ByteArrayOutputStream(head.size() * Words.WORD_SIZE + tail.length);
        for (byte[] word : head) {
            out.writeBytes(word);
        }
        out.writeBytes(tail);
        return out.toByteArray();
    }

    /**
     * Returns the full call data.
     *
     * @return {@code selector ++ head ++ tail}
     */
    public byte[] toBytes() {
        final byte[] args = arguments();
        final byte[] out = new byte[selector.length + args.length];
        System.arraycopy(selector, 0, out, 0, selector.length);
        System.arraycopy(args, 0, out, selector.length, args.length);
        return out;
    }

    public String toHex() {
        return Hex.encode(toBytes());
    }

    public HexData toHexData() {
        return new HexData(toHex());
    }

    /**
     * Returns the selector as {@code 0x} followed by 8 lowercase hex characters.
     *
     * @return the selector hex
     */
    public String selectorHex() {
        return Hex.encode(selector);
    }

    @Override
    public String toString() {
        return toHex();
    }
}
