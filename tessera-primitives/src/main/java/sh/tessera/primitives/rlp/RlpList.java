// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.primitives.rlp;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * RLP list of items.
 *
 * @param items the items, in order (copied, may not contain null)
 */
public record RlpList(List<RlpItem> items) implements RlpItem {

    public RlpList {
        Objects.requireNonNull(items, "items cannot be null");
        items = List.copyOf(items);
    }

    public static RlpList of(final RlpItem... items) {
        return new RlpList(Arrays.asList(items));
    }

    @Override
    public byte[] encode() {
        return Rlp.encodeList(items);
    }
}
