// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.abi;

import java.util.Objects;

/**
 * A named function parameter. Position in the parameter list fixes the head slot.
 *
 * @param name the parameter name, informational only
 * @param type the parameter type
 * @since 0.1.0
 */
public record Param(String name, TypeTag type) {

    public Param {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
    }

    /**
     * Creates a parameter from a Solidity type name.
     *
     * @param name the parameter name
     * @param typeName the canonical type, e.g. {@code uint256}
     * @return the parameter
     */
    public static Param of(final String name, final String typeName) {
        return new Param(name, TypeTag.parse(typeName));
    }
}
