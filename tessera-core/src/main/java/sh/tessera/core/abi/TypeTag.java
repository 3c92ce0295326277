// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.abi;

import java.util.Objects;

import sh.tessera.core.error.AbiEncodingException;

/**
 * A Solidity parameter type.
 *
 * <p>
 * Only the canonical families in {@link TypeKind} are modeled. Fixed-size byte arrays,
 * fixed-point numbers, tuples and fixed-length arrays are rejected by {@link #parse(String)}.
 *
 * <h2>Static vs dynamic</h2>
 * <ul>
 * <li>{@code address}, {@code uintN}, {@code intN}, {@code bool}: static, one head word</li>
 * <li>{@code string}, {@code bytes}, {@code T[]}: dynamic, an offset in the head and the
 * payload in the tail</li>
 * </ul>
 *
 * @since 0.1.0
 */
public sealed interface TypeTag
        permits TypeTag.AddressTag, TypeTag.UIntTag, TypeTag.IntTag, TypeTag.BoolTag,
        TypeTag.StringTag, TypeTag.BytesTag, TypeTag.ArrayTag {

    /** {@code address}. */
    TypeTag ADDRESS = new AddressTag();
    /** {@code uint256}. */
    TypeTag UINT256 = new UIntTag(256);
    /** {@code int256}. */
    TypeTag INT256 = new IntTag(256);
    /** {@code bool}. */
    TypeTag BOOL = new BoolTag();
    /** {@code string}. */
    TypeTag STRING = new StringTag();
    /** {@code bytes}. */
    TypeTag BYTES = new BytesTag();

    /**
     * Returns the family of this type, used for exhaustive dispatch.
     *
     * @return the kind
     */
    TypeKind kind();

    /**
     * Returns the canonical Solidity name, as used in signatures (e.g. {@code uint256}).
     *
     * @return the type name
     */
    String typeName();

    /**
     * Returns whether values of this type are encoded in the tail.
     *
     * @return true for {@code string}, {@code bytes} and arrays
     */
    default boolean isDynamic() {
        return switch (kind()) {
            case STRING, BYTES, ARRAY -> true;
            case ADDRESS, UINT, INT, BOOL -> false;
        };
    }

    /**
     * Parses a canonical Solidity type name.
     *
     * @param typeName the name, e.g. {@code address}, {@code uint8}, {@code string[]}
     * @return the matching tag
     * @throws AbiEncodingException with kind {@code UNSUPPORTED_TYPE} for unknown names
     */
    static TypeTag parse(final String typeName) {
        Objects.requireNonNull(typeName, "typeName");
        if (typeName.endsWith("[]")) {
            return new ArrayTag(parse(typeName.substring(0, typeName.length() - 2)));
        }
        switch (typeName) {
            case "address":
                return ADDRESS;
            case "bool":
                return BOOL;
            case "string":
                return STRING;
            case "bytes":
                return BYTES;
            case "uint":
                return UINT256;
            case "int":
                return INT256;
            default:
                break;
        }
        if (typeName.startsWith("uint")) {
            return new UIntTag(parseBits(typeName, 4));
        }
        if (typeName.startsWith("int")) {
            return new IntTag(parseBits(typeName, 3));
        }
        throw AbiEncodingException.unsupportedType(typeName);
    }

    private static int parseBits(final String typeName, final int prefixLength) {
        final String digits = typeName.substring(prefixLength);
        if (digits.isEmpty() || digits.length() > 3 || digits.charAt(0) == '0'
                || !digits.chars().allMatch(Character::isDigit)) {
            throw AbiEncodingException.unsupportedType(typeName);
        }
        final int bits = Integer.parseInt(digits);
        if (!validBits(bits)) {
            throw AbiEncodingException.unsupportedType(typeName);
        }
        return bits;
    }

    private static boolean validBits(final int bits) {
        return bits >= 8 && bits <= 256 && bits % 8 == 0;
    }

    /** {@code address}: 20 bytes, right-aligned in one word. */
    record AddressTag() implements TypeTag {
        @Override
        public TypeKind kind() {
            return TypeKind.ADDRESS;
        }

        @Override
        public String typeName() {
            return "address";
        }
    }

    /**
     * {@code uintN}.
     *
     * @param bits width, a multiple of 8 in {@code [8, 256]}
     */
    record UIntTag(int bits) implements TypeTag {
        public UIntTag {
            if (!validBits(bits)) {
                throw new IllegalArgumentException("Invalid uint width: " + bits);
            }
        }

        @Override
        public TypeKind kind() {
            return TypeKind.UINT;
        }

        @Override
        public String typeName() {
            return "uint" + bits;
        }
    }

    /**
     * {@code intN}, two's complement.
     *
     * @param bits width, a multiple of 8 in {@code [8, 256]}
     */
    record IntTag(int bits) implements TypeTag {
        public IntTag {
            if (!validBits(bits)) {
                throw new IllegalArgumentException("Invalid int width: " + bits);
            }
        }

        @Override
        public TypeKind kind() {
            return TypeKind.INT;
        }

        @Override
        public String typeName() {
            return "int" + bits;
        }
    }

    record BoolTag() implements TypeTag {
        @Override
        public TypeKind kind() {
            return TypeKind.BOOL;
        }

        @Override
        public String typeName() {
            return "bool";
        }
    }

    record StringTag() implements TypeTag {
        @Override
        public TypeKind kind() {
            return TypeKind.STRING;
        }

        @Override
        public String typeName() {
            return "string";
        }
    }

    record BytesTag() implements TypeTag {
        @Override
        public TypeKind kind() {
            return TypeKind.BYTES;
        }

        @Override
        public String typeName() {
            return "bytes";
        }
    }

    /**
     * Dynamic-length array {@code T[]}.
     *
     * @param element the element type
     */
    record ArrayTag(TypeTag element) implements TypeTag {
        public ArrayTag {
            Objects.requireNonNull(element, "element");
        }

        @Override
        public TypeKind kind() {
            return TypeKind.ARRAY;
        }

        @Override
        public String typeName() {
            return element.typeName() + "[]";
        }
    }
}
