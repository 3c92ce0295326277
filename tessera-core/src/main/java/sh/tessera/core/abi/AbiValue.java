// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.abi;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

import sh.tessera.core.error.AbiEncodingException;
import sh.tessera.core.types.Address;
import sh.tessera.primitives.Hex;

/**
 * A runtime value paired with a {@link TypeTag} for encoding, or produced by decoding.
 *
 * <p>
 * Each variant matches one or more type kinds: {@link IntValue} serves both {@code uintN}
 * and {@code intN}. The encoder never coerces between variants.
 *
 * @since 0.1.0
 */
public sealed interface AbiValue
        permits AbiValue.AddressValue, AbiValue.IntValue, AbiValue.BoolValue,
        AbiValue.StringValue, AbiValue.BytesValue, AbiValue.ArrayValue {

    static AddressValue address(final String address) {
        return AddressValue.of(address);
    }

    static AddressValue address(final Address address) {
        return AddressValue.of(address);
    }

    static IntValue uint(final long value) {
        return new IntValue(BigInteger.valueOf(value));
    }

    static IntValue uint(final BigInteger value) {
        return new IntValue(value);
    }

    static IntValue integer(final long value) {
        return new IntValue(BigInteger.valueOf(value));
    }

    static IntValue integer(final BigInteger value) {
        return new IntValue(value);
    }

    static BoolValue bool(final boolean value) {
        return new BoolValue(value);
    }

    static StringValue string(final String value) {
        return new StringValue(value);
    }

    static BytesValue bytes(final byte[] value) {
        return new BytesValue(value);
    }

    static ArrayValue array(final List<? extends AbiValue> elements) {
        return new ArrayValue(List.copyOf(elements));
    }

    /**
     * Raw address bytes. The length is checked at encode time, not here, so that the encoder
     * can report a short or long address as {@code INVALID_ADDRESS}.
     *
     * @param raw the address bytes, normally 20
     */
    record AddressValue(byte[] raw) implements AbiValue {
        public AddressValue {
            Objects.requireNonNull(raw, "raw");
            raw = raw.clone();
        }

        /**
         * Parses a {@code 0x}-prefixed 40-hex-character address.
         *
         * @param address the address string
         * @return the value
         * @throws AbiEncodingException with kind {@code INVALID_ADDRESS} if malformed
         */
        public static AddressValue of(final String address) {
            if (!Address.isValid(address)) {
                throw AbiEncodingException.invalidAddress("invalid address: " + address);
            }
            return new AddressValue(Hex.decode(address));
        }

        public static AddressValue of(final Address address) {
            return new AddressValue(address.toBytes());
        }

        @Override
        public byte[] raw() {
            return raw.clone();
        }

        /**
         * Converts to the checked {@link Address} type.
         *
         * @return the address
         * @throws IllegalArgumentException if the raw form is not 20 bytes
         */
        public Address toAddress() {
            return Address.fromBytes(raw);
        }

        @Override
        public boolean equals(final Object o) {
            return o instanceof AddressValue other && Arrays.equals(raw, other.raw);
        }

        @Override
        public int hashCode() {
            return Arrays.hashCode(raw);
        }

        @Override
        public String toString() {
            return "AddressValue[" + Hex.encode(raw) + "]";
        }
    }

    /** Signed or unsigned integer of up to 256 bits. */
    record IntValue(BigInteger value) implements AbiValue {
        public IntValue {
            Objects.requireNonNull(value, "value");
        }
    }

    record BoolValue(boolean value) implements AbiValue {
    }

    /** Text, UTF-8 encoded on the wire. */
    record StringValue(String value) implements AbiValue {
        public StringValue {
            Objects.requireNonNull(value, "value");
        }
    }

    record BytesValue(byte[] value) implements AbiValue {
        public BytesValue {
            Objects.requireNonNull(value, "value");
            value = value.clone();
        }

        @Override
        public byte[] value() {
            return value.clone();
        }

        @Override
        public boolean equals(final Object o) {
            return o instanceof BytesValue other && Arrays.equals(value, other.value);
        }

        @Override
        public int hashCode() {
            return Arrays.hashCode(value);
        }

        @Override
        public String toString() {
            return "BytesValue[" + Hex.encode(value) + "]";
        }
    }

    record ArrayValue(List<AbiValue> elements) implements AbiValue {
        public ArrayValue {
            elements = List.copyOf(elements);
        }
    }
}
