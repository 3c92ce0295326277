// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.types;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * A non-negative amount of wei (10^-18 ether).
 * <p>
 * <strong>Common Conversions:</strong>
 * <ul>
 * <li>1 Ether = 10^18 Wei</li>
 * <li>1 Gwei = 10^9 Wei</li>
 * </ul>
 * For arbitrary token decimals see {@link sh.tessera.core.units.Units}.
 *
 * @since 0.1.0
 */
public record Wei(BigInteger value) {
    private static final BigDecimal WEI_PER_ETHER = BigDecimal.TEN.pow(18);
    private static final BigDecimal WEI_PER_GWEI = BigDecimal.TEN.pow(9);

    /** Zero wei. */
    public static final Wei ZERO = new Wei(BigInteger.ZERO);

    public Wei {
        Objects.requireNonNull(value, "value");
        if (value.signum() < 0) {
            throw new IllegalArgumentException("Wei must be non-negative");
        }
    }

    public static Wei of(final long wei) {
        return new Wei(BigInteger.valueOf(wei));
    }

    public static Wei of(final BigInteger wei) {
        return new Wei(wei);
    }

    public static Wei gwei(final long gwei) {
        return new Wei(BigInteger.valueOf(gwei).multiply(WEI_PER_GWEI.toBigIntegerExact()));
    }

    /**
     * Converts an exact ether amount to wei.
     *
     * @param ether the amount in ether
     * @return the amount in wei
     * @throws ArithmeticException if {@code ether} has more than 18 fractional digits
     */
    public static Wei fromEther(final BigDecimal ether) {
        Objects.requireNonNull(ether, "ether");
        return new Wei(ether.multiply(WEI_PER_ETHER).toBigIntegerExact());
    }

    /**
     * Converts an exact gwei amount to wei.
     *
     * @param gwei the amount in gwei
     * @return the amount in wei
     * @throws ArithmeticException if {@code gwei} has more than 9 fractional digits
     */
    public static Wei fromGwei(final BigDecimal gwei) {
        Objects.requireNonNull(gwei, "gwei");
        return new Wei(gwei.multiply(WEI_PER_GWEI).toBigIntegerExact());
    }

    public BigDecimal toEther() {
        return new BigDecimal(value).divide(WEI_PER_ETHER, 18, RoundingMode.DOWN);
    }

    public BigDecimal toGwei() {
        return new BigDecimal(value).divide(WEI_PER_GWEI, 9, RoundingMode.DOWN);
    }

    public Wei plus(final Wei other) {
        return new Wei(value.add(other.value));
    }

    public Wei times(final long factor) {
        return new Wei(value.multiply(BigInteger.valueOf(factor)));
    }

    @JsonValue
    public String toHexString() {
        return "0x" + value.toString(16);
    }
}
