// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.units;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import sh.tessera.core.error.UnitFormatException;

/**
 * Conversion between base-unit integers and human-readable decimal amounts.
 *
 * <p>
 * All arithmetic is exact ({@link BigDecimal}); nothing goes through floating point.
 *
 * <pre>{@code
 * BigInteger wei = Units.parseEther("1.5");           // 1500000000000000000
 * String usdc = Units.formatUnits(wei, 6);            // "1500000000000"
 * String eth = Units.formatEther(wei, 4);             // "1.5000"
 * }</pre>
 *
 * @since 0.1.0
 */
public final class Units {

    /** Decimals of ether. */
    public static final int ETHER_DECIMALS = 18;

    /** Decimals of gwei relative to wei. */
    public static final int GWEI_DECIMALS = 9;

    private static final Pattern AMOUNT = Pattern.compile("^(-)?(\\d*)(?:\\.(\\d*))?$");

    private Units() {
    }

    /**
     * Parses a decimal string into base units. Fractional digits beyond {@code decimals}
     * are dropped, not rounded.
     *
     * @param amount e.g. {@code "100.5"}
     * @param decimals the token's decimals
     * @return the amount in base units
     * @throws UnitFormatException if {@code amount} is not a plain decimal number
     */
    public static BigInteger parseUnits(final String amount, final int decimals) {
        Objects.requireNonNull(amount, "amount");
        checkDecimals(decimals);
        final Matcher m = AMOUNT.matcher(amount.trim());
        if (!m.matches()) {
            throw new UnitFormatException("invalid amount format: '" + amount + "'");
        }
        final String integer = m.group(2);
        final String fraction = m.group(3) == null ? "" : m.group(3);
        if (integer.isEmpty() && fraction.isEmpty()) {
            throw new UnitFormatException("invalid amount format: '" + amount + "'");
        }
        final String unsigned = (integer.isEmpty() ? "0" : integer) + "." + (fraction.isEmpty() ? "0" : fraction);
        BigDecimal value = new BigDecimal(unsigned).movePointRight(decimals).setScale(0, RoundingMode.DOWN);
        if (m.group(1) != null) {
            value = value.negate();
        }
        return value.toBigIntegerExact();
    }

    /**
     * Formats base units as the shortest exact decimal string.
     *
     * @param amount the amount in base units
     * @param decimals the token's decimals
     * @return e.g. {@code "100.5"}, or {@code "100"} when there is no fraction
     */
    public static String formatUnits(final BigInteger amount, final int decimals) {
        Objects.requireNonNull(amount, "amount");
        checkDecimals(decimals);
        if (amount.signum() == 0) {
            return "0";
        }
        return new BigDecimal(amount, decimals).stripTrailingZeros().toPlainString();
    }

    public static BigInteger parseEther(final String ether) {
        return parseUnits(ether, ETHER_DECIMALS);
    }

    /**
     * Formats wei as ether with a fixed number of places, rounding half up.
     *
     * @param wei the amount in wei
     * @param places digits after the decimal point
     * @return e.g. {@code "1.5000"}
     */
    public static String formatEther(final BigInteger wei, final int places) {
        return weiToEther(wei).setScale(places, RoundingMode.HALF_UP).toPlainString();
    }

    /**
     * Formats wei as gwei with a fixed number of places, rounding half up.
     *
     * @param wei the amount in wei
     * @param places digits after the decimal point
     * @return e.g. {@code "20.00"}
     */
    public static String formatGwei(final BigInteger wei, final int places) {
        return weiToGwei(wei).setScale(places, RoundingMode.HALF_UP).toPlainString();
    }

    public static BigDecimal weiToEther(final BigInteger wei) {
        Objects.requireNonNull(wei, "wei");
        return new BigDecimal(wei, ETHER_DECIMALS);
    }

    public static BigDecimal weiToGwei(final BigInteger wei) {
        Objects.requireNonNull(wei, "wei");
        return new BigDecimal(wei, GWEI_DECIMALS);
    }

    /**
     * Converts ether to wei, dropping any digits below one wei.
     *
     * @param ether the amount in ether
     * @return the amount in wei
     */
    public static BigInteger etherToWei(final BigDecimal ether) {
        Objects.requireNonNull(ether, "ether");
        return ether.movePointRight(ETHER_DECIMALS).setScale(0, RoundingMode.DOWN).toBigIntegerExact();
    }

    /**
     * Converts gwei to wei, dropping any digits below one wei.
     *
     * @param gwei the amount in gwei
     * @return the amount in wei
     */
    public static BigInteger gweiToWei(final BigDecimal gwei) {
        Objects.requireNonNull(gwei, "gwei");
        return gwei.movePointRight(GWEI_DECIMALS).setScale(0, RoundingMode.DOWN).toBigIntegerExact();
    }

    private static void checkDecimals(final int decimals) {
        if (decimals < 0) {
            throw new IllegalArgumentException("decimals must be non-negative, got " + decimals);
        }
    }
}
