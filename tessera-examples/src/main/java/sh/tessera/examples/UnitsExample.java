// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.examples;

import java.math.BigInteger;

import sh.tessera.core.error.UnitFormatException;
import sh.tessera.core.types.Wei;
import sh.tessera.core.units.Units;

/** Converts between wei, gwei, ether and arbitrary token decimals. */
public final class UnitsExample {

    private UnitsExample() {}

    public static void main(final String[] args) {
        final BigInteger oneAndAHalf = Units.parseEther("1.5");
        System.out.println("1.5 ether = " + oneAndAHalf + " wei");
        System.out.println("Back to ether: " + Units.formatEther(oneAndAHalf, 4));

        final Wei gasPrice = Wei.gwei(30);
        System.out.println("30 gwei = " + gasPrice.value() + " wei (" + gasPrice.toHexString() + ")");
        System.out.println("In gwei: " + Units.formatGwei(gasPrice.value(), 2));

        // USDC uses 6 decimals
        final BigInteger usdc = Units.parseUnits("12.345678", 6);
        System.out.println("12.345678 USDC = " + usdc + " base units, formatted " + Units.formatUnits(usdc, 6));

        try {
            Units.parseUnits("1.2.3", 18);
        } catch (UnitFormatException e) {
            System.out.println("Rejected malformed amount: " + e.getMessage());
        }
    }
}
