package com.openfashion.lendingservice.core.util;

import com.openfashion.lendingservice.core.exceptions.InvalidAmountException;

import java.math.BigInteger;

/**
 * Integer-only arithmetic for the lending ledger.
 * Products are widened to {@link BigInteger} and narrowed back exactly, so an overflow
 * rejects the operation instead of wrapping.
 */
public class LedgerMath {

    private LedgerMath(){}

    public static final long BASIS_POINTS = 10_000L;
    public static final long PERCENT = 100L;

    /**
     * {@code principal * ratePerBlock * blocks / 10000}, truncated.
     */
    public static long interest(long principal, long ratePerBlock, long blocks) {
        if (blocks <= 0) return 0L;
        BigInteger product = BigInteger.valueOf(principal)
                .multiply(BigInteger.valueOf(ratePerBlock))
                .multiply(BigInteger.valueOf(blocks));
        return narrow(product.divide(BigInteger.valueOf(BASIS_POINTS)));
    }

    /**
     * {@code collateral * 100 / owed}. Owed must be positive.
     */
    public static long collateralRatio(long collateral, long owed) {
        return mulDiv(collateral, PERCENT, owed);
    }

    public static long mulDiv(long a, long b, long divisor) {
        if (divisor == 0) {
            throw new InvalidAmountException("Division by zero");
        }
        BigInteger result = BigInteger.valueOf(a)
                .multiply(BigInteger.valueOf(b))
                .divide(BigInteger.valueOf(divisor));
        return narrow(result);
    }

    public static long add(long a, long b) {
        try {
            return Math.addExact(a, b);
        } catch (ArithmeticException e) {
            throw new InvalidAmountException("Amount overflow: " + a + " + " + b);
        }
    }

    private static long narrow(BigInteger value) {
        try {
            return value.longValueExact();
        } catch (ArithmeticException e) {
            throw new InvalidAmountException("Amount overflow: " + value);
        }
    }
}
