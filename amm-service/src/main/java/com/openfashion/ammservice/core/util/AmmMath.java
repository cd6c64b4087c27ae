package com.openfashion.ammservice.core.util;

import com.openfashion.ammservice.core.exceptions.InvalidAmountException;

import java.math.BigInteger;

/**
 * Constant-product pool arithmetic on whole units. Every product is taken in {@link BigInteger}
 * and narrowed exactly; a result outside the {@code long} range rejects the operation.
 */
public class AmmMath {

    private AmmMath(){}

    public static final long FEE_DENOMINATOR = 10_000L;
    public static final long PRECISION = 1_000_000L;
    public static final long BASIS_POINTS = 10_000L;

    private static final BigInteger TWO = BigInteger.valueOf(2);

    /**
     * Babylonian integer square root, starting from {@code x / 2} and stopping as soon as the
     * next guess is not smaller than the current one. Yields {@code floor(sqrt(x))}.
     */
    public static long isqrt(BigInteger x) {
        if (x.signum() < 0) {
            throw new InvalidAmountException("Square root of negative value " + x);
        }
        if (x.compareTo(BigInteger.ONE) <= 0) {
            return x.longValueExact();
        }
        BigInteger guess = x.divide(TWO);
        while (true) {
            BigInteger next = guess.add(x.divide(guess)).divide(TWO);
            if (next.compareTo(guess) >= 0) {
                return narrow(guess);
            }
            guess = next;
        }
    }

    public static long isqrt(long x) {
        return isqrt(BigInteger.valueOf(x));
    }

    /**
     * Shares minted to the creator of a pool: {@code isqrt(amountA * amountB)}.
     */
    public static long initialLiquidity(long amountA, long amountB) {
        return isqrt(BigInteger.valueOf(amountA).multiply(BigInteger.valueOf(amountB)));
    }

    /**
     * {@code net * reserveOut / (reserveIn * 10000 + net)} where {@code net = amountIn * (10000 - feeRate)}.
     */
    public static long amountOut(long amountIn, long reserveIn, long reserveOut, long feeRate) {
        BigInteger net = BigInteger.valueOf(amountIn).multiply(BigInteger.valueOf(FEE_DENOMINATOR - feeRate));
        BigInteger denominator = BigInteger.valueOf(reserveIn)
                .multiply(BigInteger.valueOf(FEE_DENOMINATOR))
                .add(net);
        if (denominator.signum() == 0) {
            throw new InvalidAmountException("Division by zero");
        }
        return narrow(net.multiply(BigInteger.valueOf(reserveOut)).divide(denominator));
    }

    public static long fee(long amountIn, long feeRate) {
        return mulDiv(amountIn, feeRate, FEE_DENOMINATOR);
    }

    /**
     * Output as basis points of the output reserve it was taken from.
     */
    public static long priceImpact(long amountOut, long reserveOut) {
        return mulDiv(amountOut, BASIS_POINTS, reserveOut);
    }

    /**
     * {@code numerator / denominator} in 6-decimal fixed point.
     */
    public static long price(long numerator, long denominator) {
        return mulDiv(numerator, PRECISION, denominator);
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
