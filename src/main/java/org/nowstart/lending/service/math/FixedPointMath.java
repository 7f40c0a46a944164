package org.nowstart.lending.service.math;

import java.math.BigInteger;
import org.nowstart.lending.data.exception.LendingException;
import org.nowstart.lending.data.type.LendingErrorCode;

/**
 * Integer fixed-point helpers. Every division floors.
 */
public final class FixedPointMath {

    public static final int PRICE_DECIMALS = 18;
    public static final BigInteger PRECISION = BigInteger.TEN.pow(PRICE_DECIMALS);
    public static final BigInteger BIPS = BigInteger.valueOf(10_000);
    public static final BigInteger PERCENT = BigInteger.valueOf(100);
    // health reported for a position without debt
    public static final BigInteger MAX_VALUE = BigInteger.ONE.shiftLeft(256).subtract(BigInteger.ONE);

    private FixedPointMath() {
    }

    public static BigInteger mulDiv(BigInteger a, BigInteger b, BigInteger denominator) {
        if (denominator.signum() <= 0) {
            throw new ArithmeticException("denominator must be positive");
        }
        return a.multiply(b).divide(denominator);
    }

    public static BigInteger pow10(int exponent) {
        if (exponent < 0) {
            throw new IllegalArgumentException("exponent must not be negative: " + exponent);
        }
        return BigInteger.TEN.pow(exponent);
    }

    /**
     * Rescales an oracle price reported with {@code decimals} fractional digits to
     * {@link #PRICE_DECIMALS}.
     */
    public static BigInteger normalizePrice(BigInteger price, int decimals) {
        if (decimals == PRICE_DECIMALS) {
            return price;
        }
        if (decimals < PRICE_DECIMALS) {
            return price.multiply(pow10(PRICE_DECIMALS - decimals));
        }
        return price.divide(pow10(decimals - PRICE_DECIMALS));
    }

    /**
     * Value of {@code amount} base units of a token with {@code tokenDecimals}, in 18-decimal
     * quote units.
     */
    public static BigInteger valueOf(BigInteger amount, BigInteger price18, int tokenDecimals) {
        return mulDiv(amount, price18, pow10(tokenDecimals));
    }

    public static BigInteger requirePositive(BigInteger amount, LendingErrorCode errorCode, String name) {
        if (amount == null || amount.signum() <= 0) {
            throw new LendingException(errorCode, name + " must be greater than zero");
        }
        return amount;
    }

    public static BigInteger orZero(BigInteger value) {
        return value == null ? BigInteger.ZERO : value;
    }

    public static BigInteger max(BigInteger left, BigInteger right) {
        return left.compareTo(right) >= 0 ? left : right;
    }
}
