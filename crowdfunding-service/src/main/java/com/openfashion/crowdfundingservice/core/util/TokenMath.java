package com.openfashion.crowdfundingservice.core.util;

import com.openfashion.crowdfundingservice.core.exceptions.ConservationViolationException;
import com.openfashion.crowdfundingservice.core.exceptions.InvalidInputException;

import java.math.BigInteger;

/**
 * Unsigned 256-bit token arithmetic. Every operation fails instead of wrapping or clamping.
 */
public class TokenMath {

    private TokenMath(){}

    public static final int BASIS_POINTS = 10_000;
    public static final BigInteger MAX_UINT256 = BigInteger.ONE.shiftLeft(256).subtract(BigInteger.ONE);

    private static final BigInteger BPS_DENOMINATOR = BigInteger.valueOf(BASIS_POINTS);

    public static BigInteger add(BigInteger a, BigInteger b) {
        BigInteger result = checked(a).add(checked(b));
        if (result.compareTo(MAX_UINT256) > 0) {
            throw new ConservationViolationException("Overflow: " + a + " + " + b);
        }
        return result;
    }

    public static BigInteger sub(BigInteger a, BigInteger b) {
        BigInteger result = checked(a).subtract(checked(b));
        if (result.signum() < 0) {
            throw new ConservationViolationException("Underflow: " + a + " - " + b);
        }
        return result;
    }

    public static BigInteger mul(BigInteger a, BigInteger b) {
        BigInteger result = checked(a).multiply(checked(b));
        if (result.compareTo(MAX_UINT256) > 0) {
            throw new ConservationViolationException("Overflow: " + a + " * " + b);
        }
        return result;
    }

    /**
     * floor(amount * rate / 10000).
     */
    public static BigInteger feeOf(BigInteger amount, int rateBasisPoints) {
        requireBasisPoints(rateBasisPoints);
        return mul(amount, BigInteger.valueOf(rateBasisPoints)).divide(BPS_DENOMINATOR);
    }

    /**
     * totalDonations * 100 / goal, 0 when the goal is 0.
     */
    public static BigInteger percentOf(BigInteger part, BigInteger whole) {
        if (whole == null || whole.signum() == 0) {
            return BigInteger.ZERO;
        }
        return mul(part, BigInteger.valueOf(100)).divide(whole);
    }

    public static int requireBasisPoints(int rateBasisPoints) {
        if (rateBasisPoints < 0 || rateBasisPoints > BASIS_POINTS) {
            throw new InvalidInputException("feeRateBasisPoints", rateBasisPoints, "must be within [0, " + BASIS_POINTS + "]");
        }
        return rateBasisPoints;
    }

    public static boolean isPositive(BigInteger amount) {
        return amount != null && amount.signum() > 0;
    }

    private static BigInteger checked(BigInteger value) {
        if (value == null) return BigInteger.ZERO;
        if (value.signum() < 0 || value.compareTo(MAX_UINT256) > 0) {
            throw new ConservationViolationException("Value outside uint256 range: " + value);
        }
        return value;
    }

}
