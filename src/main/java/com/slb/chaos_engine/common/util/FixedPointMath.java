package com.slb.chaos_engine.common.util;

import java.math.BigInteger;

/**
 * Integer fixed-point helpers. Every division truncates toward zero.
 */
public final class FixedPointMath {

    /** 1e18: token decimals and the accumulator scale. */
    public static final BigInteger WAD = BigInteger.TEN.pow(18);
    public static final int BPS_DENOMINATOR = 10_000;
    public static final BigInteger BPS = BigInteger.valueOf(BPS_DENOMINATOR);

    private FixedPointMath() {
    }

    public static BigInteger toWei(long tokens) {
        return BigInteger.valueOf(tokens).multiply(WAD);
    }

    public static BigInteger mulDiv(BigInteger a, BigInteger b, BigInteger denominator) {
        if (denominator.signum() == 0) {
            throw new ArithmeticException("division by zero");
        }
        return a.multiply(b).divide(denominator);
    }

    public static BigInteger applyBps(BigInteger amount, long bps) {
        return mulDiv(amount, BigInteger.valueOf(bps), BPS);
    }

    public static long applyBps(long value, long bps) {
        return BigInteger.valueOf(value).multiply(BigInteger.valueOf(bps)).divide(BPS).longValueExact();
    }

    public static BigInteger min(BigInteger a, BigInteger b) {
        return a.compareTo(b) <= 0 ? a : b;
    }

    public static BigInteger max(BigInteger a, BigInteger b) {
        return a.compareTo(b) >= 0 ? a : b;
    }

    public static BigInteger floorAtZero(BigInteger value) {
        return value.signum() < 0 ? BigInteger.ZERO : value;
    }

    public static long clamp(long value, long min, long max) {
        return Math.max(min, Math.min(max, value));
    }

    /**
     * Linear interpolation of {@code value} between two anchors, clamped to the outer outputs.
     */
    public static long interpolate(long value, long fromX, long toX, long fromY, long toY) {
        if (value <= fromX) {
            return fromY;
        }
        if (value >= toX) {
            return toY;
        }
        long span = toX - fromX;
        return fromY + Math.floorDiv((toY - fromY) * (value - fromX), span);
    }
}
