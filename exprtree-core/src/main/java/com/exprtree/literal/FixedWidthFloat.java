package com.exprtree.literal;

import com.exprtree.types.FloatFormat;

import java.math.BigInteger;

/**
 * A binary floating-point value stored as the raw bit pattern of its format.
 */
public record FixedWidthFloat(FloatFormat format, BigInteger bits) {

    public FixedWidthFloat {
        if (bits.signum() < 0 || bits.bitLength() > format.bitWidth()) {
            throw new IllegalArgumentException(bits.toString(16) + " is not a " + format + " bit pattern");
        }
    }

    public boolean isNegative() {
        return bits.testBit(format.bitWidth() - 1);
    }

    public int biasedExponent() {
        return bits.shiftRight(format.mantissaBits())
            .and(BigInteger.ONE.shiftLeft(format.exponentBits()).subtract(BigInteger.ONE))
            .intValueExact();
    }

    public BigInteger mantissa() {
        return bits.and(BigInteger.ONE.shiftLeft(format.mantissaBits()).subtract(BigInteger.ONE));
    }

    public boolean isInfinite() {
        return biasedExponent() == maxBiasedExponent() && mantissa().signum() == 0;
    }

    public boolean isNaN() {
        return biasedExponent() == maxBiasedExponent() && mantissa().signum() != 0;
    }

    public boolean isZero() {
        return biasedExponent() == 0 && mantissa().signum() == 0;
    }

    /**
     * The nearest double. Exact for half, single and double formats.
     */
    public double doubleValue() {
        switch (format) {
            case IEEE_DOUBLE:
                return Double.longBitsToDouble(bits.longValue());
            case IEEE_SINGLE:
                return Float.intBitsToFloat(bits.intValue());
            default:
                break;
        }
        double sign = isNegative() ? -1.0 : 1.0;
        if (isNaN()) {
            return Double.NaN;
        }
        if (isInfinite()) {
            return sign * Double.POSITIVE_INFINITY;
        }
        int exponent = biasedExponent();
        BigInteger significand = mantissa();
        int scale;
        if (exponent == 0) {
            scale = format.minExponent() - format.mantissaBits();
        } else {
            significand = significand.setBit(format.mantissaBits());
            scale = exponent - format.bias() - format.mantissaBits();
        }
        return sign * Math.scalb(significand.doubleValue(), scale);
    }

    private int maxBiasedExponent() {
        return (1 << format.exponentBits()) - 1;
    }

    @Override
    public String toString() {
        return Double.toString(doubleValue());
    }
}
