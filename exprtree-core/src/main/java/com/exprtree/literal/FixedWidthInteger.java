package com.exprtree.literal;

import java.math.BigInteger;

/**
 * An integer of exactly {@code bitWidth} bits, stored as its unsigned bit pattern.
 */
public record FixedWidthInteger(int bitWidth, BigInteger bits) {

    public FixedWidthInteger {
        if (bitWidth <= 0) {
            throw new IllegalArgumentException("Bit width must be positive: " + bitWidth);
        }
        if (bits.signum() < 0 || bits.bitLength() > bitWidth) {
            throw new IllegalArgumentException(bits + " does not fit in " + bitWidth + " bits");
        }
    }

    /**
     * Zero-extends or truncates {@code value} to {@code bitWidth} bits.
     */
    public static FixedWidthInteger zextOrTrunc(BigInteger value, int bitWidth) {
        BigInteger mask = BigInteger.ONE.shiftLeft(bitWidth).subtract(BigInteger.ONE);
        return new FixedWidthInteger(bitWidth, value.and(mask));
    }

    public FixedWidthInteger zextOrTrunc(int newWidth) {
        return zextOrTrunc(bits, newWidth);
    }

    public BigInteger unsignedValue() {
        return bits;
    }

    /** The two's complement reading of the bit pattern. */
    public BigInteger signedValue() {
        if (bits.testBit(bitWidth - 1)) {
            return bits.subtract(BigInteger.ONE.shiftLeft(bitWidth));
        }
        return bits;
    }

    public long longValue() {
        return signedValue().longValue();
    }

    @Override
    public String toString() {
        return signedValue().toString();
    }
}
