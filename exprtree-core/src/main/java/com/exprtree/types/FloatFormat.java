package com.exprtree.types;

/**
 * Bit layout of a binary IEEE 754 interchange format.
 * The significand width excludes the implicit leading bit.
 */
public enum FloatFormat {
    IEEE_HALF(5, 10),
    IEEE_SINGLE(8, 23),
    IEEE_DOUBLE(11, 52),
    IEEE_QUAD(15, 112);

    private final int exponentBits;
    private final int mantissaBits;

    FloatFormat(int exponentBits, int mantissaBits) {
        this.exponentBits = exponentBits;
        this.mantissaBits = mantissaBits;
    }

    public int exponentBits() {
        return exponentBits;
    }

    public int mantissaBits() {
        return mantissaBits;
    }

    /** Total storage width: sign + exponent + mantissa. */
    public int bitWidth() {
        return 1 + exponentBits + mantissaBits;
    }

    public int bias() {
        return (1 << (exponentBits - 1)) - 1;
    }

    /** Largest unbiased exponent of a finite value. */
    public int maxExponent() {
        return bias();
    }

    /** Smallest unbiased exponent of a normal value. */
    public int minExponent() {
        return 1 - bias();
    }
}
