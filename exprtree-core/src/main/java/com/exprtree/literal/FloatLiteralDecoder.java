package com.exprtree.literal;

import com.exprtree.types.FloatFormat;

import java.math.BigInteger;

/**
 * Decodes floating-point literal text into a binary format, rounding to
 * nearest with ties to even.
 *
 * <p>Accepts decimal text ({@code 1.5}, {@code 2e-3}) and hexadecimal text
 * with a binary exponent ({@code 0x1.8p3}). Values too large for the format
 * become infinity; values too small lose precision gradually through the
 * subnormal range and finally become zero.</p>
 */
public final class FloatLiteralDecoder {

    private FloatLiteralDecoder() {
        // Utility class
    }

    private static final double LOG2_10 = Math.log(10) / Math.log(2);

    /**
     * @throws AssertionError if the text is not a well-formed literal; the
     *     semantic checker rejects such literals before decoding
     */
    public static FixedWidthFloat decode(String text, FloatFormat format) {
        boolean negative = false;
        String body = text;
        if (!body.isEmpty() && (body.charAt(0) == '-' || body.charAt(0) == '+')) {
            negative = body.charAt(0) == '-';
            body = body.substring(1);
        }

        BigInteger magnitude = isHex(body)
            ? decodeHex(text, body.substring(2), format)
            : decodeDecimal(text, body, format);
        if (negative) {
            magnitude = magnitude.setBit(format.bitWidth() - 1);
        }
        return new FixedWidthFloat(format, magnitude);
    }

    /**
     * Rounds the non-negative rational {@code num / den} into the unsigned
     * bit pattern of {@code format}.
     */
    static BigInteger round(BigInteger num, BigInteger den, FloatFormat format) {
        if (num.signum() == 0) {
            return BigInteger.ZERO;
        }
        int precision = format.mantissaBits() + 1;

        int exponent = num.bitLength() - den.bitLength();
        if (compareToPowerOfTwo(num, den, exponent) < 0) {
            exponent--;
        }
        if (exponent < format.minExponent()) {
            exponent = format.minExponent();
        }

        int shift = precision - 1 - exponent;
        BigInteger scaledNum = shift >= 0 ? num.shiftLeft(shift) : num;
        BigInteger scaledDen = shift >= 0 ? den : den.shiftLeft(-shift);
        BigInteger[] qr = scaledNum.divideAndRemainder(scaledDen);
        BigInteger significand = qr[0];
        int half = qr[1].shiftLeft(1).compareTo(scaledDen);
        if (half > 0 || (half == 0 && significand.testBit(0))) {
            significand = significand.add(BigInteger.ONE);
        }
        if (significand.bitLength() > precision) {
            significand = significand.shiftRight(1);
            exponent++;
        }

        if (exponent > format.maxExponent()) {
            return infinity(format);
        }
        if (significand.bitLength() < precision) {
            // Subnormal: biased exponent zero, no implicit bit.
            return significand;
        }
        BigInteger biased = BigInteger.valueOf((long) exponent + format.bias());
        return biased.shiftLeft(format.mantissaBits()).or(significand.clearBit(precision - 1));
    }

    private static BigInteger infinity(FloatFormat format) {
        BigInteger maxBiased = BigInteger.ONE.shiftLeft(format.exponentBits()).subtract(BigInteger.ONE);
        return maxBiased.shiftLeft(format.mantissaBits());
    }

    /**
     * The result for a value whose binary exponent is about {@code estimate}
     * (within two) when that is far enough outside the format to overflow or
     * underflow regardless of rounding, else null.
     */
    private static BigInteger saturate(double estimate, FloatFormat format) {
        if (estimate > format.maxExponent() + 2) {
            return infinity(format);
        }
        if (estimate < format.minExponent() - format.mantissaBits() - 3) {
            return BigInteger.ZERO;
        }
        return null;
    }

    private static int compareToPowerOfTwo(BigInteger num, BigInteger den, int exponent) {
        if (exponent >= 0) {
            return num.compareTo(den.shiftLeft(exponent));
        }
        return num.shiftLeft(-exponent).compareTo(den);
    }

    private static boolean isHex(String body) {
        return body.length() > 1 && body.charAt(0) == '0' && (body.charAt(1) == 'x' || body.charAt(1) == 'X');
    }

    private static BigInteger decodeDecimal(String text, String body, FloatFormat format) {
        int e = body.indexOf('e');
        if (e < 0) {
            e = body.indexOf('E');
        }
        String mantissa = e < 0 ? body : body.substring(0, e);
        BigInteger exponent = e < 0 ? BigInteger.ZERO : parseExponent(text, body.substring(e + 1));

        int dot = mantissa.indexOf('.');
        String intPart = dot < 0 ? mantissa : mantissa.substring(0, dot);
        String fracPart = dot < 0 ? "" : mantissa.substring(dot + 1);
        String allDigits = intPart + fracPart;
        if (allDigits.isEmpty() || !isDigits(allDigits, 10)) {
            throw invalid(text);
        }

        BigInteger unscaled = new BigInteger(allDigits);
        if (unscaled.signum() == 0) {
            return BigInteger.ZERO;
        }
        BigInteger scale = exponent.subtract(BigInteger.valueOf(fracPart.length()));
        BigInteger early = saturate(unscaled.bitLength() - 1 + scale.doubleValue() * LOG2_10, format);
        if (early != null) {
            return early;
        }
        int tens = scale.intValueExact();
        if (tens >= 0) {
            return round(unscaled.multiply(BigInteger.TEN.pow(tens)), BigInteger.ONE, format);
        }
        return round(unscaled, BigInteger.TEN.pow(-tens), format);
    }

    private static BigInteger decodeHex(String text, String digits, FloatFormat format) {
        int p = indexOfExponent(digits);
        if (p < 0) {
            throw invalid(text);
        }
        String mantissa = digits.substring(0, p);
        BigInteger exponent = parseExponent(text, digits.substring(p + 1));

        int dot = mantissa.indexOf('.');
        String intPart = dot < 0 ? mantissa : mantissa.substring(0, dot);
        String fracPart = dot < 0 ? "" : mantissa.substring(dot + 1);
        String allDigits = intPart + fracPart;
        if (allDigits.isEmpty() || !isDigits(allDigits, 16)) {
            throw invalid(text);
        }

        BigInteger value = new BigInteger(allDigits, 16);
        if (value.signum() == 0) {
            return BigInteger.ZERO;
        }
        BigInteger twos = exponent.subtract(BigInteger.valueOf(4L * fracPart.length()));
        BigInteger early = saturate(value.bitLength() - 1 + twos.doubleValue(), format);
        if (early != null) {
            return early;
        }
        int shift = twos.intValueExact();
        if (shift >= 0) {
            return round(value.shiftLeft(shift), BigInteger.ONE, format);
        }
        return round(value, BigInteger.ONE.shiftLeft(-shift), format);
    }

    /** A signed decimal exponent of any length. */
    private static BigInteger parseExponent(String text, String exponentText) {
        String digits = exponentText;
        if (!digits.isEmpty() && (digits.charAt(0) == '-' || digits.charAt(0) == '+')) {
            digits = digits.substring(1);
        }
        if (digits.isEmpty() || !isDigits(digits, 10)) {
            throw invalid(text);
        }
        return new BigInteger(exponentText);
    }

    private static int indexOfExponent(String digits) {
        int p = digits.indexOf('p');
        return p >= 0 ? p : digits.indexOf('P');
    }

    private static boolean isDigits(String s, int radix) {
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c > 0x7f || Character.digit(c, radix) < 0) {
                return false;
            }
        }
        return true;
    }

    private static AssertionError invalid(String text) {
        return new AssertionError("Invalid float literal was not rejected by semantic analysis: '" + text + "'");
    }
}
