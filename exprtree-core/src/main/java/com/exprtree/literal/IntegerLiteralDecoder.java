package com.exprtree.literal;

import java.math.BigInteger;

/**
 * Decodes integer literal text at a fixed bit width.
 *
 * <p>A leading {@code 0} followed by another digit is plain decimal: the
 * language has no C-style octal literals. Otherwise {@code 0x}, {@code 0o}
 * and {@code 0b} select hexadecimal, octal and binary, and anything else is
 * decimal. The parsed value is zero-extended or truncated to the width.</p>
 */
public final class IntegerLiteralDecoder {

    private IntegerLiteralDecoder() {
        // Utility class
    }

    /**
     * @throws AssertionError if the text is not a well-formed literal; the
     *     semantic checker rejects such literals before decoding
     */
    public static FixedWidthInteger decode(String text, int bitWidth) {
        if (bitWidth <= 0) {
            throw new IllegalArgumentException("Bit width must be positive: " + bitWidth);
        }
        boolean leadingZeroDecimal = text.length() > 1 && text.charAt(0) == '0' && isDecimalDigit(text.charAt(1));

        int radix = 10;
        String digits = text;
        if (!leadingZeroDecimal && text.length() > 1 && text.charAt(0) == '0') {
            switch (text.charAt(1)) {
                case 'x', 'X' -> radix = 16;
                case 'o', 'O' -> radix = 8;
                case 'b', 'B' -> radix = 2;
                default -> { }
            }
            if (radix != 10) {
                digits = text.substring(2);
            }
        }

        if (digits.isEmpty()) {
            throw new AssertionError("Invalid integer literal formed: '" + text + "'");
        }
        for (int i = 0; i < digits.length(); i++) {
            char c = digits.charAt(i);
            if (c > 0x7f || Character.digit(c, radix) < 0) {
                throw new AssertionError("Invalid integer literal formed: '" + text + "'");
            }
        }
        return FixedWidthInteger.zextOrTrunc(new BigInteger(digits, radix), bitWidth);
    }

    private static boolean isDecimalDigit(char c) {
        return c >= '0' && c <= '9';
    }
}
