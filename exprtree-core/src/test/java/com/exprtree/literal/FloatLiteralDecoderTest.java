package com.exprtree.literal;

import com.exprtree.ast.AstContext;
import com.exprtree.ast.FloatLiteralExpr;
import com.exprtree.ast.SourceLoc;
import com.exprtree.types.BuiltinFloatType;
import com.exprtree.types.FloatFormat;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

public class FloatLiteralDecoderTest {

    private static long doubleBits(String text) {
        return FloatLiteralDecoder.decode(text, FloatFormat.IEEE_DOUBLE).bits().longValue();
    }

    private static int singleBits(String text) {
        return FloatLiteralDecoder.decode(text, FloatFormat.IEEE_SINGLE).bits().intValue();
    }

    private static int halfBits(String text) {
        return FloatLiteralDecoder.decode(text, FloatFormat.IEEE_HALF).bits().intValue();
    }

    @Test
    void testMatchesJavaParsing() {
        for (String text : new String[] {"0.1", "1.5", "3.141592653589793", "1e-300", "123456789.125", "2.5e10"}) {
            assertEquals(Double.doubleToLongBits(Double.parseDouble(text)), doubleBits(text), text);
            assertEquals(Float.floatToIntBits(Float.parseFloat(text)), singleBits(text), text);
        }
    }

    @Test
    void testHexFloats() {
        assertEquals(Double.doubleToLongBits(12.0), doubleBits("0x1.8p3"));
        assertEquals(Double.doubleToLongBits(0.5), doubleBits("0x1p-1"));
        assertThrows(AssertionError.class, () -> FloatLiteralDecoder.decode("0x1.8", FloatFormat.IEEE_DOUBLE));
    }

    @Test
    void testOverflowBecomesInfinity() {
        FixedWidthFloat big = FloatLiteralDecoder.decode("1e400", FloatFormat.IEEE_DOUBLE);
        assertTrue(big.isInfinite());
        assertEquals(Double.POSITIVE_INFINITY, big.doubleValue());
        assertEquals(0x7C00, halfBits("65520"));
    }

    @Test
    void testHugeExponentsSaturate() {
        assertTrue(FloatLiteralDecoder.decode("1e999999999", FloatFormat.IEEE_DOUBLE).isInfinite());
        assertTrue(FloatLiteralDecoder.decode("1e-999999999", FloatFormat.IEEE_DOUBLE).isZero());
        assertTrue(FloatLiteralDecoder.decode("0x1p99999999999", FloatFormat.IEEE_DOUBLE).isInfinite());
        assertTrue(FloatLiteralDecoder.decode("0x1p-99999999999", FloatFormat.IEEE_QUAD).isZero());
        assertTrue(FloatLiteralDecoder.decode("1e99999999999999999999", FloatFormat.IEEE_HALF).isInfinite());
        assertTrue(FloatLiteralDecoder.decode("0e99999999999999999999", FloatFormat.IEEE_DOUBLE).isZero());

        FixedWidthFloat negative = FloatLiteralDecoder.decode("-1e999999999", FloatFormat.IEEE_DOUBLE);
        assertTrue(negative.isInfinite());
        assertEquals(Double.NEGATIVE_INFINITY, negative.doubleValue());
    }

    @Test
    void testExponentBoundaries() {
        for (String text : new String[] {"1.7976931348623157e308", "1.7976931348623159e308", "4.9e-324",
                                         "2e-324", "3e-324", "2.2250738585072014e-308", "0x1.fffffffffffffp1023",
                                         "0x1p-1074", "0x1p-1075", "0x1.8p-1075", "0x1p1024"}) {
            assertEquals(Double.doubleToLongBits(Double.parseDouble(text)), doubleBits(text), text);
        }
        assertThrows(AssertionError.class, () -> FloatLiteralDecoder.decode("1e+", FloatFormat.IEEE_DOUBLE));
        assertThrows(AssertionError.class, () -> FloatLiteralDecoder.decode("0x1p1x", FloatFormat.IEEE_DOUBLE));
    }

    @Test
    void testHalfPrecision() {
        assertEquals(0x7BFF, halfBits("65504"));
        assertEquals(0x3C00, halfBits("1"));
        assertEquals(0x3555, halfBits("0.333333"));
        assertEquals(65504.0, FloatLiteralDecoder.decode("65504", FloatFormat.IEEE_HALF).doubleValue());
    }

    @Test
    void testSubnormals() {
        assertEquals(1, singleBits("1e-45"));
        assertEquals(Float.floatToIntBits(Float.MIN_NORMAL / 2), singleBits("5.877471754111438e-39"));
        FixedWidthFloat tiny = FloatLiteralDecoder.decode("1e-50", FloatFormat.IEEE_SINGLE);
        assertTrue(tiny.isZero());
    }

    @Test
    void testTiesToEven() {
        // 2^53 + 1 is halfway between two doubles; the even one is 2^53
        assertEquals(Double.doubleToLongBits(9007199254740992.0), doubleBits("9007199254740993"));
        assertEquals(Double.doubleToLongBits(9007199254740996.0), doubleBits("9007199254740995"));
    }

    @Test
    void testQuadPrecisionOne() {
        FixedWidthFloat one = FloatLiteralDecoder.decode("1", FloatFormat.IEEE_QUAD);
        assertEquals(BigInteger.valueOf(16383).shiftLeft(112), one.bits());
        assertEquals(1.0, one.doubleValue());
    }

    @Test
    void testNegativeAndMalformed() {
        assertEquals(Double.doubleToLongBits(-2.0), doubleBits("-2.0"));
        assertThrows(AssertionError.class, () -> FloatLiteralDecoder.decode("1.2.3", FloatFormat.IEEE_DOUBLE));
        assertThrows(AssertionError.class, () -> FloatLiteralDecoder.decode("abc", FloatFormat.IEEE_DOUBLE));
    }

    @Test
    void testLiteralNodeDecodesAtItsType() {
        try (AstContext ctx = new AstContext()) {
            FloatLiteralExpr literal = FloatLiteralExpr.create(ctx, "1.5", SourceLoc.at(0));
            assertThrows(AssertionError.class, literal::value);
            literal.setType(new BuiltinFloatType(FloatFormat.IEEE_SINGLE));
            assertEquals(1.5, literal.value().doubleValue());
        }
    }
}
