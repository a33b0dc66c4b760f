package com.exprtree.literal;

import com.exprtree.ast.AstContext;
import com.exprtree.ast.IntegerLiteralExpr;
import com.exprtree.ast.SourceLoc;
import com.exprtree.types.BuiltinIntegerType;
import com.exprtree.types.UnresolvedType;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

public class IntegerLiteralDecoderTest {

    @Test
    void testLeadingZeroIsDecimal() {
        assertEquals(BigInteger.valueOf(17), IntegerLiteralDecoder.decode("017", 8).unsignedValue());
        assertEquals(BigInteger.valueOf(9), IntegerLiteralDecoder.decode("09", 8).unsignedValue());
        assertEquals(BigInteger.ZERO, IntegerLiteralDecoder.decode("0", 8).unsignedValue());
    }

    @Test
    void testPrefixes() {
        assertEquals(BigInteger.valueOf(31), IntegerLiteralDecoder.decode("0x1F", 8).unsignedValue());
        assertEquals(BigInteger.valueOf(8), IntegerLiteralDecoder.decode("0o10", 8).unsignedValue());
        assertEquals(BigInteger.valueOf(5), IntegerLiteralDecoder.decode("0b101", 8).unsignedValue());
    }

    @Test
    void testWidthAdjustment() {
        FixedWidthInteger truncated = IntegerLiteralDecoder.decode("300", 8);
        assertEquals(8, truncated.bitWidth());
        assertEquals(BigInteger.valueOf(44), truncated.unsignedValue());

        assertEquals(BigInteger.valueOf(300), IntegerLiteralDecoder.decode("300", 16).unsignedValue());

        FixedWidthInteger allOnes = IntegerLiteralDecoder.decode("255", 8);
        assertEquals(BigInteger.valueOf(255), allOnes.unsignedValue());
        assertEquals(BigInteger.valueOf(-1), allOnes.signedValue());
        assertEquals("-1", allOnes.toString());
    }

    @Test
    void testMalformedTextIsAnInvariantViolation() {
        assertThrows(AssertionError.class, () -> IntegerLiteralDecoder.decode("0x", 32));
        assertThrows(AssertionError.class, () -> IntegerLiteralDecoder.decode("12a", 32));
        assertThrows(AssertionError.class, () -> IntegerLiteralDecoder.decode("", 32));
    }

    @Test
    void testValueRequiresResolvedType() {
        try (AstContext ctx = new AstContext()) {
            IntegerLiteralExpr untyped = IntegerLiteralExpr.create(ctx, "42", SourceLoc.at(0));
            AssertionError error = assertThrows(AssertionError.class, untyped::value);
            assertEquals("Semantic analysis has not completed", error.getMessage());

            IntegerLiteralExpr unresolved = IntegerLiteralExpr.create(ctx, "42", SourceLoc.at(3));
            unresolved.setType(UnresolvedType.INSTANCE);
            assertThrows(AssertionError.class, unresolved::value);

            IntegerLiteralExpr typed = IntegerLiteralExpr.create(ctx, "0x2A", SourceLoc.at(6));
            typed.setType(new BuiltinIntegerType(32));
            assertEquals(42L, typed.value().longValue());
        }
    }
}
