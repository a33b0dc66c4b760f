package com.exprtree.ast;

import com.exprtree.ExprFixtures;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class SourceRangeTest {

    @Test
    void testEveryKindReportsValidRange() {
        try (AstContext ctx = new AstContext()) {
            List<Expr> nodes = new ExprFixtures(ctx, new SimpleDeclTable()).oneOfEachKind();
            for (Expr e : nodes) {
                SourceRange range = e.sourceRange();
                String name = e.kind().getKindName();
                assertTrue(range.isValid(), name + " range should be valid");
                assertTrue(range.end().isValid(), name + " end should be valid");
                assertTrue(range.start().offset() <= range.end().offset(), name + " range is backwards: " + range);
                assertTrue(e.loc().isValid(), name + " loc should be valid");
                assertTrue(e.loc().offset() >= range.start().offset()
                    && e.loc().offset() <= range.end().offset(), name + " loc outside range");
            }
        }
    }

    @Test
    void testMergeSkipsInvalidEnds() {
        SourceRange a = SourceRange.of(4, 8);
        assertEquals(SourceRange.of(4, 12), SourceRange.merge(a, SourceRange.of(10, 12)));
        assertEquals(a, SourceRange.merge(a, SourceRange.INVALID));
        assertEquals(a, SourceRange.merge(SourceRange.INVALID, a));
        assertTrue(SourceRange.INVALID.isInvalid());
    }

    @Test
    void testAnchors() {
        try (AstContext ctx = new AstContext()) {
            ExprFixtures f = new ExprFixtures(ctx, new SimpleDeclTable());
            SourceLoc question = SourceLoc.at(100);
            IfExpr ifExpr = IfExpr.create(ctx, f.ref(), question, f.lit(), SourceLoc.at(200), f.lit());
            assertEquals(question, ifExpr.loc());
            assertNotEquals(question, ifExpr.startLoc());

            Expr sub = f.ref();
            LoadExpr load = LoadExpr.create(ctx, sub, ExprFixtures.INT);
            assertEquals(sub.sourceRange(), load.sourceRange());
            assertEquals(sub.loc(), load.loc());

            Expr fn = f.ref();
            BinaryExpr binary = BinaryExpr.create(ctx, fn, TupleExpr.createImplicit(ctx, List.of(f.lit(), f.lit())));
            assertEquals(fn.loc(), binary.loc());
        }
    }

    @Test
    void testTupleRange() {
        try (AstContext ctx = new AstContext()) {
            ExprFixtures f = new ExprFixtures(ctx, new SimpleDeclTable());
            TupleExpr parens = TupleExpr.create(ctx, SourceLoc.at(1), List.of(), null, SourceLoc.at(2), false);
            assertEquals(SourceRange.of(1, 2), parens.sourceRange());

            Expr first = f.lit();
            Expr last = f.lit();
            TupleExpr withDefault = TupleExpr.createImplicit(ctx, java.util.Arrays.asList(first, null, last));
            assertEquals(new SourceRange(first.startLoc(), last.endLoc()), withDefault.sourceRange());

            assertTrue(TupleExpr.createImplicit(ctx, List.of()).sourceRange().isInvalid());
        }
    }

    @Test
    void testExplicitCastRangeWithoutKeyword() {
        try (AstContext ctx = new AstContext()) {
            ExprFixtures f = new ExprFixtures(ctx, new SimpleDeclTable());
            Expr sub = f.ref();
            UncheckedDowncastExpr cast = UncheckedDowncastExpr.create(ctx, sub, SourceLoc.INVALID,
                TypeLoc.withoutLoc(ExprFixtures.INT));
            assertEquals(sub.sourceRange(), cast.sourceRange());
            assertEquals(sub.loc(), cast.loc());
        }
    }
}
